package com.example.fulfillment.domain.model;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Value Object identifying an order. Also serves as the business key for
 * carrier shipment creation.
 */
public final class OrderId {

    private final String value;

    private OrderId(String value) {
        this.value = value;
    }

    /**
     * Parses an OrderId from its canonical UUID string.
     *
     * @param value UUID string
     * @return OrderId instance
     * @throws IllegalArgumentException if value is null or not a valid UUID
     */
    public static OrderId of(String value) {
        Objects.requireNonNull(value, "OrderId value cannot be null");
        try {
            return new OrderId(UUID.fromString(value.trim()).toString());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid OrderId format: " + value, e);
        }
    }

    /**
     * Lenient variant of {@link #of(String)} for untrusted input such as
     * gateway callback metadata.
     */
    public static Optional<OrderId> tryParse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(of(value));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public static OrderId generate() {
        return new OrderId(UUID.randomUUID().toString());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OrderId orderId = (OrderId) o;
        return value.equals(orderId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
