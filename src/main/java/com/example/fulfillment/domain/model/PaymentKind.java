package com.example.fulfillment.domain.model;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Declared purpose of a payment attempt. Each kind knows which order statuses
 * it may settle from and which status a confirmed payment moves the order to.
 */
public enum PaymentKind {

    FULL("full", EnumSet.of(OrderStatus.PENDING_PAYMENT), OrderStatus.PAID_FULL),
    PREPAY("prepay", EnumSet.of(OrderStatus.PENDING_PAYMENT), OrderStatus.PAID_PARTIALLY),
    REMAINDER("remainder", EnumSet.of(OrderStatus.PAID_PARTIALLY), OrderStatus.PAID_FULL);

    private final String wireValue;
    private final Set<OrderStatus> settlesFrom;
    private final OrderStatus settlesTo;

    PaymentKind(String wireValue, Set<OrderStatus> settlesFrom, OrderStatus settlesTo) {
        this.wireValue = wireValue;
        this.settlesFrom = settlesFrom;
        this.settlesTo = settlesTo;
    }

    /**
     * Parses the value carried in gateway metadata. Accepts the short
     * forms {@code pre} and {@code rem} as well.
     */
    public static Optional<PaymentKind> fromWireValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "pre" -> Optional.of(PREPAY);
            case "rem" -> Optional.of(REMAINDER);
            default -> Arrays.stream(values())
                    .filter(kind -> kind.wireValue.equals(normalized) || kind.name().equalsIgnoreCase(normalized))
                    .findFirst();
        };
    }

    public String wireValue() {
        return wireValue;
    }

    public Set<OrderStatus> settlesFrom() {
        return EnumSet.copyOf(settlesFrom);
    }

    public OrderStatus settlesTo() {
        return settlesTo;
    }

    /**
     * Statuses from which a new attempt of this kind may be started.
     */
    public Set<OrderStatus> startableFrom() {
        return this == REMAINDER
                ? EnumSet.of(OrderStatus.PAID_PARTIALLY)
                : EnumSet.of(OrderStatus.NEW, OrderStatus.PENDING_PAYMENT);
    }

    public boolean appliesTo(FulfillmentKind fulfillmentKind) {
        return this == FULL
                ? fulfillmentKind == FulfillmentKind.FULL
                : fulfillmentKind == FulfillmentKind.PREPAY_REMAINDER;
    }
}
