package com.example.fulfillment.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Flow-specific data attached to an order. Stored as one unstructured
 * column and always read-modify-written as a whole.
 * <p>
 * Each key has a single writer: checkout writes the delivery keys, the
 * payment path writes the payment keys and the shipment path writes the
 * carrier keys.
 */
public final class OrderExtension {

    public static final String PICKUP_POINT_CODE = "pickup_point_code";
    public static final String POSTAL_CODE = "postal_code";
    public static final String DELIVERY_COST = "delivery_cost";
    public static final String DELIVERY_PERIOD = "delivery_period";
    public static final String GIFT_MESSAGE = "gift_message";

    public static final String PENDING_PAYMENTS = "pending_payments";
    public static final String PAYMENT_ID = "payment_id";
    public static final String PREPAY_PAYMENT_ID = "prepay_payment_id";

    public static final String CARRIER_ID = "carrier_id";

    private final Map<String, Object> values;

    private OrderExtension(Map<String, Object> values) {
        this.values = values;
    }

    public static OrderExtension empty() {
        return new OrderExtension(new LinkedHashMap<>());
    }

    /**
     * Creates a detached, mutable copy of the given map.
     */
    public static OrderExtension copyOf(Map<String, Object> values) {
        return new OrderExtension(values == null ? new LinkedHashMap<>() : deepCopy(values));
    }

    public Optional<String> getString(String key) {
        Object value = values.get(key);
        return value == null ? Optional.empty() : Optional.of(String.valueOf(value));
    }

    public OrderExtension put(String key, Object value) {
        if (value == null) {
            values.remove(key);
        } else {
            values.put(key, value);
        }
        return this;
    }

    /**
     * Gateway ids of outstanding attempts, keyed by payment kind wire value.
     */
    public Map<String, String> pendingPayments() {
        Object raw = values.get(PENDING_PAYMENTS);
        Map<String, String> result = new LinkedHashMap<>();
        if (raw instanceof Map<?, ?> map) {
            map.forEach((k, v) -> result.put(String.valueOf(k), String.valueOf(v)));
        }
        return result;
    }

    public OrderExtension putPendingPayment(PaymentKind kind, String gatewayId) {
        Map<String, String> pending = pendingPayments();
        pending.put(kind.wireValue(), gatewayId);
        values.put(PENDING_PAYMENTS, pending);
        return this;
    }

    public OrderExtension removePendingPayment(PaymentKind kind) {
        Map<String, String> pending = pendingPayments();
        pending.remove(kind.wireValue());
        if (pending.isEmpty()) {
            values.remove(PENDING_PAYMENTS);
        } else {
            values.put(PENDING_PAYMENTS, pending);
        }
        return this;
    }

    /**
     * Whether the given gateway id is already recorded as a settled payment.
     */
    public boolean isRecordedPayment(String gatewayId) {
        return gatewayId != null
                && (gatewayId.equals(values.get(PAYMENT_ID)) || gatewayId.equals(values.get(PREPAY_PAYMENT_ID)));
    }

    /**
     * Returns a fresh map suitable for handing back to persistence.
     */
    public Map<String, Object> asMap() {
        return deepCopy(values);
    }

    public Map<String, Object> view() {
        return Collections.unmodifiableMap(values);
    }

    private static Map<String, Object> deepCopy(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (value instanceof Map<?, ?> nested) {
                copy.put(key, new LinkedHashMap<>(nested));
            } else {
                copy.put(key, value);
            }
        });
        return copy;
    }

    @Override
    public String toString() {
        return "OrderExtension" + values;
    }
}
