package com.example.fulfillment.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of an order together with the fixed table of allowed
 * transitions. The table is acyclic, so every observed status sequence
 * only moves forward.
 */
public enum OrderStatus {

    /**
     * Checkout confirmed, no payment requested yet.
     */
    NEW,

    /**
     * At least one payment attempt has been created at the gateway.
     */
    PENDING_PAYMENT,

    /**
     * Prepayment received, remainder outstanding.
     */
    PAID_PARTIALLY,

    /**
     * Total amount received.
     */
    PAID_FULL,

    /**
     * Packed by an operator and ready to hand over to the carrier.
     */
    ASSEMBLED,

    /**
     * Accepted by the carrier.
     */
    SHIPPED,

    /**
     * Closed by an operator after delivery.
     */
    ARCHIVED,

    /**
     * Closed because no payment arrived in time.
     */
    ABANDONED;

    public Set<OrderStatus> allowedTargets() {
        return switch (this) {
            case NEW -> EnumSet.of(PENDING_PAYMENT, ABANDONED);
            case PENDING_PAYMENT -> EnumSet.of(PAID_PARTIALLY, PAID_FULL, ABANDONED);
            case PAID_PARTIALLY -> EnumSet.of(PAID_FULL);
            case PAID_FULL -> EnumSet.of(ASSEMBLED);
            case ASSEMBLED -> EnumSet.of(SHIPPED);
            case SHIPPED -> EnumSet.of(ARCHIVED);
            case ARCHIVED, ABANDONED -> EnumSet.noneOf(OrderStatus.class);
        };
    }

    public boolean canTransitionTo(OrderStatus target) {
        return allowedTargets().contains(target);
    }

    public boolean isTerminal() {
        return allowedTargets().isEmpty();
    }

    /**
     * True once the full amount has been collected. Assembly requires a full
     * payment, so every later status is settled as well.
     */
    public boolean isPaymentSettled() {
        return switch (this) {
            case PAID_FULL, ASSEMBLED, SHIPPED, ARCHIVED -> true;
            case NEW, PENDING_PAYMENT, PAID_PARTIALLY, ABANDONED -> false;
        };
    }
}
