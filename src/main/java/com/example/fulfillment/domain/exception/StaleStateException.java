package com.example.fulfillment.domain.exception;

import com.example.fulfillment.domain.model.OrderId;
import com.example.fulfillment.domain.model.OrderStatus;

import java.util.Set;

/**
 * Thrown when a compare-and-set on order status finds a status outside the
 * expected set. The caller re-reads the order and decides whether the work
 * is already done.
 */
public class StaleStateException extends DomainException {

    private final OrderId orderId;
    private final Set<OrderStatus> expected;
    private final OrderStatus actual;

    public StaleStateException(OrderId orderId, Set<OrderStatus> expected, OrderStatus actual) {
        super("Order " + orderId + " is " + actual + ", expected one of " + expected);
        this.orderId = orderId;
        this.expected = Set.copyOf(expected);
        this.actual = actual;
    }

    public OrderId getOrderId() {
        return orderId;
    }

    public Set<OrderStatus> getExpected() {
        return expected;
    }

    /**
     * Status observed after the failed update, or null if it could not be read.
     */
    public OrderStatus getActual() {
        return actual;
    }
}
