package com.example.fulfillment.domain.exception;

import com.example.fulfillment.domain.model.OrderStatus;

/**
 * Thrown when code asks for an edge that is not in the transition table.
 */
public class IllegalTransitionException extends DomainException {

    private final OrderStatus from;
    private final OrderStatus to;

    public IllegalTransitionException(OrderStatus from, OrderStatus to) {
        super("Transition " + from + " -> " + to + " is not allowed");
        this.from = from;
        this.to = to;
    }

    public OrderStatus getFrom() {
        return from;
    }

    public OrderStatus getTo() {
        return to;
    }
}
