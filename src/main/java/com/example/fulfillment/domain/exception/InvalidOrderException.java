package com.example.fulfillment.domain.exception;

/**
 * Malformed input from a user or a callback, rejected before it reaches the
 * state machine.
 */
public class InvalidOrderException extends DomainException {

    public InvalidOrderException(String message) {
        super(message);
    }
}
