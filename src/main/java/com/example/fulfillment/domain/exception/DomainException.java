package com.example.fulfillment.domain.exception;

/**
 * Base class for violations of order lifecycle rules.
 */
public abstract class DomainException extends RuntimeException {

    protected DomainException(String message) {
        super(message);
    }

    protected DomainException(String message, Throwable cause) {
        super(message, cause);
    }
}
