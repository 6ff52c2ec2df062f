package com.example.fulfillment.infrastructure.exception;

/**
 * Upstream answered 5xx. Only status queries are repeated on it, never creations.
 */
public class RetryableServiceException extends UpstreamServiceException {

    public RetryableServiceException(String serviceName, int statusCode, String message) {
        super(serviceName, statusCode, message, null);
    }
}
