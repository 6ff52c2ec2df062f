package com.example.fulfillment.infrastructure.exception;

/**
 * Upstream rejected the call (4xx) or answered with a body that cannot be used.
 */
public class NonRetryableServiceException extends UpstreamServiceException {

    public NonRetryableServiceException(String serviceName, int statusCode, String message) {
        super(serviceName, statusCode, message, null);
    }

    private NonRetryableServiceException(String serviceName, String message, Throwable cause) {
        super(serviceName, 200, message, cause);
    }

    /** A 2xx answer whose content is missing or unreadable. */
    public static NonRetryableServiceException unusableAnswer(String serviceName, String message) {
        return new NonRetryableServiceException(serviceName, message, null);
    }

    public static NonRetryableServiceException unusableAnswer(String serviceName, String message, Throwable cause) {
        return new NonRetryableServiceException(serviceName, message, cause);
    }
}
