package com.example.fulfillment.infrastructure.exception;

/**
 * Failure of an outbound call to the payment gateway, the carrier or the messaging service.
 * Subclasses decide whether Resilience4j may repeat the call.
 */
public abstract class UpstreamServiceException extends RuntimeException {

    private final String serviceName;
    private final int statusCode;

    protected UpstreamServiceException(String serviceName, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.serviceName = serviceName;
        this.statusCode = statusCode;
    }

    public String getServiceName() {
        return serviceName;
    }

    /**
     * HTTP status of the upstream answer, or 0 when no answer was received.
     */
    public int getStatusCode() {
        return statusCode;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + serviceName + " " + statusCode + "]: " + getMessage();
    }
}
