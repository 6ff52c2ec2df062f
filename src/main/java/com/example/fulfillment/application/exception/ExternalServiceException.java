package com.example.fulfillment.application.exception;

/**
 * A call to an external collaborator failed, timed out or was rejected by an
 * open circuit. The outcome of a side-effecting call that ends this way is
 * unknown and is never assumed to have succeeded.
 */
public abstract class ExternalServiceException extends RuntimeException {

    private final String serviceName;

    protected ExternalServiceException(String serviceName, String message) {
        super(message);
        this.serviceName = serviceName;
    }

    protected ExternalServiceException(String serviceName, String message, Throwable cause) {
        super(message, cause);
        this.serviceName = serviceName;
    }

    public String getServiceName() {
        return serviceName;
    }
}
