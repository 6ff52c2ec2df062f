package com.example.fulfillment.application.exception;

public class GatewayException extends ExternalServiceException {

    public static final String SERVICE_NAME = "payment-gateway";

    public GatewayException(String message) {
        super(SERVICE_NAME, message);
    }

    public GatewayException(String message, Throwable cause) {
        super(SERVICE_NAME, message, cause);
    }
}
