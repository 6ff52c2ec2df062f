package com.example.fulfillment.application.exception;

public class CarrierException extends ExternalServiceException {

    public static final String SERVICE_NAME = "carrier";

    public CarrierException(String message) {
        super(SERVICE_NAME, message);
    }

    public CarrierException(String message, Throwable cause) {
        super(SERVICE_NAME, message, cause);
    }
}
