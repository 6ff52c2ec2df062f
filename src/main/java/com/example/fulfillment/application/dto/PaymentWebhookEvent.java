package com.example.fulfillment.application.dto;

/**
 * Gateway callback reduced to the fields the engine acts on. Metadata values
 * are kept raw; the handler decides whether they are usable.
 */
public record PaymentWebhookEvent(
        String event,
        String gatewayId,
        String orderIdMetadata,
        String paymentKindMetadata
) {
    public static final String PAYMENT_SUCCEEDED = "payment.succeeded";
    public static final String PAYMENT_CANCELED = "payment.canceled";

    public boolean isSucceeded() {
        return PAYMENT_SUCCEEDED.equals(event);
    }

    public boolean isCanceled() {
        return PAYMENT_CANCELED.equals(event);
    }
}
