package com.example.fulfillment.application.dto;

import com.example.fulfillment.domain.model.PaymentAttempt;

/**
 * Result of starting a payment: where to send the customer.
 *
 * @param reused true when an outstanding attempt of the same kind was returned
 *               instead of creating a new one
 */
public record PaymentIntentView(
        String orderId,
        String gatewayId,
        String kind,
        long amount,
        String currency,
        String confirmationUrl,
        boolean reused
) {
    public static PaymentIntentView from(PaymentAttempt attempt, boolean reused) {
        return new PaymentIntentView(
                attempt.getOrderId().getValue(),
                attempt.getGatewayId(),
                attempt.getKind().wireValue(),
                attempt.getAmount().getMinorUnits(),
                attempt.getAmount().getCurrency(),
                attempt.getConfirmationUrl(),
                reused);
    }
}
