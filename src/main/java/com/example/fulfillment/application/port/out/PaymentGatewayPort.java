package com.example.fulfillment.application.port.out;

import com.example.fulfillment.domain.model.CustomerProfile;
import com.example.fulfillment.domain.model.Money;
import com.example.fulfillment.domain.model.OrderId;
import com.example.fulfillment.domain.model.PaymentKind;

import java.util.concurrent.CompletableFuture;

/**
 * Outbound port for the payment gateway.
 * <p>
 * Futures complete exceptionally with
 * {@link com.example.fulfillment.application.exception.GatewayException}.
 * Creation is not idempotent: callers dedupe against their own pending
 * attempts before calling it.
 */
public interface PaymentGatewayPort {

    /**
     * Creates a payment intent the customer confirms on the gateway page.
     *
     * @param request what to charge and for which order
     * @return future containing the gateway id and the confirmation URL
     */
    CompletableFuture<PaymentIntent> createIntent(PaymentIntentRequest request);

    /**
     * Reads the current status of an intent. Read-only, safe to retry.
     *
     * @param gatewayId id issued by {@link #createIntent}
     * @return future containing the gateway-side status
     */
    CompletableFuture<GatewayPaymentStatus> queryStatus(String gatewayId);

    record PaymentIntentRequest(
            OrderId orderId,
            PaymentKind kind,
            Money amount,
            String description,
            CustomerProfile customer
    ) {}

    record PaymentIntent(
            String gatewayId,
            String confirmationUrl,
            GatewayPaymentStatus status
    ) {}

    enum GatewayPaymentStatus {
        PENDING,
        SUCCEEDED,
        FAILED
    }
}
