package com.example.fulfillment.application.port.in;

import com.example.fulfillment.application.dto.PaymentWebhookEvent;

/**
 * Inbound port for asynchronous gateway callbacks. Never throws: every
 * outcome is acknowledged so the gateway does not redeliver.
 */
public interface HandlePaymentWebhookUseCase {

    WebhookOutcome handle(PaymentWebhookEvent event);

    enum WebhookOutcome {
        /**
         * The event changed stored state: the order moved to a paid status,
         * or a pending attempt was marked failed.
         */
        APPLIED,
        /**
         * Replay of an event that was already applied.
         */
        DUPLICATE,
        /**
         * Structurally valid but unusable, or not relevant to the order's current status.
         */
        IGNORED,
        /**
         * Internal failure; logged and raised to an operator.
         */
        FAILED
    }
}
