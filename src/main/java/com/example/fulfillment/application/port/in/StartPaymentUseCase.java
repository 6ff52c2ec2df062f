package com.example.fulfillment.application.port.in;

import com.example.fulfillment.application.dto.PaymentIntentView;
import com.example.fulfillment.domain.model.OrderId;
import com.example.fulfillment.domain.model.PaymentKind;

/**
 * Inbound port for user-initiated payments.
 */
public interface StartPaymentUseCase {

    /**
     * Creates a payment intent for the given kind, or returns the outstanding
     * one if an attempt of that kind is still pending.
     *
     * @param orderId order to pay for
     * @param kind    full, prepay or remainder
     * @return confirmation data for the customer
     */
    PaymentIntentView startPayment(OrderId orderId, PaymentKind kind);
}
