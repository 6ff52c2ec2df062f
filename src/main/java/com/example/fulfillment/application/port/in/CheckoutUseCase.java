package com.example.fulfillment.application.port.in;

import com.example.fulfillment.application.dto.CheckoutCommand;
import com.example.fulfillment.application.dto.OrderStatusView;

/**
 * Inbound port for checkout confirmation.
 */
public interface CheckoutUseCase {

    /**
     * Creates a NEW order and records the owner profile.
     *
     * @param command checkout data collected by the storefront
     * @return the created order
     */
    OrderStatusView checkout(CheckoutCommand command);
}
