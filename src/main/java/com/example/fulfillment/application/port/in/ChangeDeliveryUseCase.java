package com.example.fulfillment.application.port.in;

import com.example.fulfillment.application.dto.DeliveryChangeCommand;
import com.example.fulfillment.application.dto.OrderStatusView;
import com.example.fulfillment.domain.model.OrderId;

/**
 * Inbound port for moving an order to another pickup point.
 */
public interface ChangeDeliveryUseCase {

    /**
     * Replaces the delivery address and pickup point while the order is
     * between NEW and ASSEMBLED and no carrier request exists. Operators are told.
     *
     * @throws com.example.fulfillment.domain.exception.StaleStateException if the order is past assembly
     * @throws IllegalStateException if the order was already handed to the carrier
     */
    OrderStatusView changeDelivery(OrderId orderId, DeliveryChangeCommand command);
}
