package com.example.fulfillment.application.port.in;

import com.example.fulfillment.application.dto.OrderStatusView;
import com.example.fulfillment.domain.model.OrderId;

/**
 * Manual steps performed by an operator.
 */
public interface OperatorActionsUseCase {

    /**
     * PAID_FULL to ASSEMBLED.
     */
    OrderStatusView assemble(OrderId orderId);

    /**
     * SHIPPED to ARCHIVED.
     */
    OrderStatusView archive(OrderId orderId);

    /**
     * Replaces the tracking number of a shipped order and tells the owner.
     */
    OrderStatusView overrideTracking(OrderId orderId, String trackingNumber);
}
