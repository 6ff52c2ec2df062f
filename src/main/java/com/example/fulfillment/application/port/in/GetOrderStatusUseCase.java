package com.example.fulfillment.application.port.in;

import com.example.fulfillment.application.dto.OrderStatusView;
import com.example.fulfillment.domain.model.OrderId;

public interface GetOrderStatusUseCase {

    /**
     * @throws com.example.fulfillment.domain.exception.OrderNotFoundException if no such order exists
     */
    OrderStatusView getStatus(OrderId orderId);
}
