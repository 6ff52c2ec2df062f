package com.example.fulfillment.application.dto;

import com.example.fulfillment.domain.model.Order;
import com.example.fulfillment.domain.model.OrderExtension;
import com.example.fulfillment.domain.model.PaymentAttempt;
import com.example.fulfillment.domain.model.ShipmentRequest;

import java.time.Instant;
import java.util.List;

/**
 * Read model of an order for the front-end and operators.
 */
public record OrderStatusView(
        String orderId,
        String status,
        String fulfillmentKind,
        long totalAmount,
        long paidAmount,
        long outstandingAmount,
        String currency,
        String trackingNumber,
        String deliveryAddress,
        String pickupPointCode,
        List<PaymentView> payments,
        ShipmentView shipment,
        Instant createdAt,
        Instant statusChangedAt
) {
    public static OrderStatusView from(Order order, List<PaymentAttempt> attempts,
                                       ShipmentRequest shipment, int prepayPercent) {
        long total = order.getTotalAmount().getMinorUnits();
        long paid = order.paidAmount(prepayPercent).getMinorUnits();
        return new OrderStatusView(
                order.getOrderId().getValue(),
                order.getStatus().name(),
                order.getFulfillmentKind().name(),
                total,
                paid,
                total - paid,
                order.getTotalAmount().getCurrency(),
                order.getTrackingNumber(),
                order.getDeliveryAddress(),
                order.getExtension().getString(OrderExtension.PICKUP_POINT_CODE).orElse(null),
                attempts.stream().map(PaymentView::from).toList(),
                shipment != null ? ShipmentView.from(shipment, order.getTrackingNumber()) : null,
                order.getCreatedAt(),
                order.getStatusChangedAt());
    }
}
