package com.example.fulfillment.application.dto;

import com.example.fulfillment.domain.model.ShipmentRequest;

/**
 * Shipment state as exposed to callers.
 */
public record ShipmentView(
        String orderId,
        String status,
        String carrierId,
        String trackingNumber,
        String lastCarrierStatus
) {
    public static ShipmentView from(ShipmentRequest request, String trackingNumber) {
        return new ShipmentView(
                request.getOrderId().getValue(),
                request.getStatus().name(),
                request.getCarrierId(),
                trackingNumber,
                request.getLastPolledStatus());
    }
}
