package com.example.fulfillment.application.dto;

import com.example.fulfillment.domain.exception.InvalidOrderException;

/**
 * New pickup point chosen by the owner for an order that has not shipped yet.
 */
public record DeliveryChangeCommand(
        String deliveryAddress,
        String pickupPointCode,
        String postalCode
) {
    public DeliveryChangeCommand {
        if (pickupPointCode == null || pickupPointCode.isBlank()) {
            throw new InvalidOrderException("Pickup point code is required");
        }
    }
}
