package com.example.fulfillment.application.dto;

import com.example.fulfillment.domain.exception.InvalidOrderException;
import com.example.fulfillment.domain.model.FulfillmentKind;

/**
 * Command issued by the storefront when a customer confirms checkout.
 */
public record CheckoutCommand(
        long chatId,
        String fullName,
        String phone,
        String email,
        long totalAmountMinor,
        FulfillmentKind fulfillmentKind,
        String deliveryAddress,
        String pickupPointCode,
        String postalCode,
        Long deliveryCostMinor,
        String deliveryPeriod,
        String giftMessage
) {
    public CheckoutCommand {
        if (chatId == 0) {
            throw new InvalidOrderException("Customer chat id is required");
        }
        if (isBlank(fullName)) {
            throw new InvalidOrderException("Full name is required");
        }
        if (isBlank(phone)) {
            throw new InvalidOrderException("Phone is required");
        }
        if (totalAmountMinor <= 0) {
            throw new InvalidOrderException("Total amount must be positive");
        }
        if (fulfillmentKind == null) {
            throw new InvalidOrderException("Fulfillment kind is required");
        }
        if (isBlank(pickupPointCode)) {
            throw new InvalidOrderException("Pickup point code is required");
        }
        if (deliveryCostMinor != null && deliveryCostMinor < 0) {
            throw new InvalidOrderException("Delivery cost cannot be negative");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
