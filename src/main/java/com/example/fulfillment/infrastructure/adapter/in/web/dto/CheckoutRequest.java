package com.example.fulfillment.infrastructure.adapter.in.web.dto;

import com.example.fulfillment.domain.model.FulfillmentKind;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for checkout confirmation. Amounts are in minor currency units.
 */
public record CheckoutRequest(
        @NotNull(message = "Chat id is required")
        Long chatId,

        @NotBlank(message = "Full name is required")
        @Size(max = 200)
        String fullName,

        @NotBlank(message = "Phone is required")
        @Size(max = 32)
        String phone,

        @Email(message = "Invalid email")
        String email,

        @NotNull(message = "Total amount is required")
        @Positive(message = "Total amount must be positive")
        Long totalAmount,

        @NotNull(message = "Fulfillment kind is required")
        FulfillmentKind fulfillmentKind,

        @Size(max = 500)
        String deliveryAddress,

        @NotBlank(message = "Pickup point code is required")
        String pickupPointCode,

        String postalCode,

        @PositiveOrZero(message = "Delivery cost cannot be negative")
        Long deliveryCost,

        String deliveryPeriod,

        @Size(max = 500, message = "Gift message is too long")
        String giftMessage
) {}
