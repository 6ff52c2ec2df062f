package com.example.fulfillment.infrastructure.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record DeliveryChangeRequest(
        @Size(max = 500)
        String deliveryAddress,

        @NotBlank(message = "Pickup point code is required")
        String pickupPointCode,

        String postalCode
) {}
