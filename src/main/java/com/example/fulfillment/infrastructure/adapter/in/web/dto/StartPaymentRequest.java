package com.example.fulfillment.infrastructure.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * @param kind full, prepay or remainder
 */
public record StartPaymentRequest(
        @NotBlank(message = "Payment kind is required")
        String kind
) {}
