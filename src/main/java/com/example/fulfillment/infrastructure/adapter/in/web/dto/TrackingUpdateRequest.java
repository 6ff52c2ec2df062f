package com.example.fulfillment.infrastructure.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record TrackingUpdateRequest(
        @NotBlank(message = "Tracking number is required")
        @Size(max = 64)
        String trackingNumber
) {}
