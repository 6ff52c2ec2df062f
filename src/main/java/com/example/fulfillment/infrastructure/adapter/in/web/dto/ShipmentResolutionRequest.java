package com.example.fulfillment.infrastructure.adapter.in.web.dto;

import jakarta.validation.constraints.Size;

/**
 * @param carrierId shipment id found in the carrier account; absent to release the request
 */
public record ShipmentResolutionRequest(
        @Size(max = 64)
        String carrierId
) {}
