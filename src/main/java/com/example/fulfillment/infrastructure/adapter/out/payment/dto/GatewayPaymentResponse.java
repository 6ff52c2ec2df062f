package com.example.fulfillment.infrastructure.adapter.out.payment.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Payment object returned by the gateway on creation and lookup.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GatewayPaymentResponse(
        String id,
        String status,
        Boolean paid,
        Confirmation confirmation,
        Map<String, String> metadata
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Confirmation(
            String type,
            @JsonProperty("confirmation_url") String confirmationUrl
    ) {}
}
