package com.example.fulfillment.infrastructure.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/**
 * Gateway notification envelope. Fields are deliberately unvalidated:
 * an event that cannot be used is still acknowledged.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PaymentWebhookRequest(
        String type,
        String event,
        PaymentObject object
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PaymentObject(
            String id,
            String status,
            Map<String, Object> metadata
    ) {}
}
