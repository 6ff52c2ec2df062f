package com.example.fulfillment.infrastructure.adapter.out.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Body of {@code POST /v3/payments}.
 */
public record GatewayPaymentRequest(
        Amount amount,
        boolean capture,
        Confirmation confirmation,
        String description,
        Map<String, String> metadata,
        Receipt receipt
) {
    public record Amount(String value, String currency) {}

    public record Confirmation(
            String type,
            @JsonProperty("return_url") String returnUrl
    ) {}

    public record Receipt(Customer customer, List<Item> items) {}

    public record Customer(
            @JsonProperty("full_name") String fullName,
            String email,
            String phone
    ) {}

    public record Item(
            String description,
            String quantity,
            Amount amount,
            @JsonProperty("vat_code") int vatCode,
            @JsonProperty("payment_mode") String paymentMode,
            @JsonProperty("payment_subject") String paymentSubject
    ) {}
}
