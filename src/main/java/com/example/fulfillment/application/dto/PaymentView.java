package com.example.fulfillment.application.dto;

import com.example.fulfillment.domain.model.PaymentAttempt;

import java.time.Instant;

public record PaymentView(
        String gatewayId,
        String kind,
        long amount,
        String status,
        Instant createdAt
) {
    public static PaymentView from(PaymentAttempt attempt) {
        return new PaymentView(
                attempt.getGatewayId(),
                attempt.getKind().wireValue(),
                attempt.getAmount().getMinorUnits(),
                attempt.getStatus().name(),
                attempt.getCreatedAt());
    }
}
