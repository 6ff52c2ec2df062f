package com.example.fulfillment.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One request to the payment gateway for a specific charge kind. Several
 * attempts may exist per order; at most one of them ever moves the order.
 */
public final class PaymentAttempt {

    private final String gatewayId;
    private final OrderId orderId;
    private final PaymentKind kind;
    private final Money amount;
    private final PaymentAttemptStatus status;
    private final String confirmationUrl;
    private final Instant createdAt;

    private PaymentAttempt(String gatewayId, OrderId orderId, PaymentKind kind, Money amount,
                           PaymentAttemptStatus status, String confirmationUrl, Instant createdAt) {
        this.gatewayId = Objects.requireNonNull(gatewayId, "Gateway id cannot be null");
        this.orderId = Objects.requireNonNull(orderId, "OrderId cannot be null");
        this.kind = Objects.requireNonNull(kind, "Kind cannot be null");
        this.amount = Objects.requireNonNull(amount, "Amount cannot be null");
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        this.confirmationUrl = confirmationUrl;
        this.createdAt = createdAt;
    }

    public static PaymentAttempt reconstitute(String gatewayId, OrderId orderId, PaymentKind kind, Money amount,
                                              PaymentAttemptStatus status, String confirmationUrl,
                                              Instant createdAt) {
        return new PaymentAttempt(gatewayId, orderId, kind, amount, status, confirmationUrl, createdAt);
    }

    public boolean isPending() {
        return status == PaymentAttemptStatus.PENDING;
    }

    public String getGatewayId() {
        return gatewayId;
    }

    public OrderId getOrderId() {
        return orderId;
    }

    public PaymentKind getKind() {
        return kind;
    }

    public Money getAmount() {
        return amount;
    }

    public PaymentAttemptStatus getStatus() {
        return status;
    }

    public String getConfirmationUrl() {
        return confirmationUrl;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public String toString() {
        return "PaymentAttempt{gatewayId=" + gatewayId + ", kind=" + kind + ", status=" + status + '}';
    }
}
