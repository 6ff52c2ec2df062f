package com.example.fulfillment.infrastructure.persistence.entity;

import com.example.fulfillment.domain.model.PaymentAttemptStatus;
import com.example.fulfillment.domain.model.PaymentKind;
import jakarta.persistence.*;

import java.time.Instant;

/**
 * One payment intent created at the gateway, keyed by the gateway-issued id.
 */
@Entity
@Table(name = "payment_attempts", indexes = {
    @Index(name = "idx_payment_attempts_order", columnList = "order_id"),
    @Index(name = "idx_payment_attempts_status", columnList = "status, kind")
})
public class PaymentAttemptEntity {

    @Id
    @Column(name = "gateway_id", length = 64)
    private String gatewayId;

    @Column(name = "order_id", length = 36, nullable = false)
    private String orderId;

    @Column(name = "kind", length = 16, nullable = false)
    @Enumerated(EnumType.STRING)
    private PaymentKind kind;

    @Column(name = "amount", nullable = false)
    private Long amount;

    @Column(name = "currency", length = 3, nullable = false)
    private String currency;

    @Column(name = "status", length = 16, nullable = false)
    @Enumerated(EnumType.STRING)
    private PaymentAttemptStatus status = PaymentAttemptStatus.PENDING;

    @Column(name = "confirmation_url", length = 1000)
    private String confirmationUrl;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public String getGatewayId() {
        return gatewayId;
    }

    public void setGatewayId(String gatewayId) {
        this.gatewayId = gatewayId;
    }

    public String getOrderId() {
        return orderId;
    }

    public void setOrderId(String orderId) {
        this.orderId = orderId;
    }

    public PaymentKind getKind() {
        return kind;
    }

    public void setKind(PaymentKind kind) {
        this.kind = kind;
    }

    public Long getAmount() {
        return amount;
    }

    public void setAmount(Long amount) {
        this.amount = amount;
    }

    public String getCurrency() {
        return currency;
    }

    public void setCurrency(String currency) {
        this.currency = currency;
    }

    public PaymentAttemptStatus getStatus() {
        return status;
    }

    public String getConfirmationUrl() {
        return confirmationUrl;
    }

    public void setConfirmationUrl(String confirmationUrl) {
        this.confirmationUrl = confirmationUrl;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void markSucceeded() {
        this.status = PaymentAttemptStatus.SUCCEEDED;
    }

    public void markFailed() {
        this.status = PaymentAttemptStatus.FAILED;
    }

    public void markExpired() {
        this.status = PaymentAttemptStatus.EXPIRED;
    }
}
