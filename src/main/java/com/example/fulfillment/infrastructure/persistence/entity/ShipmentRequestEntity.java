package com.example.fulfillment.infrastructure.persistence.entity;

import com.example.fulfillment.domain.model.ShipmentRequestStatus;
import jakarta.persistence.*;

import java.time.Instant;

/**
 * Carrier shipment request. The order id is the primary key, so at most one
 * row can exist per order.
 */
@Entity
@Table(name = "shipment_requests")
public class ShipmentRequestEntity {

    @Id
    @Column(name = "order_id", length = 36)
    private String orderId;

    @Column(name = "status", length = 16, nullable = false)
    @Enumerated(EnumType.STRING)
    private ShipmentRequestStatus status = ShipmentRequestStatus.PENDING;

    @Column(name = "carrier_id", length = 64)
    private String carrierId;

    @Column(name = "last_polled_status", length = 64)
    private String lastPolledStatus;

    @Column(name = "tracking_terminal", nullable = false)
    private boolean trackingTerminal;

    @Column(name = "raw_response", columnDefinition = "TEXT")
    private String rawResponse;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    @Column(name = "attempt_count", nullable = false)
    private int attemptCount;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public static ShipmentRequestEntity claim(String orderId) {
        ShipmentRequestEntity entity = new ShipmentRequestEntity();
        entity.orderId = orderId;
        entity.status = ShipmentRequestStatus.PENDING;
        entity.attemptCount = 1;
        return entity;
    }

    public String getOrderId() {
        return orderId;
    }

    public ShipmentRequestStatus getStatus() {
        return status;
    }

    public String getCarrierId() {
        return carrierId;
    }

    public String getLastPolledStatus() {
        return lastPolledStatus;
    }

    public void setLastPolledStatus(String lastPolledStatus) {
        this.lastPolledStatus = lastPolledStatus;
    }

    public boolean isTrackingTerminal() {
        return trackingTerminal;
    }

    public void setTrackingTerminal(boolean trackingTerminal) {
        this.trackingTerminal = trackingTerminal;
    }

    public String getRawResponse() {
        return rawResponse;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public int getAttemptCount() {
        return attemptCount;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void reclaim() {
        this.status = ShipmentRequestStatus.PENDING;
        this.errorMessage = null;
        this.attemptCount++;
    }

    public void markAccepted(String carrierId, String rawResponse) {
        this.status = ShipmentRequestStatus.ACCEPTED;
        this.carrierId = carrierId;
        this.rawResponse = rawResponse;
        this.errorMessage = null;
    }

    public void markFailed(String error) {
        this.status = ShipmentRequestStatus.FAILED;
        this.errorMessage = error != null && error.length() > 1000 ? error.substring(0, 1000) : error;
    }
}
