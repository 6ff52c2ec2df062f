package com.example.fulfillment.infrastructure.persistence.entity;

import com.example.fulfillment.domain.model.FulfillmentKind;
import com.example.fulfillment.domain.model.OrderStatus;
import com.example.fulfillment.infrastructure.persistence.converter.ExtensionMapConverter;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JPA Entity for Order persistence. Status is a plain string column so the
 * compare-and-set stays a single conditional UPDATE.
 */
@Entity
@Table(name = "orders", indexes = {
    @Index(name = "idx_orders_status_changed", columnList = "status, status_changed_at")
})
public class OrderEntity {

    @Id
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "owner_chat_id", nullable = false)
    private Long ownerChatId;

    @Column(name = "total_amount", nullable = false)
    private Long totalAmount;

    @Column(name = "currency", length = 3, nullable = false)
    private String currency;

    @Column(name = "fulfillment_kind", length = 32, nullable = false)
    @Enumerated(EnumType.STRING)
    private FulfillmentKind fulfillmentKind;

    @Column(name = "status", length = 32, nullable = false)
    @Enumerated(EnumType.STRING)
    private OrderStatus status;

    @Column(name = "delivery_address", length = 500)
    private String deliveryAddress;

    @Column(name = "tracking_number", length = 64)
    private String trackingNumber;

    @Convert(converter = ExtensionMapConverter.class)
    @Column(name = "extension", columnDefinition = "TEXT")
    private Map<String, Object> extension = new LinkedHashMap<>();

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "status_changed_at", nullable = false)
    private Instant statusChangedAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (statusChangedAt == null) {
            statusChangedAt = createdAt;
        }
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public Long getOwnerChatId() {
        return ownerChatId;
    }

    public void setOwnerChatId(Long ownerChatId) {
        this.ownerChatId = ownerChatId;
    }

    public Long getTotalAmount() {
        return totalAmount;
    }

    public void setTotalAmount(Long totalAmount) {
        this.totalAmount = totalAmount;
    }

    public String getCurrency() {
        return currency;
    }

    public void setCurrency(String currency) {
        this.currency = currency;
    }

    public FulfillmentKind getFulfillmentKind() {
        return fulfillmentKind;
    }

    public void setFulfillmentKind(FulfillmentKind fulfillmentKind) {
        this.fulfillmentKind = fulfillmentKind;
    }

    public OrderStatus getStatus() {
        return status;
    }

    public void setStatus(OrderStatus status) {
        this.status = status;
    }

    public String getDeliveryAddress() {
        return deliveryAddress;
    }

    public void setDeliveryAddress(String deliveryAddress) {
        this.deliveryAddress = deliveryAddress;
    }

    public String getTrackingNumber() {
        return trackingNumber;
    }

    public void setTrackingNumber(String trackingNumber) {
        this.trackingNumber = trackingNumber;
    }

    public Map<String, Object> getExtension() {
        return extension;
    }

    /**
     * Replaces the whole map; callers pass a fresh instance so the change is
     * picked up by dirty checking.
     */
    public void setExtension(Map<String, Object> extension) {
        this.extension = extension;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getStatusChangedAt() {
        return statusChangedAt;
    }

    public void setStatusChangedAt(Instant statusChangedAt) {
        this.statusChangedAt = statusChangedAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
