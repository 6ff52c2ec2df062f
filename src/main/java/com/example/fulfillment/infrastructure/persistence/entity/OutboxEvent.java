package com.example.fulfillment.infrastructure.persistence.entity;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Notification intent recorded in the same transaction as the state change
 * that caused it, and dispatched later by the outbox poller.
 */
@Entity
@Table(name = "outbox_events", indexes = {
    @Index(name = "idx_outbox_status", columnList = "status"),
    @Index(name = "idx_outbox_created_at", columnList = "created_at")
})
public class OutboxEvent {

    public static final String TYPE_NOTIFICATION = "Notification";

    @Id
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "aggregate_type", length = 64, nullable = false)
    private String aggregateType;

    @Column(name = "aggregate_id", length = 64, nullable = false)
    private String aggregateId;

    @Column(name = "event_type", length = 64, nullable = false)
    private String eventType;

    @Column(name = "payload", columnDefinition = "TEXT")
    private String payload;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "processed_at")
    private Instant processedAt;

    @Column(name = "retry_count")
    private Integer retryCount = 0;

    @Column(name = "status", length = 32)
    @Enumerated(EnumType.STRING)
    private OutboxEventStatus status = OutboxEventStatus.PENDING;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    protected OutboxEvent() {
    }

    /**
     * Creates a pending notification event.
     *
     * @param aggregateType "Order" for order-scoped messages
     * @param aggregateId   id the message refers to
     * @param payload       serialized recipient and text
     */
    public static OutboxEvent notification(String aggregateType, String aggregateId, String payload) {
        OutboxEvent event = new OutboxEvent();
        event.id = UUID.randomUUID().toString();
        event.aggregateType = aggregateType;
        event.aggregateId = aggregateId;
        event.eventType = TYPE_NOTIFICATION;
        event.payload = payload;
        return event;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }

    public String getId() {
        return id;
    }

    public String getAggregateType() {
        return aggregateType;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public String getEventType() {
        return eventType;
    }

    public String getPayload() {
        return payload;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getProcessedAt() {
        return processedAt;
    }

    public Integer getRetryCount() {
        return retryCount;
    }

    public OutboxEventStatus getStatus() {
        return status;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void markProcessing() {
        this.status = OutboxEventStatus.PROCESSING;
    }

    public void markProcessed() {
        this.status = OutboxEventStatus.PROCESSED;
        this.processedAt = Instant.now();
    }

    public void markFailed(String error) {
        this.status = OutboxEventStatus.FAILED;
        this.errorMessage = error != null && error.length() > 1000 ? error.substring(0, 1000) : error;
        this.retryCount++;
    }

    public void markRetrying() {
        this.status = OutboxEventStatus.PENDING;
    }
}
