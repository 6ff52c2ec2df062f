package com.example.fulfillment.infrastructure.persistence.entity;

/**
 * Dispatch status of outbox events.
 */
public enum OutboxEventStatus {
    PENDING,
    PROCESSING,
    PROCESSED,
    FAILED
}
