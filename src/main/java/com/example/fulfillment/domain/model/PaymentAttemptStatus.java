package com.example.fulfillment.domain.model;

/**
 * Last known gateway-side status of a payment attempt.
 */
public enum PaymentAttemptStatus {
    PENDING,
    SUCCEEDED,
    FAILED,
    /**
     * Still pending at the gateway past the payment timeout; no longer queried.
     */
    EXPIRED
}
