package com.example.fulfillment.infrastructure.outbox;

/**
 * Serialized body of a notification outbox event.
 */
public record NotificationPayload(long recipient, String text) {
}
