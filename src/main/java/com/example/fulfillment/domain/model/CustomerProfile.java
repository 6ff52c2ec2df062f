package com.example.fulfillment.domain.model;

import java.util.Objects;

/**
 * Owner of an order as known to the storefront. The chat id doubles as the
 * notification recipient.
 */
public record CustomerProfile(long chatId, String fullName, String phone, String email) {

    public CustomerProfile {
        Objects.requireNonNull(fullName, "Full name cannot be null");
        Objects.requireNonNull(phone, "Phone cannot be null");
    }
}
