package com.example.fulfillment.application.dto;

/**
 * A message to deliver as part of a state change. The recipient is resolved
 * from the order when the change commits.
 */
public record Notice(Audience audience, String text) {

    public enum Audience {
        OWNER,
        OPERATOR
    }

    public static Notice owner(String text) {
        return new Notice(Audience.OWNER, text);
    }

    public static Notice operator(String text) {
        return new Notice(Audience.OPERATOR, text);
    }
}
