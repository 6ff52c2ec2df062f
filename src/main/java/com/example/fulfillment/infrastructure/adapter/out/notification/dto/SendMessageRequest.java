package com.example.fulfillment.infrastructure.adapter.out.notification.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SendMessageRequest(
        @JsonProperty("chat_id") long chatId,
        String text,
        @JsonProperty("disable_web_page_preview") boolean disableWebPagePreview
) {
    public static SendMessageRequest of(long chatId, String text) {
        return new SendMessageRequest(chatId, text, true);
    }
}
