package com.example.fulfillment.infrastructure.adapter.out.notification.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SendMessageResponse(
        boolean ok,
        String description
) {}
