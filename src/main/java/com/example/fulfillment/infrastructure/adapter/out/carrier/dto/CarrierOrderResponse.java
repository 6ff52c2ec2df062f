package com.example.fulfillment.infrastructure.adapter.out.carrier.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Carrier order envelope, returned by creation and lookup alike.
 * Creation fills only {@code entity.uuid} and {@code requests}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CarrierOrderResponse(
        Entity entity,
        List<Request> requests
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Entity(
            String uuid,
            String number,
            @JsonProperty("cdek_number") String carrierNumber,
            List<Status> statuses
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Status(
            String code,
            String name,
            @JsonProperty("date_time") String dateTime
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Request(
            String type,
            String state,
            List<Problem> errors
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Problem(String code, String message) {}
}
