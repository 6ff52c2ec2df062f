package com.example.fulfillment.infrastructure.adapter.out.carrier.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Body of {@code POST /v2/orders}: a store-to-pickup-point parcel.
 */
public record CarrierOrderRequest(
        int type,
        String number,
        @JsonProperty("tariff_code") int tariffCode,
        String comment,
        @JsonProperty("shipment_point") String shipmentPoint,
        @JsonProperty("delivery_recipient_cost") Payment deliveryRecipientCost,
        @JsonProperty("to_location") Location toLocation,
        Recipient recipient,
        List<Parcel> packages,
        List<Service> services
) {
    public record Payment(long value) {}

    public record Location(
            String code,
            String address,
            @JsonProperty("postal_code") String postalCode
    ) {}

    public record Recipient(String name, List<Phone> phones) {}

    public record Phone(String number) {}

    public record Parcel(
            String number,
            int weight,
            int length,
            int width,
            int height,
            List<Item> items
    ) {}

    public record Item(
            String name,
            @JsonProperty("ware_key") String wareKey,
            Payment payment,
            long cost,
            int weight,
            int amount
    ) {}

    public record Service(String code, String parameter) {}
}
