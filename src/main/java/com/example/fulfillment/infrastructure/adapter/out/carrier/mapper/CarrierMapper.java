package com.example.fulfillment.infrastructure.adapter.out.carrier.mapper;

import com.example.fulfillment.application.port.out.CarrierPort.CarrierStatus;
import com.example.fulfillment.application.port.out.CarrierPort.CarrierTracking;
import com.example.fulfillment.application.port.out.CarrierPort.ShipmentOrder;
import com.example.fulfillment.infrastructure.adapter.out.carrier.dto.CarrierOrderRequest;
import com.example.fulfillment.infrastructure.adapter.out.carrier.dto.CarrierOrderRequest.*;
import com.example.fulfillment.infrastructure.adapter.out.carrier.dto.CarrierOrderResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Mapper between carrier port types and carrier DTOs.
 */
@Component
public class CarrierMapper {

    static final int PACKAGE_WEIGHT_G = 750;
    static final int PACKAGE_LENGTH_CM = 26;
    static final int PACKAGE_WIDTH_CM = 19;
    static final int PACKAGE_HEIGHT_CM = 8;

    private static final int TYPE_ONLINE_STORE = 2;
    private static final String DEFAULT_POSTAL_CODE = "000000";

    private final int tariffCode;
    private final String shipmentPoint;
    private final String itemName;

    public CarrierMapper(
            @Value("${services.carrier.tariff-code:136}") int tariffCode,
            @Value("${services.carrier.shipment-point}") String shipmentPoint,
            @Value("${services.carrier.item-name:Gift box}") String itemName) {
        this.tariffCode = tariffCode;
        this.shipmentPoint = shipmentPoint;
        this.itemName = itemName;
    }

    public CarrierOrderRequest toRequest(ShipmentOrder order) {
        // Declared value in whole currency units, rounded up.
        long minor = order.declaredValue().getMinorUnits();
        long declared = minor / 100 + (minor % 100 == 0 ? 0 : 1);

        Item item = new Item(itemName, order.number(), new Payment(0), declared, PACKAGE_WEIGHT_G, 1);
        Parcel parcel = new Parcel(order.number(), PACKAGE_WEIGHT_G,
                PACKAGE_LENGTH_CM, PACKAGE_WIDTH_CM, PACKAGE_HEIGHT_CM, List.of(item));

        return new CarrierOrderRequest(
                TYPE_ONLINE_STORE,
                order.number(),
                tariffCode,
                "Order " + order.orderId().getValue(),
                shipmentPoint,
                new Payment(0),
                new Location(
                        order.pickupPointCode(),
                        order.address(),
                        order.postalCode() != null ? order.postalCode() : DEFAULT_POSTAL_CODE),
                new Recipient(order.recipient().fullName(), List.of(new Phone(normalizePhone(order.recipient().phone())))),
                List.of(parcel),
                List.of(new Service("INSURANCE", String.valueOf(declared))));
    }

    public CarrierTracking toTracking(CarrierOrderResponse response) {
        CarrierOrderResponse.Entity entity = response.entity();
        if (entity == null) {
            return new CarrierTracking(null, null, null, null);
        }
        CarrierOrderResponse.Status current = entity.statuses() == null || entity.statuses().isEmpty()
                ? null
                : entity.statuses().get(0);
        return new CarrierTracking(
                entity.uuid(),
                entity.carrierNumber(),
                current != null ? toStatus(current.code()) : null,
                current != null ? current.name() : null);
    }

    /**
     * Collapses the carrier's status codes onto the statuses the engine acts on.
     * Unknown codes are treated as movement in transit.
     */
    public CarrierStatus toStatus(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        if (normalized.startsWith("RETURN")) {
            return CarrierStatus.RETURNED;
        }
        return switch (normalized) {
            case "CREATED", "ACCEPTED" -> CarrierStatus.CREATED;
            case "RECEIVED_AT_SHIPMENT_WAREHOUSE" -> CarrierStatus.ACCEPTED_AT_SENDER_WAREHOUSE;
            case "TAKEN_BY_COURIER" -> CarrierStatus.OUT_FOR_DELIVERY;
            case "ACCEPTED_AT_PICK_UP_POINT" -> CarrierStatus.READY_FOR_PICKUP;
            case "NOT_DELIVERED" -> CarrierStatus.NOT_DELIVERED;
            case "DELIVERED" -> CarrierStatus.DELIVERED;
            default -> CarrierStatus.IN_TRANSIT;
        };
    }

    private static String normalizePhone(String phone) {
        return phone == null ? null : phone.replaceAll("[^0-9]", "");
    }
}
