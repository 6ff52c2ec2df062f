package com.example.fulfillment.application.port.out;

import com.example.fulfillment.domain.model.CustomerProfile;
import com.example.fulfillment.domain.model.Money;
import com.example.fulfillment.domain.model.OrderId;

import java.util.EnumSet;
import java.util.concurrent.CompletableFuture;

/**
 * Outbound port for the shipping carrier.
 * <p>
 * Futures complete exceptionally with
 * {@link com.example.fulfillment.application.exception.CarrierException}.
 */
public interface CarrierPort {

    /**
     * Registers a shipment with the carrier. Not retried: a repeated call may
     * produce a second physical shipment.
     *
     * @param order snapshot of everything the carrier needs, keyed by order id
     * @return future containing the carrier-issued id
     */
    CompletableFuture<CarrierShipment> createShipment(ShipmentOrder order);

    /**
     * Reads tracking number and status of a registered shipment.
     *
     * @param carrierId id returned by {@link #createShipment}
     */
    CompletableFuture<CarrierTracking> getShipment(String carrierId);

    record ShipmentOrder(
            OrderId orderId,
            String number,
            CustomerProfile recipient,
            String pickupPointCode,
            String address,
            String postalCode,
            Money declaredValue
    ) {}

    record CarrierShipment(
            String carrierId,
            String rawResponse
    ) {}

    record CarrierTracking(
            String carrierId,
            String trackingNumber,
            CarrierStatus status,
            String statusDescription
    ) {}

    enum CarrierStatus {
        CREATED,
        ACCEPTED_AT_SENDER_WAREHOUSE,
        IN_TRANSIT,
        OUT_FOR_DELIVERY,
        READY_FOR_PICKUP,
        NOT_DELIVERED,
        DELIVERED,
        RETURNED;

        private static final EnumSet<CarrierStatus> NOTABLE = EnumSet.of(
                ACCEPTED_AT_SENDER_WAREHOUSE, OUT_FOR_DELIVERY, READY_FOR_PICKUP,
                NOT_DELIVERED, DELIVERED, RETURNED);

        /**
         * Statuses the owner is told about.
         */
        public boolean isNotable() {
            return NOTABLE.contains(this);
        }

        /**
         * No further movement is expected; polling stops here.
         */
        public boolean isTerminal() {
            return this == DELIVERED || this == RETURNED;
        }
    }
}
