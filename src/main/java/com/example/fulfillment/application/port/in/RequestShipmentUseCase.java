package com.example.fulfillment.application.port.in;

import com.example.fulfillment.application.dto.ShipmentView;
import com.example.fulfillment.domain.model.OrderId;

/**
 * Inbound port for handing an assembled order over to the carrier.
 */
public interface RequestShipmentUseCase {

    /**
     * Creates the carrier shipment at most once per order. Repeated calls
     * return the existing shipment.
     *
     * @throws com.example.fulfillment.application.exception.CarrierException if the carrier call fails
     * @throws com.example.fulfillment.domain.exception.StaleStateException if the order is not assembled
     */
    ShipmentView requestShipment(OrderId orderId);

    /**
     * Settles a shipment request whose carrier call ended without a known
     * outcome. With a carrier id the operator found in the carrier account,
     * the order moves to SHIPPED without a new carrier call; without one the
     * request is released so {@link #requestShipment} may call the carrier again.
     *
     * @param carrierId carrier shipment id, or null to release the request
     * @throws IllegalStateException if the order has no such request
     * @throws com.example.fulfillment.domain.exception.StaleStateException if the order is not assembled
     */
    ShipmentView resolveUnknownOutcome(OrderId orderId, String carrierId);
}
