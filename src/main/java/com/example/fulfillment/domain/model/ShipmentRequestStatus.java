package com.example.fulfillment.domain.model;

/**
 * Outcome of the single carrier creation call made for an order.
 */
public enum ShipmentRequestStatus {

    /**
     * Claimed before calling the carrier. A request left in this state means
     * the call never reported back and must be checked by hand.
     */
    PENDING,

    ACCEPTED,

    /**
     * The carrier call failed; an operator may request the shipment again.
     */
    FAILED
}
