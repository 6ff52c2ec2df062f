package com.example.fulfillment.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * The single carrier shipment request of an order, keyed by order id.
 */
public final class ShipmentRequest {

    private final OrderId orderId;
    private final ShipmentRequestStatus status;
    private final String carrierId;
    private final String lastPolledStatus;
    private final boolean trackingTerminal;
    private final String errorMessage;
    private final Instant updatedAt;

    private ShipmentRequest(OrderId orderId, ShipmentRequestStatus status, String carrierId,
                            String lastPolledStatus, boolean trackingTerminal, String errorMessage,
                            Instant updatedAt) {
        this.orderId = Objects.requireNonNull(orderId, "OrderId cannot be null");
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        this.carrierId = carrierId;
        this.lastPolledStatus = lastPolledStatus;
        this.trackingTerminal = trackingTerminal;
        this.errorMessage = errorMessage;
        this.updatedAt = updatedAt;
    }

    public static ShipmentRequest reconstitute(OrderId orderId, ShipmentRequestStatus status, String carrierId,
                                               String lastPolledStatus, boolean trackingTerminal,
                                               String errorMessage, Instant updatedAt) {
        return new ShipmentRequest(orderId, status, carrierId, lastPolledStatus, trackingTerminal,
                errorMessage, updatedAt);
    }

    public boolean isAccepted() {
        return status == ShipmentRequestStatus.ACCEPTED && carrierId != null;
    }

    public OrderId getOrderId() {
        return orderId;
    }

    public ShipmentRequestStatus getStatus() {
        return status;
    }

    public String getCarrierId() {
        return carrierId;
    }

    public String getLastPolledStatus() {
        return lastPolledStatus;
    }

    public boolean isTrackingTerminal() {
        return trackingTerminal;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
