package com.example.fulfillment.application.service;

import com.example.fulfillment.application.dto.Notice;
import com.example.fulfillment.application.exception.CarrierException;
import com.example.fulfillment.application.port.out.CarrierPort;
import com.example.fulfillment.application.port.out.CarrierPort.CarrierStatus;
import com.example.fulfillment.application.port.out.CarrierPort.CarrierTracking;
import com.example.fulfillment.domain.exception.StaleStateException;
import com.example.fulfillment.domain.model.Order;
import com.example.fulfillment.domain.model.OrderId;
import com.example.fulfillment.domain.model.ShipmentRequest;
import com.example.fulfillment.infrastructure.concurrency.OrderLockRegistry;
import com.example.fulfillment.infrastructure.persistence.OrderPersistenceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Follows shipped orders at the carrier. Tells the owner once when the real
 * tracking number appears and once per notable status. Never archives:
 * a delivered or returned parcel is handed to the operator.
 */
@Service
public class ShipmentTrackingService {

    private static final Logger log = LoggerFactory.getLogger(ShipmentTrackingService.class);

    private final OrderPersistenceService persistenceService;
    private final CarrierPort carrier;
    private final OrderLockRegistry lockRegistry;

    public ShipmentTrackingService(
            OrderPersistenceService persistenceService,
            CarrierPort carrier,
            OrderLockRegistry lockRegistry) {
        this.persistenceService = persistenceService;
        this.carrier = carrier;
        this.lockRegistry = lockRegistry;
    }

    public record PollReport(int polled, int trackingAssigned, int statusChanges, int failures) {
    }

    public PollReport pollShipments(int limit) {
        int polled = 0;
        int tracking = 0;
        int changes = 0;
        int failures = 0;
        for (ShipmentRequest shipment : persistenceService.findPollableShipments(limit)) {
            if (lockRegistry.isShuttingDown()) {
                break;
            }
            OrderId orderId = shipment.getOrderId();
            CarrierTracking current;
            try {
                current = Futures.await(carrier.getShipment(shipment.getCarrierId()));
            } catch (CarrierException e) {
                log.warn("Carrier status for order {} unavailable: {}", orderId, e.getMessage());
                failures++;
                continue;
            }
            polled++;
            try {
                if (applyTrackingNumber(orderId, current)) {
                    tracking++;
                }
                if (applyStatus(orderId, current)) {
                    changes++;
                }
            } catch (StaleStateException e) {
                log.info("Order {} left SHIPPED while polling: {}", orderId, e.getMessage());
            }
        }
        return new PollReport(polled, tracking, changes, failures);
    }

    private boolean applyTrackingNumber(OrderId orderId, CarrierTracking current) {
        String number = current.trackingNumber();
        if (Order.isPlaceholderTracking(number)) {
            return false;
        }
        boolean written = lockRegistry.withLock(orderId, () -> persistenceService.recordTrackingNumber(
                orderId, number, true, List.of(
                        Notice.owner("Your order " + orderId.getValue() + " is on its way. Tracking number: "
                                + number),
                        Notice.operator("Order " + orderId.getValue() + " got tracking number " + number))));
        if (written) {
            log.info("Order {} tracking number assigned: {}", orderId, number);
        }
        return written;
    }

    private boolean applyStatus(OrderId orderId, CarrierTracking current) {
        CarrierStatus status = current.status();
        if (status == null) {
            return false;
        }
        List<Notice> notices = new ArrayList<>();
        if (status.isNotable()) {
            notices.add(Notice.owner(ownerText(orderId, status, current.statusDescription())));
        }
        if (status.isTerminal()) {
            notices.add(Notice.operator("Order " + orderId.getValue() + " is " + status
                    + " at the carrier. Archive it or investigate."));
        } else if (status.isNotable()) {
            notices.add(Notice.operator("Order " + orderId.getValue() + " carrier status: " + status));
        }
        boolean changed = lockRegistry.withLock(orderId,
                () -> persistenceService.recordCarrierStatus(orderId, status.name(), status.isTerminal(), notices));
        if (changed) {
            log.info("Order {} carrier status is now {}", orderId, status);
        }
        return changed;
    }

    private static String ownerText(OrderId orderId, CarrierStatus status, String description) {
        String id = orderId.getValue();
        String text = switch (status) {
            case ACCEPTED_AT_SENDER_WAREHOUSE -> "Order " + id + " was accepted by the carrier.";
            case OUT_FOR_DELIVERY -> "Order " + id + " is out for delivery.";
            case READY_FOR_PICKUP -> "Order " + id + " is waiting for you at the pickup point.";
            case NOT_DELIVERED -> "Order " + id + " could not be delivered. We will contact you.";
            case DELIVERED -> "Order " + id + " was delivered. Thank you!";
            case RETURNED -> "Order " + id + " is being returned to us. We will contact you.";
            default -> "Order " + id + " status: " + status;
        };
        return description == null || description.isBlank() ? text : text + " (" + description + ")";
    }
}
