package com.example.fulfillment.application.service;

import com.example.fulfillment.application.dto.Notice;
import com.example.fulfillment.application.dto.ShipmentView;
import com.example.fulfillment.application.exception.CarrierException;
import com.example.fulfillment.application.port.in.RequestShipmentUseCase;
import com.example.fulfillment.application.port.out.CarrierPort;
import com.example.fulfillment.application.port.out.CarrierPort.CarrierShipment;
import com.example.fulfillment.application.port.out.CarrierPort.ShipmentOrder;
import com.example.fulfillment.domain.exception.StaleStateException;
import com.example.fulfillment.domain.model.*;
import com.example.fulfillment.infrastructure.concurrency.OrderLockRegistry;
import com.example.fulfillment.infrastructure.outbox.NotificationOutbox;
import com.example.fulfillment.infrastructure.persistence.OrderPersistenceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * Hands an assembled order to the carrier, at most once.
 * <p>
 * The shipment request row is claimed before the carrier call and is the
 * idempotency record: an accepted request is reused, a pending one means an
 * earlier call ended without a known outcome and needs a human. Carrier
 * failures are never retried automatically.
 */
@Service
public class ShipmentOrchestrator implements RequestShipmentUseCase {

    private static final Logger log = LoggerFactory.getLogger(ShipmentOrchestrator.class);

    private final OrderPersistenceService persistenceService;
    private final CarrierPort carrier;
    private final OrderLockRegistry lockRegistry;
    private final NotificationOutbox outbox;

    public ShipmentOrchestrator(
            OrderPersistenceService persistenceService,
            CarrierPort carrier,
            OrderLockRegistry lockRegistry,
            NotificationOutbox outbox) {
        this.persistenceService = persistenceService;
        this.carrier = carrier;
        this.lockRegistry = lockRegistry;
        this.outbox = outbox;
    }

    @Override
    public ShipmentView requestShipment(OrderId orderId) {
        return lockRegistry.withLock(orderId, () -> requestLocked(orderId));
    }

    @Override
    public ShipmentView resolveUnknownOutcome(OrderId orderId, String carrierId) {
        return lockRegistry.withLock(orderId, () -> resolveLocked(orderId, carrierId));
    }

    private ShipmentView resolveLocked(OrderId orderId, String carrierId) {
        boolean pending = persistenceService.findShipment(orderId)
                .map(request -> request.getStatus() == ShipmentRequestStatus.PENDING)
                .orElse(false);
        if (!pending) {
            throw new IllegalStateException("Order " + orderId + " has no shipment request with an unknown outcome");
        }

        Order order;
        if (carrierId == null || carrierId.isBlank()) {
            order = persistenceService.releaseShipmentClaim(orderId, "Released by operator", List.of(
                    Notice.operator("Shipment request for order " + orderId.getValue()
                            + " released; the next shipment request calls the carrier again")));
            log.info("Operator released pending shipment request of order {}", orderId);
        } else {
            String id = carrierId.trim();
            order = persistenceService.completeShipment(orderId, id, null,
                    shippedNotices(persistenceService.loadOrder(orderId)));
            log.info("Operator attached carrier shipment {} to order {}", id, orderId);
        }
        return view(orderId, order);
    }

    private ShipmentView requestLocked(OrderId orderId) {
        Order order = persistenceService.loadOrder(orderId);

        Optional<ShipmentRequest> existing = persistenceService.findShipment(orderId);
        if (existing.isPresent() && existing.get().isAccepted()) {
            log.info("Order {} already has carrier shipment {}", orderId, existing.get().getCarrierId());
            if (order.getStatus() == OrderStatus.ASSEMBLED) {
                order = persistenceService.completeShipment(orderId, existing.get().getCarrierId(), null,
                        shippedNotices(order));
            }
            return view(orderId, order);
        }
        if (existing.isPresent() && existing.get().getStatus() == ShipmentRequestStatus.PENDING) {
            outbox.alertOperator(orderId, "Shipment for order " + orderId
                    + " has an unfinished carrier request. Check the carrier account before retrying.");
            throw new CarrierException("Shipment request for order " + orderId + " has an unknown outcome");
        }

        if (order.getStatus() != OrderStatus.ASSEMBLED) {
            throw new StaleStateException(orderId, EnumSet.of(OrderStatus.ASSEMBLED), order.getStatus());
        }
        CustomerProfile recipient = persistenceService.findCustomer(order.getOwnerChatId())
                .orElseThrow(() -> new IllegalStateException("No customer profile for order " + orderId));

        persistenceService.claimShipment(orderId);

        CarrierShipment shipment;
        try {
            shipment = Futures.await(carrier.createShipment(toShipmentOrder(order, recipient)));
        } catch (RuntimeException e) {
            log.error("Carrier rejected shipment for order {}: {}", orderId, e.getMessage());
            persistenceService.markShipmentFailed(orderId, e.getMessage());
            outbox.alertOperator(orderId, "Shipment creation failed for order " + orderId + ": "
                    + e.getMessage() + ". The order stays ASSEMBLED; retry manually.");
            throw e instanceof CarrierException carrierException
                    ? carrierException
                    : new CarrierException("Shipment creation failed for order " + orderId, e);
        }

        try {
            order = persistenceService.completeShipment(orderId, shipment.carrierId(), shipment.rawResponse(),
                    shippedNotices(order));
        } catch (StaleStateException e) {
            persistenceService.markShipmentAccepted(orderId, shipment.carrierId(), shipment.rawResponse());
            log.error("Carrier shipment {} created for order {} but the order is now {}",
                    shipment.carrierId(), orderId, e.getActual());
            outbox.alertOperator(orderId, "Carrier shipment " + shipment.carrierId() + " exists for order "
                    + orderId + " but the order is " + e.getActual());
            throw e;
        }

        log.info("Order {} handed to carrier as {}", orderId, shipment.carrierId());
        return view(orderId, order);
    }

    private ShipmentView view(OrderId orderId, Order order) {
        ShipmentRequest request = persistenceService.findShipment(orderId)
                .orElseThrow(() -> new IllegalStateException("Shipment request vanished for order " + orderId));
        return ShipmentView.from(request, order.getTrackingNumber());
    }

    private static ShipmentOrder toShipmentOrder(Order order, CustomerProfile recipient) {
        OrderExtension extension = order.getExtension();
        return new ShipmentOrder(
                order.getOrderId(),
                Order.placeholderTracking(order.getOrderId()),
                recipient,
                extension.getString(OrderExtension.PICKUP_POINT_CODE).orElse(null),
                order.getDeliveryAddress(),
                extension.getString(OrderExtension.POSTAL_CODE).orElse(null),
                order.getTotalAmount());
    }

    private static List<Notice> shippedNotices(Order order) {
        String id = order.getOrderId().getValue();
        return List.of(
                Notice.owner("Order " + id + " has been handed to the carrier. "
                        + "We will send the tracking number as soon as it is assigned."),
                Notice.operator("Order " + id + " shipped"));
    }
}
