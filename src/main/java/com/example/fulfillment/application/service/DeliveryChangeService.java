package com.example.fulfillment.application.service;

import com.example.fulfillment.application.dto.DeliveryChangeCommand;
import com.example.fulfillment.application.dto.Notice;
import com.example.fulfillment.application.dto.OrderStatusView;
import com.example.fulfillment.application.port.in.ChangeDeliveryUseCase;
import com.example.fulfillment.application.port.in.GetOrderStatusUseCase;
import com.example.fulfillment.domain.model.OrderId;
import com.example.fulfillment.infrastructure.concurrency.OrderLockRegistry;
import com.example.fulfillment.infrastructure.persistence.OrderPersistenceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Owner-initiated change of pickup point. Runs under the order's lock so it
 * cannot interleave with a shipment being created from the old address.
 */
@Service
public class DeliveryChangeService implements ChangeDeliveryUseCase {

    private static final Logger log = LoggerFactory.getLogger(DeliveryChangeService.class);

    private final OrderPersistenceService persistenceService;
    private final OrderLockRegistry lockRegistry;
    private final GetOrderStatusUseCase statusUseCase;

    public DeliveryChangeService(
            OrderPersistenceService persistenceService,
            OrderLockRegistry lockRegistry,
            GetOrderStatusUseCase statusUseCase) {
        this.persistenceService = persistenceService;
        this.lockRegistry = lockRegistry;
        this.statusUseCase = statusUseCase;
    }

    @Override
    public OrderStatusView changeDelivery(OrderId orderId, DeliveryChangeCommand command) {
        String address = command.deliveryAddress() != null ? command.deliveryAddress().trim() : null;
        String pickupPoint = command.pickupPointCode().trim();

        lockRegistry.withLock(orderId, () -> persistenceService.changeDelivery(
                orderId, address, pickupPoint, command.postalCode(), List.of(
                        Notice.owner("Pickup point for order " + orderId.getValue() + " changed to "
                                + describe(address, pickupPoint) + "."),
                        Notice.operator("Pickup point updated for order " + orderId.getValue() + ": "
                                + describe(address, pickupPoint)))));
        log.info("Order {} moved to pickup point {}", orderId, pickupPoint);
        return statusUseCase.getStatus(orderId);
    }

    private static String describe(String address, String pickupPoint) {
        return address == null || address.isEmpty() ? pickupPoint : address + " (" + pickupPoint + ")";
    }
}
