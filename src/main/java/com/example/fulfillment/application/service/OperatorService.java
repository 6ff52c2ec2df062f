package com.example.fulfillment.application.service;

import com.example.fulfillment.application.dto.Notice;
import com.example.fulfillment.application.dto.OrderStatusView;
import com.example.fulfillment.application.port.in.GetOrderStatusUseCase;
import com.example.fulfillment.application.port.in.OperatorActionsUseCase;
import com.example.fulfillment.domain.exception.InvalidOrderException;
import com.example.fulfillment.domain.model.OrderId;
import com.example.fulfillment.domain.model.OrderStatus;
import com.example.fulfillment.infrastructure.concurrency.OrderLockRegistry;
import com.example.fulfillment.infrastructure.persistence.OrderPersistenceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.List;

@Service
public class OperatorService implements OperatorActionsUseCase {

    private static final Logger log = LoggerFactory.getLogger(OperatorService.class);

    private final OrderPersistenceService persistenceService;
    private final OrderLockRegistry lockRegistry;
    private final GetOrderStatusUseCase statusUseCase;

    public OperatorService(
            OrderPersistenceService persistenceService,
            OrderLockRegistry lockRegistry,
            GetOrderStatusUseCase statusUseCase) {
        this.persistenceService = persistenceService;
        this.lockRegistry = lockRegistry;
        this.statusUseCase = statusUseCase;
    }

    @Override
    public OrderStatusView assemble(OrderId orderId) {
        lockRegistry.withLock(orderId, () -> persistenceService.transition(
                orderId, EnumSet.of(OrderStatus.PAID_FULL), OrderStatus.ASSEMBLED,
                List.of(Notice.owner("Order " + orderId.getValue() + " is assembled and will ship soon."))));
        log.info("Operator assembled order {}", orderId);
        return statusUseCase.getStatus(orderId);
    }

    @Override
    public OrderStatusView archive(OrderId orderId) {
        lockRegistry.withLock(orderId, () -> persistenceService.archiveOrder(orderId, List.of()));
        log.info("Operator archived order {}", orderId);
        return statusUseCase.getStatus(orderId);
    }

    @Override
    public OrderStatusView overrideTracking(OrderId orderId, String trackingNumber) {
        if (trackingNumber == null || trackingNumber.isBlank()) {
            throw new InvalidOrderException("Tracking number is required");
        }
        String number = trackingNumber.trim();
        boolean written = lockRegistry.withLock(orderId, () -> persistenceService.recordTrackingNumber(
                orderId, number, false, List.of(
                        Notice.owner("Tracking number for order " + orderId.getValue() + ": " + number))));
        log.info("Operator set tracking number of order {} to {} (changed: {})", orderId, number, written);
        return statusUseCase.getStatus(orderId);
    }
}
