package com.example.fulfillment.application.service;

import com.example.fulfillment.application.dto.PaymentWebhookEvent;
import com.example.fulfillment.application.port.in.HandlePaymentWebhookUseCase;
import com.example.fulfillment.domain.model.OrderId;
import com.example.fulfillment.domain.model.PaymentAttempt;
import com.example.fulfillment.domain.model.PaymentAttemptStatus;
import com.example.fulfillment.domain.model.PaymentKind;
import com.example.fulfillment.infrastructure.concurrency.OrderLockRegistry;
import com.example.fulfillment.infrastructure.outbox.NotificationOutbox;
import com.example.fulfillment.infrastructure.persistence.OrderPersistenceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Consumes gateway callbacks. Every event is acknowledged: unusable ones are
 * logged and dropped, internal failures are logged and raised to an operator.
 */
@Service
public class PaymentWebhookService implements HandlePaymentWebhookUseCase {

    private static final Logger log = LoggerFactory.getLogger(PaymentWebhookService.class);

    private final OrderPersistenceService persistenceService;
    private final PaymentSettlementService settlementService;
    private final OrderLockRegistry lockRegistry;
    private final NotificationOutbox outbox;

    public PaymentWebhookService(
            OrderPersistenceService persistenceService,
            PaymentSettlementService settlementService,
            OrderLockRegistry lockRegistry,
            NotificationOutbox outbox) {
        this.persistenceService = persistenceService;
        this.settlementService = settlementService;
        this.lockRegistry = lockRegistry;
        this.outbox = outbox;
    }

    @Override
    public WebhookOutcome handle(PaymentWebhookEvent event) {
        if (!event.isSucceeded() && !event.isCanceled()) {
            log.debug("Ignoring gateway event {}", event.event());
            return WebhookOutcome.IGNORED;
        }
        if (event.gatewayId() == null || event.gatewayId().isBlank()) {
            log.warn("Gateway event {} without payment id ignored", event.event());
            return WebhookOutcome.IGNORED;
        }

        Optional<OrderId> parsed = OrderId.tryParse(event.orderIdMetadata());
        if (parsed.isEmpty()) {
            log.warn("Gateway event {} for payment {} has unusable order_id metadata: {}",
                    event.event(), event.gatewayId(), event.orderIdMetadata());
            return WebhookOutcome.IGNORED;
        }
        OrderId orderId = parsed.get();

        try {
            if (persistenceService.findOrder(orderId).isEmpty()) {
                log.warn("Gateway event {} for payment {} references unknown order {}",
                        event.event(), event.gatewayId(), orderId);
                return WebhookOutcome.IGNORED;
            }

            if (event.isCanceled()) {
                return lockRegistry.withLock(orderId, () -> cancel(orderId, event.gatewayId()));
            }

            PaymentKind declaredKind = PaymentKind.fromWireValue(event.paymentKindMetadata()).orElse(null);
            return lockRegistry.withLock(orderId,
                    () -> settlementService.settle(orderId, event.gatewayId(), declaredKind, "webhook"));
        } catch (RuntimeException e) {
            log.error("Failed to process gateway event {} for payment {} on order {}",
                    event.event(), event.gatewayId(), orderId, e);
            raiseAlert(orderId, "Gateway event " + event.event() + " for payment " + event.gatewayId()
                    + " could not be processed: " + e.getMessage());
            return WebhookOutcome.FAILED;
        }
    }

    private WebhookOutcome cancel(OrderId orderId, String gatewayId) {
        Optional<PaymentAttempt> attempt = persistenceService.findAttempt(gatewayId);
        if (attempt.isEmpty() || !attempt.get().getOrderId().equals(orderId)) {
            log.warn("Cancellation for unknown payment {} on order {}", gatewayId, orderId);
            return WebhookOutcome.IGNORED;
        }
        if (!attempt.get().isPending()) {
            log.info("Cancellation for payment {} already {}", gatewayId, attempt.get().getStatus());
            return WebhookOutcome.DUPLICATE;
        }
        persistenceService.updateAttemptStatus(gatewayId, PaymentAttemptStatus.FAILED);
        log.info("Payment {} for order {} canceled at the gateway", gatewayId, orderId);
        return WebhookOutcome.APPLIED;
    }

    private void raiseAlert(OrderId orderId, String text) {
        try {
            outbox.alertOperator(orderId, text);
        } catch (RuntimeException alertFailure) {
            log.error("[OPERATOR_ALERT] could not be recorded for order {}: {}", orderId, text, alertFailure);
        }
    }
}
