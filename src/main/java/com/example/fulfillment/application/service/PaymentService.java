package com.example.fulfillment.application.service;

import com.example.fulfillment.application.dto.Notice;
import com.example.fulfillment.application.dto.PaymentIntentView;
import com.example.fulfillment.application.exception.GatewayException;
import com.example.fulfillment.application.port.in.StartPaymentUseCase;
import com.example.fulfillment.application.port.out.PaymentGatewayPort;
import com.example.fulfillment.application.port.out.PaymentGatewayPort.PaymentIntent;
import com.example.fulfillment.application.port.out.PaymentGatewayPort.PaymentIntentRequest;
import com.example.fulfillment.domain.exception.InvalidOrderException;
import com.example.fulfillment.domain.exception.StaleStateException;
import com.example.fulfillment.domain.model.*;
import com.example.fulfillment.infrastructure.concurrency.OrderLockRegistry;
import com.example.fulfillment.infrastructure.outbox.NotificationOutbox;
import com.example.fulfillment.infrastructure.persistence.OrderPersistenceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Starts user-initiated payments. The whole check-dedupe-create-record
 * sequence runs under the order's lock, so two taps on "pay" produce one
 * gateway intent.
 */
@Service
public class PaymentService implements StartPaymentUseCase {

    private static final Logger log = LoggerFactory.getLogger(PaymentService.class);

    private final OrderPersistenceService persistenceService;
    private final PaymentGatewayPort paymentGateway;
    private final OrderLockRegistry lockRegistry;
    private final NotificationOutbox outbox;
    private final int prepayPercent;

    public PaymentService(
            OrderPersistenceService persistenceService,
            PaymentGatewayPort paymentGateway,
            OrderLockRegistry lockRegistry,
            NotificationOutbox outbox,
            @Value("${fulfillment.payment.prepay-percent:30}") int prepayPercent) {
        this.persistenceService = persistenceService;
        this.paymentGateway = paymentGateway;
        this.lockRegistry = lockRegistry;
        this.outbox = outbox;
        this.prepayPercent = prepayPercent;
    }

    @Override
    public PaymentIntentView startPayment(OrderId orderId, PaymentKind kind) {
        return lockRegistry.withLock(orderId, () -> startLocked(orderId, kind));
    }

    private PaymentIntentView startLocked(OrderId orderId, PaymentKind kind) {
        Order order = persistenceService.loadOrder(orderId);
        if (!kind.startableFrom().contains(order.getStatus())) {
            throw new StaleStateException(orderId, kind.startableFrom(), order.getStatus());
        }

        Money amount = order.amountDue(kind, prepayPercent);
        if (amount.isZero()) {
            throw new InvalidOrderException("Nothing to pay for " + kind.wireValue() + " on order " + orderId);
        }

        Optional<PaymentAttempt> outstanding = persistenceService.findPendingAttempt(orderId, kind);
        if (outstanding.isPresent()) {
            log.info("Reusing pending {} attempt {} for order {}",
                    kind.wireValue(), outstanding.get().getGatewayId(), orderId);
            return PaymentIntentView.from(outstanding.get(), true);
        }

        CustomerProfile customer = persistenceService.findCustomer(order.getOwnerChatId())
                .orElseThrow(() -> new IllegalStateException("No customer profile for order " + orderId));

        PaymentIntent intent;
        try {
            intent = Futures.await(paymentGateway.createIntent(
                    new PaymentIntentRequest(orderId, kind, amount, describe(order, kind), customer)));
        } catch (GatewayException e) {
            log.error("Payment creation failed for order {} ({}): {}", orderId, kind.wireValue(), e.getMessage());
            outbox.alertOperator(orderId,
                    "Could not create " + kind.wireValue() + " payment for order " + orderId + ": " + e.getMessage());
            throw e;
        }

        PaymentAttempt attempt = PaymentAttempt.reconstitute(intent.gatewayId(), orderId, kind, amount,
                PaymentAttemptStatus.PENDING, intent.confirmationUrl(), Instant.now());
        try {
            persistenceService.recordPaymentAttempt(order, attempt, List.of(startedNotice(order, attempt)));
        } catch (StaleStateException e) {
            log.error("Payment {} was created for order {} but the order is now {}",
                    intent.gatewayId(), orderId, e.getActual());
            outbox.alertOperator(orderId, "Payment " + intent.gatewayId() + " was created while order "
                    + orderId + " moved to " + e.getActual() + "; cancel it at the gateway if it gets paid");
            throw e;
        }

        log.info("Payment {} created for order {}: {} {}", intent.gatewayId(), orderId, kind.wireValue(), amount);
        return PaymentIntentView.from(attempt, false);
    }

    private static Notice startedNotice(Order order, PaymentAttempt attempt) {
        String address = order.getDeliveryAddress() != null ? order.getDeliveryAddress() : "-";
        return Notice.operator("Payment started for order " + order.getOrderId().getValue() + ": "
                + attempt.getKind().wireValue() + " " + attempt.getAmount().toDecimalString() + " "
                + attempt.getAmount().getCurrency() + ", customer " + order.getOwnerChatId()
                + ", address " + address + ", status " + order.getStatus());
    }

    private static String describe(Order order, PaymentKind kind) {
        String shortId = order.getOrderId().getValue().substring(0, 8);
        return switch (kind) {
            case FULL -> "Order " + shortId;
            case PREPAY -> "Prepayment for order " + shortId;
            case REMAINDER -> "Remaining payment for order " + shortId;
        };
    }
}
