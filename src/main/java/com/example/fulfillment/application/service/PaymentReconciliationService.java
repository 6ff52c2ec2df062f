package com.example.fulfillment.application.service;

import com.example.fulfillment.application.dto.Notice;
import com.example.fulfillment.application.exception.GatewayException;
import com.example.fulfillment.application.port.in.HandlePaymentWebhookUseCase.WebhookOutcome;
import com.example.fulfillment.application.port.out.PaymentGatewayPort;
import com.example.fulfillment.application.port.out.PaymentGatewayPort.GatewayPaymentStatus;
import com.example.fulfillment.domain.exception.StaleStateException;
import com.example.fulfillment.domain.model.*;
import com.example.fulfillment.infrastructure.concurrency.OrderLockRegistry;
import com.example.fulfillment.infrastructure.persistence.OrderPersistenceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Timeout reconciliation. Finds payments whose webhook never arrived by
 * asking the gateway directly, and closes orders nobody paid for.
 * <p>
 * A gateway that does not answer never causes an abandonment: the order is
 * left for the next sweep. Only an answer of "failed" or "still pending"
 * past the timeout counts as no success.
 */
@Service
public class PaymentReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(PaymentReconciliationService.class);

    private final OrderPersistenceService persistenceService;
    private final PaymentGatewayPort paymentGateway;
    private final PaymentSettlementService settlementService;
    private final OrderLockRegistry lockRegistry;
    private final Duration paymentTimeout;
    private final Duration checkoutTimeout;
    private final int batchSize;

    public PaymentReconciliationService(
            OrderPersistenceService persistenceService,
            PaymentGatewayPort paymentGateway,
            PaymentSettlementService settlementService,
            OrderLockRegistry lockRegistry,
            @Value("${fulfillment.payment.timeout-seconds:600}") long paymentTimeoutSeconds,
            @Value("${fulfillment.checkout.abandon-after-seconds:86400}") long checkoutTimeoutSeconds,
            @Value("${fulfillment.sweeper.batch-size:100}") int batchSize) {
        this.persistenceService = persistenceService;
        this.paymentGateway = paymentGateway;
        this.settlementService = settlementService;
        this.lockRegistry = lockRegistry;
        this.paymentTimeout = Duration.ofSeconds(paymentTimeoutSeconds);
        this.checkoutTimeout = Duration.ofSeconds(checkoutTimeoutSeconds);
        this.batchSize = batchSize;
    }

    public enum Outcome {
        SETTLED,
        ABANDONED,
        EXPIRED,
        DEFERRED,
        SKIPPED
    }

    public record SweepReport(int settled, int abandoned, int expired, int deferred) {

        static SweepReport empty() {
            return new SweepReport(0, 0, 0, 0);
        }

        SweepReport plus(Outcome outcome) {
            return switch (outcome) {
                case SETTLED -> new SweepReport(settled + 1, abandoned, expired, deferred);
                case ABANDONED -> new SweepReport(settled, abandoned + 1, expired, deferred);
                case EXPIRED -> new SweepReport(settled, abandoned, expired + 1, deferred);
                case DEFERRED -> new SweepReport(settled, abandoned, expired, deferred + 1);
                case SKIPPED -> this;
            };
        }

        public boolean isEmpty() {
            return settled + abandoned + expired + deferred == 0;
        }
    }

    /**
     * One pass over everything that is overdue as of {@code now}.
     */
    public SweepReport sweepExpired(Instant now) {
        SweepReport report = SweepReport.empty();
        Instant paymentCutoff = now.minus(paymentTimeout);

        for (OrderId orderId : persistenceService.findOrdersInStatusSince(
                OrderStatus.PENDING_PAYMENT, paymentCutoff, batchSize)) {
            if (lockRegistry.isShuttingDown()) {
                return report;
            }
            report = report.plus(guarded(orderId, () -> reconcilePending(orderId, paymentCutoff)));
        }

        for (OrderId orderId : persistenceService.findOrdersWithAttemptsBefore(
                OrderStatus.PAID_PARTIALLY, PaymentKind.REMAINDER, paymentCutoff)) {
            if (lockRegistry.isShuttingDown()) {
                return report;
            }
            report = report.plus(guarded(orderId, () -> reconcileRemainder(orderId, paymentCutoff)));
        }

        Instant checkoutCutoff = now.minus(checkoutTimeout);
        for (OrderId orderId : persistenceService.findOrdersInStatusSince(
                OrderStatus.NEW, checkoutCutoff, batchSize)) {
            if (lockRegistry.isShuttingDown()) {
                return report;
            }
            report = report.plus(guarded(orderId, () -> abandonStaleCheckout(orderId, checkoutCutoff)));
        }
        return report;
    }

    /**
     * Resolves one PENDING_PAYMENT order: settles it if any attempt succeeded,
     * abandons it if every attempt answered without success.
     */
    Outcome reconcilePending(OrderId orderId, Instant cutoff) {
        return lockRegistry.withLock(orderId, () -> {
            Order order = persistenceService.loadOrder(orderId);
            if (order.getStatus() != OrderStatus.PENDING_PAYMENT || order.getStatusChangedAt().isAfter(cutoff)) {
                return Outcome.SKIPPED;
            }
            List<PaymentAttempt> attempts = persistenceService.findPendingAttempts(orderId);
            if (attempts.stream().anyMatch(attempt -> attempt.getCreatedAt().isAfter(cutoff))) {
                log.debug("Order {} has a recent payment attempt, not due yet", orderId);
                return Outcome.SKIPPED;
            }

            boolean deferred = false;
            for (PaymentAttempt attempt : attempts) {
                Optional<GatewayPaymentStatus> status = query(attempt);
                if (status.isEmpty()) {
                    deferred = true;
                    continue;
                }
                switch (status.get()) {
                    case SUCCEEDED -> {
                        WebhookOutcome outcome = settlementService.settle(
                                orderId, attempt.getGatewayId(), attempt.getKind(), "sweep");
                        if (outcome == WebhookOutcome.APPLIED || outcome == WebhookOutcome.DUPLICATE) {
                            return Outcome.SETTLED;
                        }
                        deferred = true;
                    }
                    case FAILED -> persistenceService.updateAttemptStatus(
                            attempt.getGatewayId(), PaymentAttemptStatus.FAILED);
                    case PENDING -> log.debug("Payment {} for order {} still pending at the gateway",
                            attempt.getGatewayId(), orderId);
                }
            }

            if (deferred) {
                log.info("Order {} left in PENDING_PAYMENT until the gateway answers", orderId);
                return Outcome.DEFERRED;
            }

            persistenceService.abandonOrder(orderId, EnumSet.of(OrderStatus.PENDING_PAYMENT), List.of(
                    Notice.owner("Order " + orderId.getValue() + " was cancelled because we did not receive "
                            + "the payment in time. You can place a new order at any time.")));
            for (PaymentAttempt attempt : attempts) {
                persistenceService.updateAttemptStatus(attempt.getGatewayId(), PaymentAttemptStatus.EXPIRED);
            }
            return Outcome.ABANDONED;
        });
    }

    /**
     * Resolves overdue remainder attempts. The order itself is never
     * abandoned: the prepayment is already taken.
     */
    Outcome reconcileRemainder(OrderId orderId, Instant cutoff) {
        return lockRegistry.withLock(orderId, () -> {
            Order order = persistenceService.loadOrder(orderId);
            if (order.getStatus() != OrderStatus.PAID_PARTIALLY) {
                return Outcome.SKIPPED;
            }
            Outcome result = Outcome.SKIPPED;
            for (PaymentAttempt attempt : persistenceService.findPendingAttempts(orderId)) {
                if (attempt.getKind() != PaymentKind.REMAINDER || attempt.getCreatedAt().isAfter(cutoff)) {
                    continue;
                }
                Optional<GatewayPaymentStatus> status = query(attempt);
                if (status.isEmpty()) {
                    result = Outcome.DEFERRED;
                    continue;
                }
                switch (status.get()) {
                    case SUCCEEDED -> {
                        WebhookOutcome outcome = settlementService.settle(
                                orderId, attempt.getGatewayId(), PaymentKind.REMAINDER, "sweep");
                        if (outcome == WebhookOutcome.APPLIED || outcome == WebhookOutcome.DUPLICATE) {
                            return Outcome.SETTLED;
                        }
                    }
                    case FAILED -> persistenceService.updateAttemptStatus(
                            attempt.getGatewayId(), PaymentAttemptStatus.FAILED);
                    case PENDING -> {
                        persistenceService.updateAttemptStatus(attempt.getGatewayId(), PaymentAttemptStatus.EXPIRED);
                        log.info("Remainder payment {} for order {} expired", attempt.getGatewayId(), orderId);
                        if (result == Outcome.SKIPPED) {
                            result = Outcome.EXPIRED;
                        }
                    }
                }
            }
            return result;
        });
    }

    Outcome abandonStaleCheckout(OrderId orderId, Instant cutoff) {
        return lockRegistry.withLock(orderId, () -> {
            Order order = persistenceService.loadOrder(orderId);
            if (order.getStatus() != OrderStatus.NEW || order.getStatusChangedAt().isAfter(cutoff)) {
                return Outcome.SKIPPED;
            }
            persistenceService.abandonOrder(orderId, EnumSet.of(OrderStatus.NEW), List.of());
            log.info("Checkout {} abandoned without payment", orderId);
            return Outcome.ABANDONED;
        });
    }

    private Optional<GatewayPaymentStatus> query(PaymentAttempt attempt) {
        try {
            return Optional.of(Futures.await(paymentGateway.queryStatus(attempt.getGatewayId())));
        } catch (GatewayException e) {
            log.warn("Status query for payment {} on order {} failed, retrying next sweep: {}",
                    attempt.getGatewayId(), attempt.getOrderId(), e.getMessage());
            return Optional.empty();
        }
    }

    private Outcome guarded(OrderId orderId, Supplier<Outcome> step) {
        try {
            return step.get();
        } catch (StaleStateException e) {
            log.info("Order {} changed during sweep, skipping: {}", orderId, e.getMessage());
            return Outcome.SKIPPED;
        } catch (RuntimeException e) {
            log.error("Sweep failed for order {}", orderId, e);
            return Outcome.DEFERRED;
        }
    }
}
