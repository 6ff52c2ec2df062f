package com.example.fulfillment.application.service;

import com.example.fulfillment.application.dto.Notice;
import com.example.fulfillment.application.port.in.HandlePaymentWebhookUseCase.WebhookOutcome;
import com.example.fulfillment.domain.exception.StaleStateException;
import com.example.fulfillment.domain.model.*;
import com.example.fulfillment.infrastructure.outbox.NotificationOutbox;
import com.example.fulfillment.infrastructure.persistence.OrderPersistenceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Applies a payment the gateway reports as succeeded, whether it arrived by
 * webhook or was found by the sweeper. Callers hold the order's lock.
 * <p>
 * The stored attempt's kind wins over whatever kind the caller supplies.
 * A success that cannot move the order (already settled by another payment,
 * abandoned, wrong kind) is money taken without a matching transition and
 * goes to an operator.
 */
@Service
public class PaymentSettlementService {

    private static final Logger log = LoggerFactory.getLogger(PaymentSettlementService.class);

    private final OrderPersistenceService persistenceService;
    private final NotificationOutbox outbox;
    private final int prepayPercent;

    public PaymentSettlementService(
            OrderPersistenceService persistenceService,
            NotificationOutbox outbox,
            @Value("${fulfillment.payment.prepay-percent:30}") int prepayPercent) {
        this.persistenceService = persistenceService;
        this.outbox = outbox;
        this.prepayPercent = prepayPercent;
    }

    /**
     * @param declaredKind kind carried by the event, used only when no attempt is stored
     * @param source       webhook or sweep, for logging
     */
    public WebhookOutcome settle(OrderId orderId, String gatewayId, PaymentKind declaredKind, String source) {
        Optional<PaymentAttempt> attempt = persistenceService.findAttempt(gatewayId);
        if (attempt.isPresent() && !attempt.get().getOrderId().equals(orderId)) {
            log.warn("Payment {} belongs to order {}, not {} ({})",
                    gatewayId, attempt.get().getOrderId(), orderId, source);
            return WebhookOutcome.IGNORED;
        }

        PaymentKind kind = attempt.map(PaymentAttempt::getKind).orElse(declaredKind);
        if (kind == null) {
            log.warn("Payment {} for order {} has no usable kind ({})", gatewayId, orderId, source);
            return WebhookOutcome.IGNORED;
        }
        if (attempt.isPresent() && attempt.get().getStatus() == PaymentAttemptStatus.SUCCEEDED) {
            log.info("Payment {} for order {} already applied ({})", gatewayId, orderId, source);
            return WebhookOutcome.DUPLICATE;
        }

        Order order = persistenceService.loadOrder(orderId);
        if (order.getExtension().isRecordedPayment(gatewayId)) {
            log.info("Payment {} for order {} already recorded ({})", gatewayId, orderId, source);
            return WebhookOutcome.DUPLICATE;
        }
        if (!kind.appliesTo(order.getFulfillmentKind()) || !kind.settlesFrom().contains(order.getStatus())) {
            return unmatched(order, gatewayId, kind, source);
        }

        try {
            persistenceService.settlePayment(orderId, gatewayId, kind, notices(order, kind));
            log.info("Payment {} settled order {} as {} ({})", gatewayId, orderId, kind.settlesTo(), source);
            return WebhookOutcome.APPLIED;
        } catch (StaleStateException e) {
            log.warn("Lost race settling payment {} on order {}: {}", gatewayId, orderId, e.getMessage());
            Order fresh = persistenceService.loadOrder(orderId);
            if (fresh.getExtension().isRecordedPayment(gatewayId)) {
                return WebhookOutcome.DUPLICATE;
            }
            return unmatched(fresh, gatewayId, kind, source);
        }
    }

    private WebhookOutcome unmatched(Order order, String gatewayId, PaymentKind kind, String source) {
        persistenceService.updateAttemptStatus(gatewayId, PaymentAttemptStatus.SUCCEEDED);
        log.warn("Payment {} ({}) succeeded but order {} is {} ({})",
                gatewayId, kind.wireValue(), order.getOrderId(), order.getStatus(), source);
        outbox.alertOperator(order.getOrderId(), "Payment " + gatewayId + " (" + kind.wireValue()
                + ") succeeded but order " + order.getOrderId() + " is " + order.getStatus()
                + ". Possible double charge, check and refund if needed.");
        return WebhookOutcome.IGNORED;
    }

    private List<Notice> notices(Order order, PaymentKind kind) {
        String id = order.getOrderId().getValue();
        String paid = format(order.amountDue(kind, prepayPercent));
        return switch (kind) {
            case FULL -> List.of(
                    Notice.owner("Payment of " + paid + " received for order " + id
                            + ". We are assembling your order."),
                    Notice.operator("Order " + id + " paid in full: " + paid));
            case PREPAY -> List.of(
                    Notice.owner("Prepayment of " + paid + " received for order " + id + ". The remaining "
                            + format(order.amountDue(PaymentKind.REMAINDER, prepayPercent))
                            + " is due before shipping."),
                    Notice.operator("Order " + id + " prepaid: " + paid));
            case REMAINDER -> List.of(
                    Notice.owner("Remaining payment of " + paid + " received for order " + id
                            + ". Your order is fully paid."),
                    Notice.operator("Order " + id + " paid in full (remainder " + paid + ")"));
        };
    }

    private static String format(Money money) {
        return money.toDecimalString() + " " + money.getCurrency();
    }
}
