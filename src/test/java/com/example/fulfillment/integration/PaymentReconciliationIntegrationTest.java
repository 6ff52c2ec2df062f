package com.example.fulfillment.integration;

import com.example.fulfillment.application.service.PaymentReconciliationService;
import com.example.fulfillment.application.service.PaymentReconciliationService.SweepReport;
import com.example.fulfillment.support.WireMockTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Timeout sweep over unpaid orders. The sweep is invoked directly with a
 * clock moved past the payment timeout.
 *
 * BDD Scenarios:
 * - Given a payment whose webhook was lost, When the sweep queries the gateway, Then the order is settled
 * - Given a payment the gateway reports canceled, When the sweep runs, Then the order is abandoned exactly once
 * - Given a gateway that cannot answer, When the sweep runs, Then the decision is deferred
 */
@DisplayName("Payment Reconciliation Integration Tests")
class PaymentReconciliationIntegrationTest extends WireMockTestSupport {

    @Autowired
    private PaymentReconciliationService reconciliationService;

    private static Instant afterPaymentTimeout() {
        return Instant.now().plus(Duration.ofMinutes(11));
    }

    @Test
    @DisplayName("should_settle_order_when_gateway_reports_success_for_lost_webhook")
    void should_settle_order_when_gateway_reports_success_for_lost_webhook() {
        // Given: prepayment made, webhook never delivered
        String orderId = checkout(randomChatId(), "PREPAY_REMAINDER", 350_000);
        stubCreatePayment("pay-lost-1", "https://gateway.test/confirm/lost");
        startPayment(orderId, "prepay").expectStatus().isOk();
        stubPaymentStatus("pay-lost-1", "succeeded");

        // When
        SweepReport report = reconciliationService.sweepExpired(afterPaymentTimeout());

        // Then
        assertThat(report.settled()).isGreaterThanOrEqualTo(1);
        assertThat(orderStatus(orderId)).isEqualTo("PAID_PARTIALLY");

        // And: the late webhook is a harmless duplicate
        int notices = outboxEventsFor(orderId).size();
        sendPaymentWebhook("payment.succeeded", "pay-lost-1", orderId, "prepay").expectStatus().isOk();
        assertThat(orderStatus(orderId)).isEqualTo("PAID_PARTIALLY");
        assertThat(outboxEventsFor(orderId)).hasSize(notices);
    }

    @Test
    @DisplayName("should_abandon_order_once_when_gateway_reports_cancellation")
    void should_abandon_order_once_when_gateway_reports_cancellation() {
        // Given
        String orderId = checkout(randomChatId(), "FULL", 350_000);
        stubCreatePayment("pay-expired-1", "https://gateway.test/confirm/expired");
        startPayment(orderId, "full").expectStatus().isOk();
        stubPaymentStatus("pay-expired-1", "canceled");
        int noticesBefore = outboxEventsFor(orderId).size();

        // When
        reconciliationService.sweepExpired(afterPaymentTimeout());
        int noticesAfterFirstSweep = outboxEventsFor(orderId).size();
        reconciliationService.sweepExpired(afterPaymentTimeout());

        // Then
        assertThat(orderStatus(orderId)).isEqualTo("ABANDONED");
        assertThat(noticesAfterFirstSweep).isEqualTo(noticesBefore + 1);
        assertThat(outboxEventsFor(orderId)).hasSize(noticesAfterFirstSweep);
        assertThat(outboxEventsFor(orderId))
                .filteredOn(event -> event.getPayload().contains("cancelled"))
                .hasSize(1);
    }

    @Test
    @DisplayName("should_notify_once_when_webhook_and_sweep_settle_the_same_payment_concurrently")
    void should_notify_once_when_webhook_and_sweep_settle_the_same_payment_concurrently() throws Exception {
        // Given: the gateway already reports success and the webhook is about to arrive
        String orderId = checkout(randomChatId(), "FULL", 350_000);
        stubCreatePayment("pay-race-1", "https://gateway.test/confirm/race");
        startPayment(orderId, "full").expectStatus().isOk();
        stubPaymentStatus("pay-race-1", "succeeded");
        int noticesBefore = outboxEventsFor(orderId).size();

        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);

        // When
        try {
            Future<?> webhook = executor.submit(() -> {
                start.await();
                sendPaymentWebhook("payment.succeeded", "pay-race-1", orderId, "full").expectStatus().isOk();
                return null;
            });
            Future<?> sweep = executor.submit(() -> {
                start.await();
                return reconciliationService.sweepExpired(afterPaymentTimeout());
            });
            start.countDown();
            webhook.get(15, TimeUnit.SECONDS);
            sweep.get(15, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }

        // Then: one transition, one owner notice and one operator notice
        assertThat(orderStatus(orderId)).isEqualTo("PAID_FULL");
        assertThat(outboxEventsFor(orderId)).hasSize(noticesBefore + 2);
    }

    @Test
    @DisplayName("should_defer_when_gateway_status_query_fails")
    void should_defer_when_gateway_status_query_fails() {
        // Given
        String orderId = checkout(randomChatId(), "FULL", 350_000);
        stubCreatePayment("pay-silent-1", "https://gateway.test/confirm/silent");
        startPayment(orderId, "full").expectStatus().isOk();
        stubPaymentStatusFailure("pay-silent-1");

        // When
        SweepReport report = reconciliationService.sweepExpired(afterPaymentTimeout());

        // Then: retried, then left for the next sweep
        assertThat(report.deferred()).isGreaterThanOrEqualTo(1);
        assertThat(orderStatus(orderId)).isEqualTo("PENDING_PAYMENT");
        gatewayServer.verify(3, getRequestedFor(urlEqualTo("/v3/payments/pay-silent-1")));
    }

    @Test
    @DisplayName("should_not_touch_orders_before_timeout")
    void should_not_touch_orders_before_timeout() {
        // Given
        String orderId = checkout(randomChatId(), "FULL", 350_000);
        stubCreatePayment("pay-fresh-1", "https://gateway.test/confirm/fresh");
        startPayment(orderId, "full").expectStatus().isOk();
        stubPaymentStatus("pay-fresh-1", "canceled");

        // When
        reconciliationService.sweepExpired(Instant.now());

        // Then
        assertThat(orderStatus(orderId)).isEqualTo("PENDING_PAYMENT");
        gatewayServer.verify(0, getRequestedFor(urlEqualTo("/v3/payments/pay-fresh-1")));
    }

    @Test
    @DisplayName("should_alert_operator_when_payment_succeeds_after_abandonment")
    void should_alert_operator_when_payment_succeeds_after_abandonment() {
        // Given: order abandoned by the sweep
        String orderId = checkout(randomChatId(), "FULL", 350_000);
        stubCreatePayment("pay-late-1", "https://gateway.test/confirm/late");
        startPayment(orderId, "full").expectStatus().isOk();
        stubPaymentStatus("pay-late-1", "canceled");
        reconciliationService.sweepExpired(afterPaymentTimeout());
        assertThat(orderStatus(orderId)).isEqualTo("ABANDONED");

        // When: the gateway reports success after all
        sendPaymentWebhook("payment.succeeded", "pay-late-1", orderId, "full").expectStatus().isOk();

        // Then: the order stays closed and an operator is told to refund
        assertThat(orderStatus(orderId)).isEqualTo("ABANDONED");
        assertThat(outboxEventsFor(orderId))
                .anyMatch(event -> event.getPayload().contains("pay-late-1")
                        && event.getPayload().contains("double charge"));
    }

    @Test
    @DisplayName("should_expire_overdue_remainder_without_abandoning_prepaid_order")
    void should_expire_overdue_remainder_without_abandoning_prepaid_order() {
        // Given: prepaid order with an unanswered remainder attempt
        String orderId = checkout(randomChatId(), "PREPAY_REMAINDER", 350_000);
        stubCreatePayment("pay-pre-2", "https://gateway.test/confirm/pre2");
        startPayment(orderId, "prepay").expectStatus().isOk();
        sendPaymentWebhook("payment.succeeded", "pay-pre-2", orderId, "prepay").expectStatus().isOk();
        gatewayServer.resetAll();
        stubCreatePayment("pay-rem-2", "https://gateway.test/confirm/rem2");
        startPayment(orderId, "remainder").expectStatus().isOk();
        stubPaymentStatus("pay-rem-2", "pending");

        // When
        reconciliationService.sweepExpired(afterPaymentTimeout());

        // Then
        webTestClient.get()
                .uri("/api/orders/{id}", orderId)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("PAID_PARTIALLY")
                .jsonPath("$.payments[?(@.gatewayId == 'pay-rem-2')].status").isEqualTo("EXPIRED");
    }

    @Test
    @DisplayName("should_silently_abandon_stale_checkout")
    void should_silently_abandon_stale_checkout() {
        // Given: checkout confirmed, payment never started
        String orderId = checkout(randomChatId(), "FULL", 350_000);

        // When: a day later
        reconciliationService.sweepExpired(Instant.now().plus(Duration.ofHours(25)));

        // Then
        assertThat(orderStatus(orderId)).isEqualTo("ABANDONED");
        assertThat(outboxEventsFor(orderId)).isEmpty();
    }
}
