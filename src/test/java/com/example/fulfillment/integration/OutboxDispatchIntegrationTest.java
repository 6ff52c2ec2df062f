package com.example.fulfillment.integration;

import com.example.fulfillment.infrastructure.persistence.entity.OutboxEvent;
import com.example.fulfillment.infrastructure.persistence.entity.OutboxEventStatus;
import com.example.fulfillment.support.WireMockTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.context.TestPropertySource;

import java.util.concurrent.TimeUnit;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Notifications recorded with a state change are delivered by the outbox
 * poller after commit.
 */
@DisplayName("Outbox Dispatch Integration Tests")
@TestPropertySource(properties = {
        "outbox.poller.enabled=true",
        "outbox.poller.interval-ms=200"
})
class OutboxDispatchIntegrationTest extends WireMockTestSupport {

    @Test
    @DisplayName("should_deliver_owner_and_operator_notices_after_payment")
    void should_deliver_owner_and_operator_notices_after_payment() {
        // Given
        stubSendMessage();
        long chatId = randomChatId();
        String orderId = checkout(chatId, "FULL", 350_000);
        stubCreatePayment("pay-outbox-1", "https://gateway.test/confirm/outbox");
        startPayment(orderId, "full").expectStatus().isOk();

        // When
        sendPaymentWebhook("payment.succeeded", "pay-outbox-1", orderId, "full").expectStatus().isOk();

        // Then
        await().atMost(10, TimeUnit.SECONDS).untilAsserted(() -> {
            botServer.verify(postRequestedFor(urlEqualTo("/bot" + BOT_TOKEN + "/sendMessage"))
                    .withRequestBody(matchingJsonPath("$.chat_id", equalTo(String.valueOf(chatId)))));
            botServer.verify(postRequestedFor(urlEqualTo("/bot" + BOT_TOKEN + "/sendMessage"))
                    .withRequestBody(matchingJsonPath("$.chat_id", equalTo(String.valueOf(OPERATOR_CHAT_ID)))));
            assertThat(outboxEventsFor(orderId))
                    .extracting(OutboxEvent::getStatus)
                    .containsOnly(OutboxEventStatus.PROCESSED);
        });
    }

    @Test
    @DisplayName("should_keep_state_change_when_delivery_fails")
    void should_keep_state_change_when_delivery_fails() {
        // Given: the bot API is down
        botServer.stubFor(post(urlEqualTo("/bot" + BOT_TOKEN + "/sendMessage"))
                .willReturn(aResponse().withStatus(503)));
        String orderId = checkout(randomChatId(), "FULL", 350_000);
        stubCreatePayment("pay-outbox-2", "https://gateway.test/confirm/outbox2");
        startPayment(orderId, "full").expectStatus().isOk();

        // When
        sendPaymentWebhook("payment.succeeded", "pay-outbox-2", orderId, "full").expectStatus().isOk();

        // Then: the order is paid regardless, the notices wait for a retry
        assertThat(orderStatus(orderId)).isEqualTo("PAID_FULL");
        await().atMost(10, TimeUnit.SECONDS).untilAsserted(() ->
                assertThat(outboxEventsFor(orderId))
                        .extracting(OutboxEvent::getStatus)
                        .contains(OutboxEventStatus.FAILED));
    }
}
