package com.example.fulfillment.integration;

import com.example.fulfillment.application.exception.CarrierException;
import com.example.fulfillment.application.port.in.RequestShipmentUseCase;
import com.example.fulfillment.application.service.ShipmentTrackingService;
import com.example.fulfillment.domain.model.OrderId;
import com.example.fulfillment.infrastructure.persistence.OrderPersistenceService;
import com.example.fulfillment.support.WireMockTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Carrier hand-over and tracking.
 *
 * BDD Scenarios:
 * - Given an assembled order, When several operators press "ship" at once, Then the carrier sees one request
 * - Given a carrier failure, When the operator retries, Then the order ships on the second attempt
 * - Given a shipped order, When the poller sees a tracking number, Then the owner is told exactly once
 */
@DisplayName("Shipment Integration Tests")
class ShipmentIntegrationTest extends WireMockTestSupport {

    @Autowired
    private RequestShipmentUseCase requestShipmentUseCase;

    @Autowired
    private ShipmentTrackingService trackingService;

    @Autowired
    private OrderPersistenceService persistenceService;

    @BeforeEach
    void stubToken() {
        stubCarrierToken();
    }

    @Nested
    @DisplayName("Shipment creation")
    class ShipmentCreation {

        @Test
        @DisplayName("should_ship_assembled_order_with_placeholder_tracking")
        void should_ship_assembled_order_with_placeholder_tracking() {
            // Given
            String orderId = assembledOrder(randomChatId());
            stubCarrierToken();
            stubCreateShipment("carrier-uuid-1");

            // When
            webTestClient.post()
                    .uri("/api/admin/orders/{id}/shipment", orderId)
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.status").isEqualTo("ACCEPTED")
                    .jsonPath("$.carrierId").isEqualTo("carrier-uuid-1")
                    .jsonPath("$.trackingNumber").isEqualTo("BOX" + orderId);

            // Then
            assertThat(orderStatus(orderId)).isEqualTo("SHIPPED");
            carrierServer.verify(1, postRequestedFor(urlEqualTo("/v2/orders"))
                    .withHeader("X-Idempotency-Key", equalTo(orderId))
                    .withHeader("Authorization", equalTo("Bearer carrier-token")));
        }

        @Test
        @DisplayName("should_call_carrier_once_when_shipment_requested_concurrently")
        void should_call_carrier_once_when_shipment_requested_concurrently() throws Exception {
            // Given: a slow carrier widens the race window
            String orderId = assembledOrder(randomChatId());
            stubCarrierToken();
            stubCreateShipment("carrier-uuid-race", 300);
            OrderId id = OrderId.of(orderId);

            int callers = 5;
            ExecutorService executor = Executors.newFixedThreadPool(callers);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<String>> results = new ArrayList<>();

            // When
            try {
                for (int i = 0; i < callers; i++) {
                    Callable<String> call = () -> {
                        start.await();
                        return requestShipmentUseCase.requestShipment(id).carrierId();
                    };
                    results.add(executor.submit(call));
                }
                start.countDown();

                // Then: every caller sees the same shipment
                for (Future<String> result : results) {
                    assertThat(result.get(10, TimeUnit.SECONDS)).isEqualTo("carrier-uuid-race");
                }
            } finally {
                executor.shutdownNow();
            }

            verifyShipmentCreatedTimes(1);
            assertThat(orderStatus(orderId)).isEqualTo("SHIPPED");
        }

        @Test
        @DisplayName("should_keep_order_assembled_after_carrier_failure_and_ship_on_retry")
        void should_keep_order_assembled_after_carrier_failure_and_ship_on_retry() {
            // Given
            String orderId = assembledOrder(randomChatId());
            stubCarrierToken();
            stubCreateShipmentFailureThenSuccess("carrier-uuid-retry");

            // When: first attempt fails
            webTestClient.post()
                    .uri("/api/admin/orders/{id}/shipment", orderId)
                    .exchange()
                    .expectStatus().isEqualTo(502);

            // Then
            assertThat(orderStatus(orderId)).isEqualTo("ASSEMBLED");
            assertThat(outboxEventsFor(orderId))
                    .anyMatch(event -> event.getPayload().contains("Shipment creation failed"));

            // When: operator retries
            webTestClient.post()
                    .uri("/api/admin/orders/{id}/shipment", orderId)
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.carrierId").isEqualTo("carrier-uuid-retry");

            // Then
            assertThat(orderStatus(orderId)).isEqualTo("SHIPPED");
            verifyShipmentCreatedTimes(2);
        }

        @Test
        @DisplayName("should_refuse_shipment_for_unassembled_order")
        void should_refuse_shipment_for_unassembled_order() {
            // Given
            String orderId = checkout(randomChatId(), "FULL", 350_000);

            // When & Then
            webTestClient.post()
                    .uri("/api/admin/orders/{id}/shipment", orderId)
                    .exchange()
                    .expectStatus().isEqualTo(409)
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("ORDER_STATE_CONFLICT");
            verifyShipmentCreatedTimes(0);
        }

        @Test
        @DisplayName("should_surface_carrier_rejection_and_keep_order_assembled")
        void should_surface_carrier_rejection_and_keep_order_assembled() {
            // Given
            String orderId = assembledOrder(randomChatId());
            stubCarrierToken();
            carrierServer.stubFor(post(urlEqualTo("/v2/orders"))
                    .willReturn(aResponse()
                            .withStatus(400)
                            .withHeader("Content-Type", "application/json")
                            .withBody("{\"requests\": [{\"state\": \"INVALID\"}]}")));

            // When & Then: rejections are not retried
            assertThatThrownBy(() -> requestShipmentUseCase.requestShipment(OrderId.of(orderId)))
                    .isInstanceOf(CarrierException.class);
            assertThat(orderStatus(orderId)).isEqualTo("ASSEMBLED");
            verifyShipmentCreatedTimes(1);
        }
    }

    @Nested
    @DisplayName("Unknown carrier outcome")
    class UnknownOutcome {

        /** An assembled order whose carrier call never reported back. */
        private String orderWithUnfinishedCarrierCall() {
            String orderId = assembledOrder(randomChatId());
            persistenceService.claimShipment(OrderId.of(orderId));
            return orderId;
        }

        @Test
        @DisplayName("should_refuse_new_carrier_call_while_outcome_is_unknown")
        void should_refuse_new_carrier_call_while_outcome_is_unknown() {
            // Given
            String orderId = orderWithUnfinishedCarrierCall();
            stubCreateShipment("carrier-uuid-never");

            // When & Then
            webTestClient.post()
                    .uri("/api/admin/orders/{id}/shipment", orderId)
                    .exchange()
                    .expectStatus().isEqualTo(502);
            assertThat(orderStatus(orderId)).isEqualTo("ASSEMBLED");
            assertThat(outboxEventsFor(orderId))
                    .anyMatch(event -> event.getPayload().contains("unfinished carrier request"));
            verifyShipmentCreatedTimes(0);
        }

        @Test
        @DisplayName("should_ship_after_operator_releases_the_request")
        void should_ship_after_operator_releases_the_request() {
            // Given
            String orderId = orderWithUnfinishedCarrierCall();
            stubCreateShipment("carrier-uuid-released");

            // When: operator checked the carrier account and found nothing
            webTestClient.post()
                    .uri("/api/admin/orders/{id}/shipment/resolve", orderId)
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.status").isEqualTo("FAILED");
            assertThat(orderStatus(orderId)).isEqualTo("ASSEMBLED");

            // Then: a manual retry reaches the carrier
            webTestClient.post()
                    .uri("/api/admin/orders/{id}/shipment", orderId)
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.carrierId").isEqualTo("carrier-uuid-released");
            assertThat(orderStatus(orderId)).isEqualTo("SHIPPED");
            verifyShipmentCreatedTimes(1);
        }

        @Test
        @DisplayName("should_ship_with_carrier_id_found_by_operator_without_calling_carrier")
        void should_ship_with_carrier_id_found_by_operator_without_calling_carrier() {
            // Given
            String orderId = orderWithUnfinishedCarrierCall();

            // When
            webTestClient.post()
                    .uri("/api/admin/orders/{id}/shipment/resolve", orderId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("carrierId", "carrier-uuid-found"))
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.status").isEqualTo("ACCEPTED")
                    .jsonPath("$.carrierId").isEqualTo("carrier-uuid-found")
                    .jsonPath("$.trackingNumber").isEqualTo("BOX" + orderId);

            // Then
            assertThat(orderStatus(orderId)).isEqualTo("SHIPPED");
            verifyShipmentCreatedTimes(0);
        }

        @Test
        @DisplayName("should_reject_resolution_when_nothing_is_pending")
        void should_reject_resolution_when_nothing_is_pending() {
            // Given
            String orderId = assembledOrder(randomChatId());

            // When & Then
            webTestClient.post()
                    .uri("/api/admin/orders/{id}/shipment/resolve", orderId)
                    .exchange()
                    .expectStatus().isEqualTo(409);
            assertThat(orderStatus(orderId)).isEqualTo("ASSEMBLED");
        }
    }

    @Nested
    @DisplayName("Tracking")
    class Tracking {

        private String shippedOrder(String carrierUuid) {
            String orderId = assembledOrder(randomChatId());
            stubCarrierToken();
            stubCreateShipment(carrierUuid);
            requestShipmentUseCase.requestShipment(OrderId.of(orderId));
            return orderId;
        }

        @Test
        @DisplayName("should_notify_owner_of_tracking_number_once")
        void should_notify_owner_of_tracking_number_once() {
            // Given
            String orderId = shippedOrder("carrier-uuid-track");
            stubCarrierShipment("carrier-uuid-track", "1234567890",
                    "RECEIVED_AT_SHIPMENT_WAREHOUSE", "Received at warehouse");

            // When: polled twice with the same answer
            trackingService.pollShipments(100);
            trackingService.pollShipments(100);

            // Then
            webTestClient.get()
                    .uri("/api/orders/{id}", orderId)
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.trackingNumber").isEqualTo("1234567890")
                    .jsonPath("$.shipment.lastCarrierStatus").isEqualTo("ACCEPTED_AT_SENDER_WAREHOUSE");

            long trackingNotices = outboxEventsFor(orderId).stream()
                    .filter(event -> event.getPayload().contains("Tracking number: 1234567890"))
                    .count();
            assertThat(trackingNotices).isEqualTo(1);
            long warehouseNotices = outboxEventsFor(orderId).stream()
                    .filter(event -> event.getPayload().contains("accepted by the carrier"))
                    .count();
            assertThat(warehouseNotices).isEqualTo(1);
        }

        @Test
        @DisplayName("should_keep_placeholder_until_carrier_assigns_number")
        void should_keep_placeholder_until_carrier_assigns_number() {
            // Given
            String orderId = shippedOrder("carrier-uuid-nonum");
            stubCarrierShipment("carrier-uuid-nonum", null, "CREATED", "Created");

            // When
            trackingService.pollShipments(100);

            // Then
            webTestClient.get()
                    .uri("/api/orders/{id}", orderId)
                    .exchange()
                    .expectBody()
                    .jsonPath("$.trackingNumber").isEqualTo("BOX" + orderId);
        }

        @Test
        @DisplayName("should_stop_polling_after_delivery_and_allow_archive")
        void should_stop_polling_after_delivery_and_allow_archive() {
            // Given
            String orderId = shippedOrder("carrier-uuid-done");
            stubCarrierShipment("carrier-uuid-done", "5555555555", "DELIVERED", "Delivered");
            trackingService.pollShipments(100);

            // When
            trackingService.pollShipments(100);

            // Then: the delivered shipment is no longer polled
            carrierServer.verify(1, getRequestedFor(
                    urlEqualTo("/v2/orders/carrier-uuid-done")));

            webTestClient.post()
                    .uri("/api/admin/orders/{id}/archive", orderId)
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.status").isEqualTo("ARCHIVED");
        }

        @Test
        @DisplayName("should_let_operator_override_tracking_number")
        void should_let_operator_override_tracking_number() {
            // Given
            String orderId = shippedOrder("carrier-uuid-manual");

            // When
            webTestClient.put()
                    .uri("/api/admin/orders/{id}/tracking", orderId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{\"trackingNumber\": \"MANUAL-42\"}")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.trackingNumber").isEqualTo("MANUAL-42");

            // Then: the poller never overwrites a real number
            stubCarrierShipment("carrier-uuid-manual", "9999999999", "CREATED", "Created");
            trackingService.pollShipments(100);
            assertThat(webTestClient.get()
                    .uri("/api/orders/{id}", orderId)
                    .exchange()
                    .expectBody(Map.class)
                    .returnResult()
                    .getResponseBody()
                    .get("trackingNumber"))
                    .isEqualTo("MANUAL-42");
        }
    }
}
