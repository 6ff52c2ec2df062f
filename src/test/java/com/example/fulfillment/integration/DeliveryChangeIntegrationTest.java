package com.example.fulfillment.integration;

import com.example.fulfillment.support.WireMockTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Owner-initiated change of pickup point.
 *
 * BDD Scenarios:
 * - Given an unshipped order, When the owner picks another pickup point, Then the order and operators are updated
 * - Given an assembled order with a new pickup point, When it ships, Then the carrier gets the new destination
 * - Given a shipped order, When the owner tries to move it, Then the change is refused
 */
@DisplayName("Delivery Change Integration Tests")
class DeliveryChangeIntegrationTest extends WireMockTestSupport {

    private WebTestClient.ResponseSpec changeDelivery(String orderId, Map<String, Object> body) {
        return webTestClient.put()
                .uri("/api/orders/{id}/delivery", orderId)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange();
    }

    private static Map<String, Object> ekbPickupPoint() {
        return Map.of(
                "deliveryAddress", "Ekaterinburg, Profsoyuznaya 93",
                "pickupPointCode", "EKB7",
                "postalCode", "620000");
    }

    @Test
    @DisplayName("should_change_pickup_point_of_new_order_and_tell_operator")
    void should_change_pickup_point_of_new_order_and_tell_operator() {
        // Given
        String orderId = checkout(randomChatId(), "FULL", 350_000);

        // When
        changeDelivery(orderId, ekbPickupPoint())
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("NEW")
                .jsonPath("$.deliveryAddress").isEqualTo("Ekaterinburg, Profsoyuznaya 93")
                .jsonPath("$.pickupPointCode").isEqualTo("EKB7");

        // Then
        assertThat(outboxEventsFor(orderId))
                .anyMatch(event -> event.getPayload().contains("Pickup point updated for order " + orderId)
                        && event.getPayload().contains("EKB7"));
    }

    @Test
    @DisplayName("should_ship_assembled_order_to_the_new_pickup_point")
    void should_ship_assembled_order_to_the_new_pickup_point() {
        // Given
        String orderId = assembledOrder(randomChatId());
        changeDelivery(orderId, ekbPickupPoint()).expectStatus().isOk();
        stubCarrierToken();
        stubCreateShipment("carrier-uuid-moved");

        // When
        webTestClient.post()
                .uri("/api/admin/orders/{id}/shipment", orderId)
                .exchange()
                .expectStatus().isOk();

        // Then
        carrierServer.verify(1, postRequestedFor(urlEqualTo("/v2/orders"))
                .withRequestBody(matchingJsonPath("$.to_location.code", equalTo("EKB7")))
                .withRequestBody(matchingJsonPath("$.to_location.postal_code", equalTo("620000"))));
    }

    @Test
    @DisplayName("should_refuse_change_after_order_is_shipped")
    void should_refuse_change_after_order_is_shipped() {
        // Given
        String orderId = assembledOrder(randomChatId());
        stubCarrierToken();
        stubCreateShipment("carrier-uuid-gone");
        webTestClient.post()
                .uri("/api/admin/orders/{id}/shipment", orderId)
                .exchange()
                .expectStatus().isOk();
        int notices = outboxEventsFor(orderId).size();

        // When & Then
        changeDelivery(orderId, ekbPickupPoint())
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.error").isEqualTo("ORDER_STATE_CONFLICT");
        webTestClient.get()
                .uri("/api/orders/{id}", orderId)
                .exchange()
                .expectBody()
                .jsonPath("$.pickupPointCode").isEqualTo("MSK42");
        assertThat(outboxEventsFor(orderId)).hasSize(notices);
    }

    @Test
    @DisplayName("should_reject_change_without_pickup_point")
    void should_reject_change_without_pickup_point() {
        String orderId = checkout(randomChatId(), "FULL", 350_000);

        changeDelivery(orderId, Map.of("deliveryAddress", "Somewhere"))
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_REQUEST");
    }
}
