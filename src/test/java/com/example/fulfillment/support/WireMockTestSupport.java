package com.example.fulfillment.support;

import com.example.fulfillment.domain.model.OrderId;
import com.example.fulfillment.infrastructure.persistence.entity.OutboxEvent;
import com.example.fulfillment.infrastructure.persistence.repository.OutboxRepository;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import com.github.tomakehurst.wiremock.stubbing.Scenario;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

import static com.github.tomakehurst.wiremock.client.WireMock.*;

/**
 * Base class for integration tests that use WireMock and H2 in-memory database.
 * Provides WireMock servers for the payment gateway, the carrier and the
 * messaging bot, plus helpers that drive an order through the public API.
 *
 * Note: For Testcontainers PostgreSQL tests, extend PostgresTestContainerSupport instead.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_CLASS)
@ActiveProfiles("test")
public abstract class WireMockTestSupport {

    protected static final String BOT_TOKEN = "test-token";
    protected static final long OPERATOR_CHAT_ID = 999L;

    // Static servers initialized at class loading time (before @DynamicPropertySource)
    protected static WireMockServer gatewayServer;
    protected static WireMockServer carrierServer;
    protected static WireMockServer botServer;

    static {
        gatewayServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        carrierServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        botServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());

        gatewayServer.start();
        carrierServer.start();
        botServer.start();

        // Ensure servers are stopped when JVM exits
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            gatewayServer.stop();
            carrierServer.stop();
            botServer.stop();
        }));
    }

    @Autowired
    protected WebTestClient webTestClient;

    @Autowired
    protected OutboxRepository outboxRepository;

    @Autowired(required = false)
    private CircuitBreakerRegistry circuitBreakerRegistry;

    @BeforeEach
    void resetStateBeforeTest() {
        gatewayServer.resetAll();
        carrierServer.resetAll();
        botServer.resetAll();

        if (circuitBreakerRegistry != null) {
            circuitBreakerRegistry.getAllCircuitBreakers()
                    .forEach(cb -> cb.reset());
        }
    }

    @AfterEach
    void resetWireMockServers() {
        gatewayServer.resetAll();
        carrierServer.resetAll();
        botServer.resetAll();
    }

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("services.payment.base-url", () -> gatewayServer.baseUrl());
        registry.add("services.carrier.base-url", () -> carrierServer.baseUrl());
        registry.add("services.notification.base-url", () -> botServer.baseUrl());
        registry.add("services.notification.bot-token", () -> BOT_TOKEN);

        // H2 in-memory database configuration (for portability)
        registry.add("spring.datasource.url", () -> "jdbc:h2:mem:fulfillment_test;DB_CLOSE_DELAY=-1;DB_CLOSE_ON_EXIT=FALSE");
        registry.add("spring.datasource.username", () -> "sa");
        registry.add("spring.datasource.password", () -> "");
        registry.add("spring.datasource.driver-class-name", () -> "org.h2.Driver");
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "create-drop");
        registry.add("spring.jpa.properties.hibernate.dialect", () -> "org.hibernate.dialect.H2Dialect");
    }

    // ==================== Order Helpers ====================

    protected static long randomChatId() {
        return ThreadLocalRandom.current().nextLong(1_000_000L, 9_000_000_000L);
    }

    protected static String checkoutJson(long chatId, String fulfillmentKind, long totalAmount) {
        return """
                {
                    "chatId": %d,
                    "fullName": "Anna Ivanova",
                    "phone": "+7 (900) 123-45-67",
                    "email": "anna@example.com",
                    "totalAmount": %d,
                    "fulfillmentKind": "%s",
                    "deliveryAddress": "Moscow, Tverskaya 1",
                    "pickupPointCode": "MSK42",
                    "postalCode": "125009",
                    "deliveryCost": 39000,
                    "deliveryPeriod": "2-4 days"
                }
                """.formatted(chatId, totalAmount, fulfillmentKind);
    }

    /**
     * Confirms checkout through the API and returns the new order id.
     */
    protected String checkout(long chatId, String fulfillmentKind, long totalAmount) {
        return webTestClient.post()
                .uri("/api/orders")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(checkoutJson(chatId, fulfillmentKind, totalAmount))
                .exchange()
                .expectStatus().isCreated()
                .expectBody(Map.class)
                .returnResult()
                .getResponseBody()
                .get("orderId")
                .toString();
    }

    protected WebTestClient.ResponseSpec startPayment(String orderId, String kind) {
        return webTestClient.post()
                .uri("/api/orders/{id}/payments", orderId)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"kind\": \"%s\"}".formatted(kind))
                .exchange();
    }

    protected WebTestClient.ResponseSpec sendPaymentWebhook(String event, String gatewayId,
                                                            String orderId, String kind) {
        return webTestClient.post()
                .uri("/webhooks/payments")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(webhookJson(event, gatewayId, orderId, kind))
                .exchange();
    }

    protected static String webhookJson(String event, String gatewayId, String orderId, String kind) {
        return """
                {
                    "type": "notification",
                    "event": "%s",
                    "object": {
                        "id": "%s",
                        "status": "%s",
                        "metadata": {
                            "order_id": "%s",
                            "payment_kind": "%s"
                        }
                    }
                }
                """.formatted(event, gatewayId,
                "payment.succeeded".equals(event) ? "succeeded" : "canceled", orderId, kind);
    }

    protected String orderStatus(String orderId) {
        return webTestClient.get()
                .uri("/api/orders/{id}", orderId)
                .exchange()
                .expectStatus().isOk()
                .expectBody(Map.class)
                .returnResult()
                .getResponseBody()
                .get("status")
                .toString();
    }

    /**
     * Takes a FULL order all the way to ASSEMBLED: payment, webhook and assembly.
     */
    protected String assembledOrder(long chatId) {
        String orderId = checkout(chatId, "FULL", 350_000);
        String gatewayId = "pay-" + orderId;
        stubCreatePayment(gatewayId, "https://gateway.test/confirm/" + gatewayId);
        startPayment(orderId, "full").expectStatus().isOk();
        sendPaymentWebhook("payment.succeeded", gatewayId, orderId, "full").expectStatus().isOk();
        webTestClient.post()
                .uri("/api/admin/orders/{id}/assemble", orderId)
                .exchange()
                .expectStatus().isOk();
        gatewayServer.resetAll();
        return orderId;
    }

    protected List<OutboxEvent> outboxEventsFor(String orderId) {
        return outboxRepository.findByAggregateIdOrderByCreatedAtAsc(OrderId.of(orderId).getValue());
    }

    // ==================== Payment Gateway Stubs ====================

    protected void stubCreatePayment(String gatewayId, String confirmationUrl) {
        gatewayServer.stubFor(post(urlEqualTo("/v3/payments"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody("""
                                {
                                    "id": "%s",
                                    "status": "pending",
                                    "paid": false,
                                    "confirmation": {
                                        "type": "redirect",
                                        "confirmation_url": "%s"
                                    }
                                }
                                """.formatted(gatewayId, confirmationUrl))));
    }

    protected void stubCreatePaymentFailure(int status) {
        gatewayServer.stubFor(post(urlEqualTo("/v3/payments"))
                .willReturn(aResponse()
                        .withStatus(status)
                        .withHeader("Content-Type", "application/json")
                        .withBody("""
                                {
                                    "type": "error",
                                    "code": "internal_server_error"
                                }
                                """)));
    }

    protected void stubPaymentStatus(String gatewayId, String status) {
        gatewayServer.stubFor(get(urlEqualTo("/v3/payments/" + gatewayId))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody("""
                                {
                                    "id": "%s",
                                    "status": "%s",
                                    "paid": %s
                                }
                                """.formatted(gatewayId, status, "succeeded".equals(status)))));
    }

    protected void stubPaymentStatusFailure(String gatewayId) {
        gatewayServer.stubFor(get(urlEqualTo("/v3/payments/" + gatewayId))
                .willReturn(aResponse()
                        .withStatus(503)
                        .withHeader("Content-Type", "application/json")
                        .withBody("{\"type\": \"error\"}")));
    }

    protected void verifyPaymentCreatedTimes(int count) {
        gatewayServer.verify(count, postRequestedFor(urlEqualTo("/v3/payments")));
    }

    // ==================== Carrier Stubs ====================

    protected void stubCarrierToken() {
        carrierServer.stubFor(post(urlEqualTo("/v2/oauth/token"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody("""
                                {
                                    "access_token": "carrier-token",
                                    "token_type": "bearer",
                                    "expires_in": 3600
                                }
                                """)));
    }

    protected void stubCreateShipment(String carrierUuid) {
        stubCreateShipment(carrierUuid, 0);
    }

    protected void stubCreateShipment(String carrierUuid, int delayMs) {
        carrierServer.stubFor(post(urlEqualTo("/v2/orders"))
                .willReturn(aResponse()
                        .withStatus(202)
                        .withFixedDelay(delayMs)
                        .withHeader("Content-Type", "application/json")
                        .withBody("""
                                {
                                    "entity": { "uuid": "%s" },
                                    "requests": [ { "type": "CREATE", "state": "ACCEPTED" } ]
                                }
                                """.formatted(carrierUuid))));
    }

    /**
     * First creation attempt fails with 500, later ones succeed.
     */
    protected void stubCreateShipmentFailureThenSuccess(String carrierUuid) {
        String scenarioName = "CarrierFailureThenSuccess";

        carrierServer.stubFor(post(urlEqualTo("/v2/orders"))
                .inScenario(scenarioName)
                .whenScenarioStateIs(Scenario.STARTED)
                .willSetStateTo("Recovered")
                .willReturn(aResponse()
                        .withStatus(500)
                        .withHeader("Content-Type", "application/json")
                        .withBody("{\"errors\": [{\"code\": \"v2_internal_error\"}]}")));

        carrierServer.stubFor(post(urlEqualTo("/v2/orders"))
                .inScenario(scenarioName)
                .whenScenarioStateIs("Recovered")
                .willReturn(aResponse()
                        .withStatus(202)
                        .withHeader("Content-Type", "application/json")
                        .withBody("""
                                {
                                    "entity": { "uuid": "%s" }
                                }
                                """.formatted(carrierUuid))));
    }

    protected void stubCarrierShipment(String carrierUuid, String carrierNumber, String statusCode, String statusName) {
        carrierServer.stubFor(get(urlEqualTo("/v2/orders/" + carrierUuid))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody("""
                                {
                                    "entity": {
                                        "uuid": "%s",
                                        "cdek_number": %s,
                                        "statuses": [
                                            { "code": "%s", "name": "%s", "date_time": "2026-02-02T10:00:00+0000" },
                                            { "code": "CREATED", "name": "Created", "date_time": "2026-02-01T10:00:00+0000" }
                                        ]
                                    }
                                }
                                """.formatted(carrierUuid,
                                carrierNumber == null ? "null" : "\"" + carrierNumber + "\"",
                                statusCode, statusName))));
    }

    protected void verifyShipmentCreatedTimes(int count) {
        carrierServer.verify(count, postRequestedFor(urlEqualTo("/v2/orders")));
    }

    // ==================== Bot Stubs ====================

    protected void stubSendMessage() {
        botServer.stubFor(post(urlEqualTo("/bot" + BOT_TOKEN + "/sendMessage"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody("{\"ok\": true}")));
    }
}
