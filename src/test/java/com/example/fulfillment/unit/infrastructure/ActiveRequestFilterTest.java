package com.example.fulfillment.unit.infrastructure;

import com.example.fulfillment.infrastructure.concurrency.OrderLockRegistry;
import com.example.fulfillment.infrastructure.config.ActiveRequestFilter;
import com.example.fulfillment.infrastructure.config.GracefulShutdownConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ActiveRequestFilter Tests")
class ActiveRequestFilterTest {

    private OrderLockRegistry lockRegistry;
    private GracefulShutdownConfig shutdownConfig;
    private ActiveRequestFilter filter;

    @BeforeEach
    void setUp() {
        lockRegistry = new OrderLockRegistry(4);
        shutdownConfig = new GracefulShutdownConfig(lockRegistry, 1);
        filter = new ActiveRequestFilter(shutdownConfig);
    }

    @Test
    @DisplayName("should_count_request_while_it_is_in_flight")
    void should_count_request_while_it_is_in_flight() {
        // Given
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.post("/api/orders"));
        AtomicInteger seenInFlight = new AtomicInteger(-1);

        // When
        filter.filter(exchange, ex -> {
            seenInFlight.set(shutdownConfig.getActiveRequestCount());
            return Mono.empty();
        }).block();

        // Then
        assertThat(seenInFlight.get()).isEqualTo(1);
        assertThat(shutdownConfig.getActiveRequestCount()).isZero();
    }

    @Test
    @DisplayName("should_refuse_order_mutations_while_draining")
    void should_refuse_order_mutations_while_draining() {
        // Given
        lockRegistry.beginShutdown();
        MockServerWebExchange exchange = MockServerWebExchange.from(
                MockServerHttpRequest.post("/api/admin/orders/x/shipment"));

        // When
        filter.filter(exchange, ex -> {
            fail("chain must not be reached");
            return Mono.empty();
        }).block();

        // Then
        assertThat(exchange.getResponse().getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(shutdownConfig.getActiveRequestCount()).isZero();
    }

    @Test
    @DisplayName("should_still_accept_reads_and_webhooks_while_draining")
    void should_still_accept_reads_and_webhooks_while_draining() {
        // Given
        lockRegistry.beginShutdown();
        AtomicInteger reached = new AtomicInteger();

        // When
        filter.filter(MockServerWebExchange.from(MockServerHttpRequest.get("/api/orders/x")),
                ex -> Mono.fromRunnable(reached::incrementAndGet)).block();
        filter.filter(MockServerWebExchange.from(MockServerHttpRequest.post("/webhooks/payments")),
                ex -> Mono.fromRunnable(reached::incrementAndGet)).block();

        // Then
        assertThat(reached.get()).isEqualTo(2);
    }
}
