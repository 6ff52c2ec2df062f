package com.example.fulfillment.infrastructure.adapter.out.carrier;

import com.example.fulfillment.application.exception.CarrierException;
import com.example.fulfillment.application.port.out.CarrierPort;
import com.example.fulfillment.infrastructure.adapter.out.carrier.dto.CarrierOrderResponse;
import com.example.fulfillment.infrastructure.adapter.out.carrier.dto.CarrierTokenResponse;
import com.example.fulfillment.infrastructure.adapter.out.carrier.mapper.CarrierMapper;
import com.example.fulfillment.infrastructure.exception.NonRetryableServiceException;
import com.example.fulfillment.infrastructure.exception.RetryableServiceException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.github.resilience4j.timelimiter.annotation.TimeLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Adapter for the shipping carrier.
 * <p>
 * Shipment creation: TimeLimiter → CircuitBreaker → HTTP call, never retried.
 * The order id travels as X-Idempotency-Key and the order number is derived
 * from it, so the carrier can recognise a repeat on its side as well.
 * <p>
 * Shipment lookup: Retry → CircuitBreaker → TimeLimiter → HTTP call.
 */
@Component
public class CarrierAdapter implements CarrierPort {

    private static final Logger log = LoggerFactory.getLogger(CarrierAdapter.class);
    private static final String SERVICE_NAME = "carrier";
    private static final long TOKEN_EXPIRY_MARGIN_SECONDS = 60;

    private final WebClient webClient;
    private final CarrierMapper mapper;
    private final ObjectMapper objectMapper;
    private final String clientId;
    private final String clientSecret;

    private volatile CachedToken cachedToken;

    public CarrierAdapter(
            @Qualifier("carrierWebClient") WebClient webClient,
            CarrierMapper mapper,
            ObjectMapper objectMapper,
            @Value("${services.carrier.client-id}") String clientId,
            @Value("${services.carrier.client-secret}") String clientSecret) {
        this.webClient = webClient;
        this.mapper = mapper;
        this.objectMapper = objectMapper;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
    }

    @Override
    @TimeLimiter(name = "carrierTL")
    @CircuitBreaker(name = "carrierCB", fallbackMethod = "createShipmentFallback")
    public CompletableFuture<CarrierShipment> createShipment(ShipmentOrder order) {
        log.debug("Creating carrier shipment {} for order: {}", order.number(), order.orderId());

        return accessToken()
                .flatMap(token -> webClient.post()
                        .uri("/v2/orders")
                        .headers(headers -> {
                            headers.setBearerAuth(token);
                            headers.set("X-Idempotency-Key", order.orderId().getValue());
                        })
                        .bodyValue(mapper.toRequest(order))
                        .retrieve()
                        .onStatus(HttpStatusCode::is4xxClientError, response ->
                                rejected(response, "Carrier rejected the shipment: "))
                        .onStatus(HttpStatusCode::is5xxServerError, this::unavailable)
                        .bodyToMono(String.class))
                .map(raw -> toShipment(raw, order))
                .toFuture();
    }

    @Override
    @TimeLimiter(name = "carrierTL")
    @CircuitBreaker(name = "carrierCB")
    @Retry(name = "carrierQueryRetry", fallbackMethod = "getShipmentFallback")
    public CompletableFuture<CarrierTracking> getShipment(String carrierId) {
        log.debug("Fetching carrier shipment: {}", carrierId);

        return accessToken()
                .flatMap(token -> webClient.get()
                        .uri("/v2/orders/{uuid}", carrierId)
                        .headers(headers -> headers.setBearerAuth(token))
                        .retrieve()
                        .onStatus(HttpStatusCode::is4xxClientError, response ->
                                rejected(response, "Carrier lookup rejected: "))
                        .onStatus(HttpStatusCode::is5xxServerError, this::unavailable)
                        .bodyToMono(CarrierOrderResponse.class))
                .map(mapper::toTracking)
                .toFuture();
    }

    /**
     * OAuth2 client-credentials token, reused until shortly before it expires.
     */
    Mono<String> accessToken() {
        CachedToken token = cachedToken;
        if (token != null && token.isValidAt(Instant.now())) {
            return Mono.just(token.value());
        }
        return webClient.post()
                .uri("/v2/oauth/token")
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(BodyInserters.fromFormData("grant_type", "client_credentials")
                        .with("client_id", clientId)
                        .with("client_secret", clientSecret))
                .retrieve()
                .onStatus(HttpStatusCode::is4xxClientError, response ->
                        rejected(response, "Carrier authentication failed: "))
                .onStatus(HttpStatusCode::is5xxServerError, this::unavailable)
                .bodyToMono(CarrierTokenResponse.class)
                .map(response -> {
                    if (response.accessToken() == null) {
                        throw NonRetryableServiceException.unusableAnswer(SERVICE_NAME, "Carrier returned no access token");
                    }
                    long ttl = Math.max(0, response.expiresIn() - TOKEN_EXPIRY_MARGIN_SECONDS);
                    cachedToken = new CachedToken(response.accessToken(), Instant.now().plusSeconds(ttl));
                    log.debug("Carrier token refreshed, valid for {} seconds", ttl);
                    return response.accessToken();
                });
    }

    private CarrierShipment toShipment(String raw, ShipmentOrder order) {
        CarrierOrderResponse response;
        try {
            response = objectMapper.readValue(raw, CarrierOrderResponse.class);
        } catch (JsonProcessingException e) {
            throw NonRetryableServiceException.unusableAnswer(SERVICE_NAME, "Unreadable carrier response", e);
        }
        String uuid = response.entity() != null ? response.entity().uuid() : null;
        if (uuid == null || uuid.isBlank()) {
            throw NonRetryableServiceException.unusableAnswer(SERVICE_NAME,
                    "Carrier did not accept shipment " + order.number() + ": " + raw);
        }
        log.info("Carrier accepted shipment {} for order {} as {}", order.number(), order.orderId(), uuid);
        return new CarrierShipment(uuid, raw);
    }

    private Mono<? extends Throwable> rejected(ClientResponse response, String prefix) {
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(body -> Mono.error(new NonRetryableServiceException(
                        SERVICE_NAME, response.statusCode().value(), prefix + body)));
    }

    private Mono<? extends Throwable> unavailable(ClientResponse response) {
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(body -> Mono.error(new RetryableServiceException(
                        SERVICE_NAME, response.statusCode().value(),
                        "Carrier temporarily unavailable")));
    }

    /**
     * Fallback when circuit breaker is open.
     */
    @SuppressWarnings("unused")
    private CompletableFuture<CarrierShipment> createShipmentFallback(
            ShipmentOrder order, CallNotPermittedException ex) {

        log.warn("Circuit breaker is OPEN for carrier, order: {}", order.orderId());

        return CompletableFuture.failedFuture(
                new CarrierException("Carrier is temporarily unavailable", ex));
    }

    /**
     * Fallback for any other failure, including timeouts. A timeout leaves
     * the outcome unknown; the caller treats it as a failure and alerts.
     */
    @SuppressWarnings("unused")
    private CompletableFuture<CarrierShipment> createShipmentFallback(ShipmentOrder order, Throwable throwable) {

        log.error("Shipment creation failed for order: {}, cause: {}", order.orderId(), throwable.toString());

        return CompletableFuture.failedFuture(
                new CarrierException("Shipment creation failed: " + throwable.getMessage(), throwable));
    }

    @SuppressWarnings("unused")
    private CompletableFuture<CarrierTracking> getShipmentFallback(String carrierId, Throwable throwable) {

        log.warn("Carrier lookup failed for {}: {}", carrierId, throwable.toString());

        return CompletableFuture.failedFuture(
                new CarrierException("Carrier status unavailable for " + carrierId, throwable));
    }

    private record CachedToken(String value, Instant expiresAt) {

        boolean isValidAt(Instant now) {
            return now.isBefore(expiresAt);
        }
    }
}
