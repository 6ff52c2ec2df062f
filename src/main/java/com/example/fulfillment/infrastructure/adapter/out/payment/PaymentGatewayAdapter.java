package com.example.fulfillment.infrastructure.adapter.out.payment;

import com.example.fulfillment.application.exception.GatewayException;
import com.example.fulfillment.application.port.out.PaymentGatewayPort;
import com.example.fulfillment.infrastructure.adapter.out.payment.dto.GatewayPaymentResponse;
import com.example.fulfillment.infrastructure.adapter.out.payment.mapper.PaymentGatewayMapper;
import com.example.fulfillment.infrastructure.exception.NonRetryableServiceException;
import com.example.fulfillment.infrastructure.exception.RetryableServiceException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.github.resilience4j.timelimiter.annotation.TimeLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Adapter for the payment gateway.
 * <p>
 * Intent creation: TimeLimiter → CircuitBreaker → HTTP call, never retried.
 * A fresh Idempotence-Key per call keeps the gateway from merging two
 * deliberate attempts; duplicates are prevented by the caller.
 * <p>
 * Status query: Retry → CircuitBreaker → TimeLimiter → HTTP call.
 */
@Component
public class PaymentGatewayAdapter implements PaymentGatewayPort {

    private static final Logger log = LoggerFactory.getLogger(PaymentGatewayAdapter.class);
    private static final String SERVICE_NAME = "payment-gateway";

    private final WebClient webClient;
    private final PaymentGatewayMapper mapper;
    private final String shopId;
    private final String secretKey;

    public PaymentGatewayAdapter(
            @Qualifier("paymentGatewayWebClient") WebClient webClient,
            PaymentGatewayMapper mapper,
            @Value("${services.payment.shop-id}") String shopId,
            @Value("${services.payment.secret-key}") String secretKey) {
        this.webClient = webClient;
        this.mapper = mapper;
        this.shopId = shopId;
        this.secretKey = secretKey;
    }

    @Override
    @TimeLimiter(name = "paymentTL")
    @CircuitBreaker(name = "paymentCB", fallbackMethod = "createIntentFallback")
    public CompletableFuture<PaymentIntent> createIntent(PaymentIntentRequest request) {
        log.debug("Creating {} payment intent for order: {}, amount: {}",
                request.kind().wireValue(), request.orderId(), request.amount());

        return webClient.post()
                .uri("/v3/payments")
                .headers(headers -> {
                    headers.setBasicAuth(shopId, secretKey);
                    headers.set("Idempotence-Key", UUID.randomUUID().toString());
                })
                .bodyValue(mapper.toRequest(request))
                .retrieve()
                .onStatus(HttpStatusCode::is4xxClientError, response ->
                        response.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .flatMap(body -> Mono.error(new NonRetryableServiceException(
                                        SERVICE_NAME, response.statusCode().value(),
                                        "Payment gateway rejected the payment: " + body))))
                .onStatus(HttpStatusCode::is5xxServerError, response ->
                        response.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .flatMap(body -> Mono.error(new RetryableServiceException(
                                        SERVICE_NAME, response.statusCode().value(),
                                        "Payment gateway temporarily unavailable"))))
                .bodyToMono(GatewayPaymentResponse.class)
                .map(mapper::toIntent)
                .toFuture();
    }

    @Override
    @TimeLimiter(name = "paymentTL")
    @CircuitBreaker(name = "paymentCB")
    @Retry(name = "paymentQueryRetry", fallbackMethod = "queryStatusFallback")
    public CompletableFuture<GatewayPaymentStatus> queryStatus(String gatewayId) {
        log.debug("Querying payment status: {}", gatewayId);

        return webClient.get()
                .uri("/v3/payments/{id}", gatewayId)
                .headers(headers -> headers.setBasicAuth(shopId, secretKey))
                .retrieve()
                .onStatus(HttpStatusCode::is4xxClientError, response ->
                        response.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .flatMap(body -> Mono.error(new NonRetryableServiceException(
                                        SERVICE_NAME, response.statusCode().value(),
                                        "Payment lookup rejected: " + body))))
                .onStatus(HttpStatusCode::is5xxServerError, response ->
                        response.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .flatMap(body -> Mono.error(new RetryableServiceException(
                                        SERVICE_NAME, response.statusCode().value(),
                                        "Payment gateway temporarily unavailable"))))
                .bodyToMono(GatewayPaymentResponse.class)
                .map(response -> mapper.toStatus(response.status()))
                .toFuture();
    }

    /**
     * Fallback when circuit breaker is open.
     */
    @SuppressWarnings("unused")
    private CompletableFuture<PaymentIntent> createIntentFallback(
            PaymentIntentRequest request, CallNotPermittedException ex) {

        log.warn("Circuit breaker is OPEN for payment gateway, order: {}", request.orderId());

        return CompletableFuture.failedFuture(
                new GatewayException("Payment gateway is temporarily unavailable", ex));
    }

    /**
     * Fallback for any other failure, including timeouts.
     */
    @SuppressWarnings("unused")
    private CompletableFuture<PaymentIntent> createIntentFallback(
            PaymentIntentRequest request, Throwable throwable) {

        log.error("Payment creation failed for order: {}, cause: {}", request.orderId(), throwable.toString());

        return CompletableFuture.failedFuture(
                new GatewayException("Payment creation failed: " + throwable.getMessage(), throwable));
    }

    /**
     * Fallback when all retries are exhausted or the call was not retryable.
     */
    @SuppressWarnings("unused")
    private CompletableFuture<GatewayPaymentStatus> queryStatusFallback(String gatewayId, Throwable throwable) {

        log.warn("Payment status query failed for {}: {}", gatewayId, throwable.toString());

        return CompletableFuture.failedFuture(
                new GatewayException("Payment status unavailable for " + gatewayId, throwable));
    }
}
