package com.example.fulfillment.infrastructure.adapter.out.notification;

import com.example.fulfillment.application.port.out.NotificationPort;
import com.example.fulfillment.infrastructure.adapter.out.notification.dto.SendMessageRequest;
import com.example.fulfillment.infrastructure.adapter.out.notification.dto.SendMessageResponse;
import com.example.fulfillment.infrastructure.exception.NonRetryableServiceException;
import com.example.fulfillment.infrastructure.exception.RetryableServiceException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.concurrent.CompletableFuture;

/**
 * Adapter for the chat bot API that delivers customer and operator messages.
 * Decorator order: Retry → CircuitBreaker → HTTP call.
 */
@Component
public class NotificationAdapter implements NotificationPort {

    private static final Logger log = LoggerFactory.getLogger(NotificationAdapter.class);
    private static final String SERVICE_NAME = "notification";

    private final WebClient webClient;
    private final String botToken;

    public NotificationAdapter(
            @Qualifier("notificationWebClient") WebClient webClient,
            @Value("${services.notification.bot-token}") String botToken) {
        this.webClient = webClient;
        this.botToken = botToken;
    }

    @Override
    @CircuitBreaker(name = "notificationCB")
    @Retry(name = "notificationRetry", fallbackMethod = "sendFallback")
    public CompletableFuture<Void> send(long recipient, String text) {
        log.debug("Sending message to {}", recipient);

        return webClient.post()
                .uri("/bot{token}/sendMessage", botToken)
                .bodyValue(SendMessageRequest.of(recipient, text))
                .retrieve()
                .onStatus(HttpStatusCode::is4xxClientError, response ->
                        response.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .flatMap(body -> Mono.error(new NonRetryableServiceException(
                                        SERVICE_NAME, response.statusCode().value(),
                                        "Message to " + recipient + " rejected: " + body))))
                .onStatus(HttpStatusCode::is5xxServerError, response ->
                        response.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .flatMap(body -> Mono.error(new RetryableServiceException(
                                        SERVICE_NAME, response.statusCode().value(),
                                        "Messaging service temporarily unavailable"))))
                .bodyToMono(SendMessageResponse.class)
                .flatMap(response -> response.ok()
                        ? Mono.<Void>empty()
                        : Mono.<Void>error(NonRetryableServiceException.unusableAnswer(
                                SERVICE_NAME, "Message to " + recipient + " not sent: " + response.description())))
                .toFuture();
    }

    /**
     * Fallback when retries are exhausted or the message was rejected. The
     * failure is passed on so the outbox can count the attempt.
     */
    @SuppressWarnings("unused")
    private CompletableFuture<Void> sendFallback(long recipient, String text, Throwable throwable) {

        log.warn("Message delivery to {} failed: {}", recipient, throwable.toString());

        return CompletableFuture.failedFuture(throwable);
    }
}
