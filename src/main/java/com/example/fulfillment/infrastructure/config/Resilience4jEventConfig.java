package com.example.fulfillment.infrastructure.config;

import com.example.fulfillment.infrastructure.outbox.NotificationOutbox;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.circuitbreaker.event.CircuitBreakerOnStateTransitionEvent;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;

import java.util.Set;

/**
 * Resilience4j event logging. A payment or carrier circuit opening is
 * revenue-impacting and is also raised to the operator.
 */
@Configuration
public class Resilience4jEventConfig {

    private static final Logger log = LoggerFactory.getLogger(Resilience4jEventConfig.class);

    private static final Set<String> ALERTING_BREAKERS = Set.of("paymentCB", "carrierCB");

    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final RetryRegistry retryRegistry;
    private final TimeLimiterRegistry timeLimiterRegistry;
    private final NotificationOutbox outbox;

    public Resilience4jEventConfig(
            CircuitBreakerRegistry circuitBreakerRegistry,
            RetryRegistry retryRegistry,
            TimeLimiterRegistry timeLimiterRegistry,
            NotificationOutbox outbox) {
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.retryRegistry = retryRegistry;
        this.timeLimiterRegistry = timeLimiterRegistry;
        this.outbox = outbox;
    }

    @PostConstruct
    public void registerEventListeners() {
        registerCircuitBreakerEvents();
        registerRetryEvents();
        registerTimeLimiterEvents();
    }

    private void registerCircuitBreakerEvents() {
        circuitBreakerRegistry.getAllCircuitBreakers().forEach(this::registerCircuitBreakerEventListener);
        circuitBreakerRegistry.getEventPublisher()
                .onEntryAdded(event -> registerCircuitBreakerEventListener(event.getAddedEntry()));
    }

    private void registerCircuitBreakerEventListener(CircuitBreaker circuitBreaker) {
        circuitBreaker.getEventPublisher()
                .onStateTransition(this::onStateTransition)
                .onError(event -> log.warn(
                        "[CB_ERROR] name={}, duration={}ms, error={}",
                        event.getCircuitBreakerName(),
                        event.getElapsedDuration().toMillis(),
                        event.getThrowable().getMessage()))
                .onFailureRateExceeded(event -> log.warn(
                        "[CB_FAIL_RATE] name={}, failureRate={}%",
                        event.getCircuitBreakerName(),
                        event.getFailureRate()))
                .onCallNotPermitted(event -> log.warn(
                        "[CB_REJECTED] name={}, call refused while circuit is OPEN",
                        event.getCircuitBreakerName()));
    }

    private void onStateTransition(CircuitBreakerOnStateTransitionEvent event) {
        log.info("[CB_STATE] name={}, from={}, to={}",
                event.getCircuitBreakerName(),
                event.getStateTransition().getFromState(),
                event.getStateTransition().getToState());

        if (event.getStateTransition().getToState() == CircuitBreaker.State.OPEN
                && ALERTING_BREAKERS.contains(event.getCircuitBreakerName())) {
            try {
                outbox.alertOperator(null, "Circuit " + event.getCircuitBreakerName()
                        + " opened: calls are failing fast until the service recovers.");
            } catch (RuntimeException e) {
                log.error("[OPERATOR_ALERT] could not be recorded for circuit {}", event.getCircuitBreakerName(), e);
            }
        }
    }

    private void registerRetryEvents() {
        retryRegistry.getAllRetries().forEach(this::registerRetryEventListener);
        retryRegistry.getEventPublisher()
                .onEntryAdded(event -> registerRetryEventListener(event.getAddedEntry()));
    }

    private void registerRetryEventListener(Retry retry) {
        retry.getEventPublisher()
                .onRetry(event -> log.info(
                        "[RETRY] name={}, attempt={}, waitDuration={}ms, cause={}",
                        event.getName(),
                        event.getNumberOfRetryAttempts(),
                        event.getWaitInterval().toMillis(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "N/A"))
                .onError(event -> log.error(
                        "[RETRY_EXHAUSTED] name={}, attempts={}, error={}",
                        event.getName(),
                        event.getNumberOfRetryAttempts(),
                        event.getLastThrowable().getMessage()))
                .onIgnoredError(event -> log.debug(
                        "[RETRY_IGNORED] name={}, error={} (not retryable)",
                        event.getName(),
                        event.getLastThrowable().getMessage()));
    }

    private void registerTimeLimiterEvents() {
        timeLimiterRegistry.getAllTimeLimiters().forEach(this::registerTimeLimiterEventListener);
        timeLimiterRegistry.getEventPublisher()
                .onEntryAdded(event -> registerTimeLimiterEventListener(event.getAddedEntry()));
    }

    private void registerTimeLimiterEventListener(TimeLimiter timeLimiter) {
        timeLimiter.getEventPublisher()
                .onTimeout(event -> log.warn(
                        "[TIMEOUT] name={}, no answer in time, treated as failure",
                        event.getTimeLimiterName()))
                .onError(event -> log.error(
                        "[TL_ERROR] name={}, error={}",
                        event.getTimeLimiterName(),
                        event.getThrowable().getMessage()));
    }
}
