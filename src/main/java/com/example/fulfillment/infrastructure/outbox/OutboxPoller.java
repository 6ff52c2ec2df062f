package com.example.fulfillment.infrastructure.outbox;

import com.example.fulfillment.application.port.out.NotificationPort;
import com.example.fulfillment.infrastructure.persistence.entity.OutboxEvent;
import com.example.fulfillment.infrastructure.persistence.entity.OutboxEventStatus;
import com.example.fulfillment.infrastructure.persistence.repository.OutboxRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Dispatches notification intents recorded in the outbox. Delivery is
 * best-effort: a failed send is retried a bounded number of times and never
 * affects the state change that recorded it.
 */
@Component
@ConditionalOnProperty(value = "outbox.poller.enabled", havingValue = "true", matchIfMissing = true)
public class OutboxPoller {

    private static final Logger log = LoggerFactory.getLogger(OutboxPoller.class);

    private final OutboxRepository outboxRepository;
    private final NotificationPort notificationPort;
    private final ObjectMapper objectMapper;
    private final int batchSize;
    private final int maxRetries;

    public OutboxPoller(
            OutboxRepository outboxRepository,
            NotificationPort notificationPort,
            ObjectMapper objectMapper,
            @Value("${outbox.poller.batch-size:100}") int batchSize,
            @Value("${outbox.poller.max-retries:5}") int maxRetries) {
        this.outboxRepository = outboxRepository;
        this.notificationPort = notificationPort;
        this.objectMapper = objectMapper;
        this.batchSize = batchSize;
        this.maxRetries = maxRetries;
    }

    /**
     * Sends pending notifications.
     */
    @Scheduled(fixedDelayString = "${outbox.poller.interval-ms:1000}")
    public void pollAndDispatch() {
        List<OutboxEvent> events = outboxRepository.findByStatus(OutboxEventStatus.PENDING, batchSize);

        if (!events.isEmpty()) {
            log.debug("Dispatching {} pending outbox events", events.size());
        }

        for (OutboxEvent event : events) {
            dispatch(event);
        }
    }

    /**
     * Retries failed notifications that haven't exceeded max retries.
     * Runs every 30 seconds.
     */
    @Scheduled(fixedRate = 30000)
    public void retryFailedEvents() {
        List<OutboxEvent> failedEvents = outboxRepository.findRetryable(
                OutboxEventStatus.FAILED, maxRetries, batchSize);

        if (!failedEvents.isEmpty()) {
            log.info("Retrying {} failed outbox events", failedEvents.size());
        }

        for (OutboxEvent event : failedEvents) {
            event.markRetrying();
            outboxRepository.save(event);
            dispatch(event);
        }
    }

    /**
     * Cleans up old processed events.
     * Runs every hour.
     */
    @Scheduled(fixedRate = 3600000)
    @Transactional
    public void cleanupProcessedEvents() {
        Instant cutoff = Instant.now().minus(24, ChronoUnit.HOURS);
        int deleted = outboxRepository.deleteByStatusBefore(OutboxEventStatus.PROCESSED, cutoff);
        if (deleted > 0) {
            log.info("Cleaned up {} processed outbox events older than 24 hours", deleted);
        }
    }

    void dispatch(OutboxEvent event) {
        log.debug("Dispatching outbox event: {} (type: {}, aggregate: {})",
                event.getId(), event.getEventType(), event.getAggregateId());

        event.markProcessing();
        outboxRepository.save(event);

        if (!OutboxEvent.TYPE_NOTIFICATION.equals(event.getEventType())) {
            log.warn("Unknown event type: {}", event.getEventType());
            event.markFailed("Unknown event type: " + event.getEventType());
            outboxRepository.save(event);
            return;
        }

        try {
            NotificationPayload payload = objectMapper.readValue(event.getPayload(), NotificationPayload.class);
            notificationPort.send(payload.recipient(), payload.text()).join();
            event.markProcessed();
            log.debug("Delivered notification {} for {}", event.getId(), event.getAggregateId());
        } catch (Exception e) {
            log.warn("Failed to deliver notification {} for {} (attempt {}): {}",
                    event.getId(), event.getAggregateId(), event.getRetryCount() + 1, e.getMessage());
            event.markFailed(e.getMessage());
        }
        outboxRepository.save(event);
    }
}
