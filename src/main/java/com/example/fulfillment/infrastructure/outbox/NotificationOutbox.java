package com.example.fulfillment.infrastructure.outbox;

import com.example.fulfillment.application.dto.Notice;
import com.example.fulfillment.domain.model.OrderId;
import com.example.fulfillment.infrastructure.persistence.entity.OutboxEvent;
import com.example.fulfillment.infrastructure.persistence.repository.OutboxRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Records notification intents as outbox events. Order-scoped notices join
 * the caller's transaction, so they exist only if the state change commits.
 */
@Component
public class NotificationOutbox {

    private static final Logger log = LoggerFactory.getLogger(NotificationOutbox.class);
    private static final String AGGREGATE_ORDER = "Order";
    private static final String AGGREGATE_SYSTEM = "System";

    private final OutboxRepository outboxRepository;
    private final ObjectMapper objectMapper;
    private final long operatorChatId;

    public NotificationOutbox(
            OutboxRepository outboxRepository,
            ObjectMapper objectMapper,
            @Value("${fulfillment.operator.chat-id:0}") long operatorChatId) {
        this.outboxRepository = outboxRepository;
        this.objectMapper = objectMapper;
        this.operatorChatId = operatorChatId;
    }

    /**
     * Enqueues notices for an order within the current transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void enqueue(OrderId orderId, long ownerChatId, List<Notice> notices) {
        for (Notice notice : notices) {
            long recipient = notice.audience() == Notice.Audience.OWNER ? ownerChatId : operatorChatId;
            save(AGGREGATE_ORDER, orderId.getValue(), recipient, notice.text());
        }
    }

    /**
     * Raises an operator alert in its own transaction, so it survives a
     * rollback of whatever failed.
     *
     * @param orderId affected order, or null for system-wide alerts
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void alertOperator(OrderId orderId, String text) {
        log.warn("[OPERATOR_ALERT] order={}, message={}", orderId, text);
        String aggregateId = orderId != null ? orderId.getValue() : "operator";
        save(orderId != null ? AGGREGATE_ORDER : AGGREGATE_SYSTEM, aggregateId, operatorChatId, text);
    }

    private void save(String aggregateType, String aggregateId, long recipient, String text) {
        if (recipient == 0) {
            log.debug("No recipient configured, dropping notice for {}: {}", aggregateId, text);
            return;
        }
        outboxRepository.save(OutboxEvent.notification(aggregateType, aggregateId, serialize(recipient, text)));
    }

    private String serialize(long recipient, String text) {
        try {
            return objectMapper.writeValueAsString(new NotificationPayload(recipient, text));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize notification payload", e);
        }
    }
}
