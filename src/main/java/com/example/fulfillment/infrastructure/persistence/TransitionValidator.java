package com.example.fulfillment.infrastructure.persistence;

import com.example.fulfillment.domain.exception.IllegalTransitionException;
import com.example.fulfillment.domain.exception.OrderNotFoundException;
import com.example.fulfillment.domain.exception.StaleStateException;
import com.example.fulfillment.domain.model.Order;
import com.example.fulfillment.domain.model.OrderId;
import com.example.fulfillment.domain.model.OrderStatus;
import com.example.fulfillment.infrastructure.persistence.entity.OrderEntity;
import com.example.fulfillment.infrastructure.persistence.mapper.OrderPersistenceMapper;
import com.example.fulfillment.infrastructure.persistence.repository.OrderJpaRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * The only writer of order status.
 * <p>
 * A transition is one conditional UPDATE that succeeds only while the stored
 * status is in the expected set; the effects of the transition (extension
 * fields, related rows, outbox notices) commit in the same transaction or
 * not at all. Writes that keep the status use a locking read instead.
 */
@Component
public class TransitionValidator {

    private static final Logger log = LoggerFactory.getLogger(TransitionValidator.class);

    private final OrderJpaRepository orderRepository;
    private final OrderPersistenceMapper mapper;

    public TransitionValidator(OrderJpaRepository orderRepository, OrderPersistenceMapper mapper) {
        this.orderRepository = orderRepository;
        this.mapper = mapper;
    }

    /**
     * Work applied to the freshly updated order inside the transition's transaction.
     * Must not change the status.
     */
    @FunctionalInterface
    public interface Effects {

        Effects NONE = order -> { };

        void apply(OrderEntity order);
    }

    /**
     * Moves the order to {@code target} if its current status is one of
     * {@code expectedFrom}.
     *
     * @throws IllegalTransitionException if any expected status has no edge to the target
     * @throws StaleStateException        if the stored status is not in the expected set
     * @throws OrderNotFoundException     if the order does not exist
     */
    @Transactional
    public Order attemptTransition(OrderId orderId, Set<OrderStatus> expectedFrom, OrderStatus target,
                                   Effects effects) {
        requireAllowed(expectedFrom, target);

        int updated = orderRepository.compareAndSetStatus(orderId.getValue(), expectedFrom, target, Instant.now());
        if (updated == 0) {
            OrderStatus actual = orderRepository.findById(orderId.getValue())
                    .map(OrderEntity::getStatus)
                    .orElseThrow(() -> new OrderNotFoundException(orderId));
            log.warn("Stale transition for order {}: expected {} -> {}, found {}",
                    orderId, expectedFrom, target, actual);
            throw new StaleStateException(orderId, expectedFrom, actual);
        }

        OrderEntity entity = orderRepository.findById(orderId.getValue())
                .orElseThrow(() -> new OrderNotFoundException(orderId));
        applyKeepingStatus(entity, effects);
        log.info("Order {} transitioned {} -> {}", orderId, expectedFrom, target);
        return mapper.toDomain(entity);
    }

    /**
     * Applies a write that keeps the status, under a row lock, if the current
     * status is one of {@code expectedStatus}.
     *
     * @throws StaleStateException    if the stored status is not in the expected set
     * @throws OrderNotFoundException if the order does not exist
     */
    @Transactional
    public Order attemptUpdate(OrderId orderId, Set<OrderStatus> expectedStatus, Effects effects) {
        OrderEntity entity = orderRepository.findByIdForUpdate(orderId.getValue())
                .orElseThrow(() -> new OrderNotFoundException(orderId));
        if (!expectedStatus.contains(entity.getStatus())) {
            log.debug("Skipping update of order {}: status {} not in {}", orderId, entity.getStatus(), expectedStatus);
            throw new StaleStateException(orderId, expectedStatus, entity.getStatus());
        }
        applyKeepingStatus(entity, effects);
        return mapper.toDomain(entity);
    }

    private void applyKeepingStatus(OrderEntity entity, Effects effects) {
        OrderStatus before = entity.getStatus();
        effects.apply(entity);
        if (entity.getStatus() != before) {
            throw new IllegalStateException("Transition effects must not change order status");
        }
    }

    private static void requireAllowed(Set<OrderStatus> expectedFrom, OrderStatus target) {
        if (expectedFrom.isEmpty()) {
            throw new IllegalArgumentException("Expected status set cannot be empty");
        }
        for (OrderStatus from : EnumSet.copyOf(expectedFrom)) {
            if (!from.canTransitionTo(target)) {
                throw new IllegalTransitionException(from, target);
            }
        }
    }
}
