package com.example.fulfillment.infrastructure.persistence;

import com.example.fulfillment.application.dto.Notice;
import com.example.fulfillment.domain.exception.OrderNotFoundException;
import com.example.fulfillment.domain.model.*;
import com.example.fulfillment.infrastructure.outbox.NotificationOutbox;
import com.example.fulfillment.infrastructure.persistence.entity.CustomerEntity;
import com.example.fulfillment.infrastructure.persistence.entity.OrderEntity;
import com.example.fulfillment.infrastructure.persistence.entity.PaymentAttemptEntity;
import com.example.fulfillment.infrastructure.persistence.entity.ShipmentRequestEntity;
import com.example.fulfillment.infrastructure.persistence.mapper.OrderPersistenceMapper;
import com.example.fulfillment.infrastructure.persistence.repository.CustomerRepository;
import com.example.fulfillment.infrastructure.persistence.repository.OrderJpaRepository;
import com.example.fulfillment.infrastructure.persistence.repository.PaymentAttemptRepository;
import com.example.fulfillment.infrastructure.persistence.repository.ShipmentRequestRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Order Store. Reads return domain snapshots; every status change goes
 * through {@link TransitionValidator}, with related rows and outbox notices
 * written as effects of the same transaction.
 * <p>
 * Write methods that change order state are deliberately not transactional
 * themselves, so a lost compare-and-set surfaces as a plain
 * {@link com.example.fulfillment.domain.exception.StaleStateException}.
 */
@Service
public class OrderPersistenceService {

    private static final Logger log = LoggerFactory.getLogger(OrderPersistenceService.class);

    private final OrderJpaRepository orderRepository;
    private final CustomerRepository customerRepository;
    private final PaymentAttemptRepository attemptRepository;
    private final ShipmentRequestRepository shipmentRepository;
    private final TransitionValidator validator;
    private final NotificationOutbox outbox;
    private final OrderPersistenceMapper mapper;

    public OrderPersistenceService(
            OrderJpaRepository orderRepository,
            CustomerRepository customerRepository,
            PaymentAttemptRepository attemptRepository,
            ShipmentRequestRepository shipmentRepository,
            TransitionValidator validator,
            NotificationOutbox outbox,
            OrderPersistenceMapper mapper) {
        this.orderRepository = orderRepository;
        this.customerRepository = customerRepository;
        this.attemptRepository = attemptRepository;
        this.shipmentRepository = shipmentRepository;
        this.validator = validator;
        this.outbox = outbox;
        this.mapper = mapper;
    }

    // ==================== Orders ====================

    /**
     * Saves a new order and creates or refreshes its owner's profile.
     */
    @Transactional
    public Order createOrder(Order order, CustomerProfile owner) {
        CustomerEntity customer = customerRepository.findById(owner.chatId()).orElseGet(CustomerEntity::new);
        mapper.copyInto(owner, customer);
        customerRepository.save(customer);

        OrderEntity saved = orderRepository.save(mapper.toEntity(order));
        log.debug("Saved order {} for chat {}", saved.getId(), owner.chatId());
        return mapper.toDomain(saved);
    }

    @Transactional(readOnly = true)
    public Optional<Order> findOrder(OrderId orderId) {
        return orderRepository.findById(orderId.getValue()).map(mapper::toDomain);
    }

    /**
     * @throws OrderNotFoundException if no such order exists
     */
    @Transactional(readOnly = true)
    public Order loadOrder(OrderId orderId) {
        return findOrder(orderId).orElseThrow(() -> new OrderNotFoundException(orderId));
    }

    @Transactional(readOnly = true)
    public Optional<CustomerProfile> findCustomer(long chatId) {
        return customerRepository.findById(chatId).map(mapper::toDomain);
    }

    @Transactional(readOnly = true)
    public List<OrderId> findOrdersInStatusSince(OrderStatus status, Instant cutoff, int limit) {
        return orderRepository.findIdsByStatusChangedBefore(status, cutoff, PageRequest.of(0, limit)).stream()
                .map(OrderId::of)
                .toList();
    }

    /**
     * Generic operator transition with notices.
     */
    public Order transition(OrderId orderId, Set<OrderStatus> expectedFrom, OrderStatus target,
                            List<Notice> notices) {
        return validator.attemptTransition(orderId, expectedFrom, target,
                order -> enqueue(order, notices));
    }

    /**
     * Rewrites the delivery destination of an order that has not been handed
     * to the carrier.
     *
     * @throws IllegalStateException if a carrier request already exists for the order
     */
    public Order changeDelivery(OrderId orderId, String address, String pickupPointCode, String postalCode,
                                List<Notice> notices) {
        Set<OrderStatus> unshipped = EnumSet.range(OrderStatus.NEW, OrderStatus.ASSEMBLED);
        return validator.attemptUpdate(orderId, unshipped, order -> {
            shipmentRepository.findById(orderId.getValue())
                    .filter(shipment -> shipment.getStatus() != ShipmentRequestStatus.FAILED)
                    .ifPresent(shipment -> {
                        throw new IllegalStateException("Order " + orderId + " is already with the carrier");
                    });
            order.setDeliveryAddress(address);
            order.setExtension(OrderExtension.copyOf(order.getExtension())
                    .put(OrderExtension.PICKUP_POINT_CODE, pickupPointCode)
                    .put(OrderExtension.POSTAL_CODE, postalCode)
                    .asMap());
            enqueue(order, notices);
        });
    }

    // ==================== Payments ====================

    @Transactional(readOnly = true)
    public List<PaymentAttempt> findAttempts(OrderId orderId) {
        return attemptRepository.findByOrderIdOrderByCreatedAtAsc(orderId.getValue()).stream()
                .map(mapper::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<PaymentAttempt> findPendingAttempts(OrderId orderId) {
        return attemptRepository.findByOrderIdAndStatusOrderByCreatedAtAsc(
                        orderId.getValue(), PaymentAttemptStatus.PENDING).stream()
                .map(mapper::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public Optional<PaymentAttempt> findPendingAttempt(OrderId orderId, PaymentKind kind) {
        return attemptRepository.findFirstByOrderIdAndKindAndStatusOrderByCreatedAtDesc(
                        orderId.getValue(), kind, PaymentAttemptStatus.PENDING)
                .map(mapper::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<PaymentAttempt> findAttempt(String gatewayId) {
        return attemptRepository.findById(gatewayId).map(mapper::toDomain);
    }

    @Transactional(readOnly = true)
    public List<OrderId> findOrdersWithAttemptsBefore(OrderStatus orderStatus, PaymentKind kind, Instant cutoff) {
        return attemptRepository.findOrderIdsWithAttemptsBefore(
                        orderStatus, kind, PaymentAttemptStatus.PENDING, cutoff).stream()
                .map(OrderId::of)
                .toList();
    }

    /**
     * Stores a freshly created gateway attempt and records it as pending on
     * the order. A NEW order moves to PENDING_PAYMENT in the same step.
     */
    public Order recordPaymentAttempt(Order order, PaymentAttempt attempt, List<Notice> notices) {
        TransitionValidator.Effects effects = entity -> {
            attemptRepository.save(mapper.toEntity(attempt));
            entity.setExtension(OrderExtension.copyOf(entity.getExtension())
                    .putPendingPayment(attempt.getKind(), attempt.getGatewayId())
                    .asMap());
            enqueue(entity, notices);
        };
        if (order.getStatus() == OrderStatus.NEW) {
            return validator.attemptTransition(order.getOrderId(), EnumSet.of(OrderStatus.NEW),
                    OrderStatus.PENDING_PAYMENT, effects);
        }
        Set<OrderStatus> startable = EnumSet.copyOf(attempt.getKind().startableFrom());
        startable.remove(OrderStatus.NEW);
        return validator.attemptUpdate(order.getOrderId(), startable, effects);
    }

    /**
     * Applies a confirmed payment: moves the order along the kind's edge and
     * records which gateway payment settled it.
     */
    public Order settlePayment(OrderId orderId, String gatewayId, PaymentKind kind, List<Notice> notices) {
        return validator.attemptTransition(orderId, kind.settlesFrom(), kind.settlesTo(), order -> {
            attemptRepository.findById(gatewayId).ifPresent(PaymentAttemptEntity::markSucceeded);
            String idKey = kind == PaymentKind.PREPAY ? OrderExtension.PREPAY_PAYMENT_ID : OrderExtension.PAYMENT_ID;
            order.setExtension(OrderExtension.copyOf(order.getExtension())
                    .removePendingPayment(kind)
                    .put(idKey, gatewayId)
                    .asMap());
            enqueue(order, notices);
        });
    }

    /**
     * Records the gateway-side status of an attempt without touching the order.
     *
     * @return true if the attempt exists
     */
    @Transactional
    public boolean updateAttemptStatus(String gatewayId, PaymentAttemptStatus status) {
        return attemptRepository.findById(gatewayId)
                .map(attempt -> {
                    switch (status) {
                        case SUCCEEDED -> attempt.markSucceeded();
                        case FAILED -> attempt.markFailed();
                        case EXPIRED -> attempt.markExpired();
                        case PENDING -> { }
                    }
                    return true;
                })
                .orElse(false);
    }

    /**
     * Closes an unpaid order.
     */
    public Order abandonOrder(OrderId orderId, Set<OrderStatus> expectedFrom, List<Notice> notices) {
        return validator.attemptTransition(orderId, expectedFrom, OrderStatus.ABANDONED, order -> {
            order.setExtension(OrderExtension.copyOf(order.getExtension())
                    .put(OrderExtension.PENDING_PAYMENTS, null)
                    .asMap());
            enqueue(order, notices);
        });
    }

    // ==================== Shipments ====================

    @Transactional(readOnly = true)
    public Optional<ShipmentRequest> findShipment(OrderId orderId) {
        return shipmentRepository.findById(orderId.getValue()).map(mapper::toDomain);
    }

    @Transactional(readOnly = true)
    public List<ShipmentRequest> findPollableShipments(int limit) {
        return shipmentRepository.findPollable(OrderStatus.SHIPPED, ShipmentRequestStatus.ACCEPTED,
                        PageRequest.of(0, limit)).stream()
                .map(mapper::toDomain)
                .toList();
    }

    /**
     * Claims the order's single shipment request before the carrier call:
     * inserts it, or reopens a FAILED one.
     *
     * @throws IllegalStateException if a request is already pending or accepted
     */
    @Transactional
    public ShipmentRequest claimShipment(OrderId orderId) {
        ShipmentRequestEntity entity = shipmentRepository.findById(orderId.getValue())
                .orElse(null);
        if (entity == null) {
            entity = shipmentRepository.save(ShipmentRequestEntity.claim(orderId.getValue()));
        } else if (entity.getStatus() == ShipmentRequestStatus.FAILED) {
            entity.reclaim();
        } else {
            throw new IllegalStateException("Shipment request for order " + orderId + " is " + entity.getStatus());
        }
        return mapper.toDomain(entity);
    }

    @Transactional
    public void markShipmentFailed(OrderId orderId, String error) {
        shipmentRepository.findById(orderId.getValue())
                .ifPresent(entity -> entity.markFailed(error));
    }

    /**
     * Reopens a pending shipment request of an assembled order as FAILED, so
     * the next shipment request may call the carrier again.
     *
     * @throws IllegalStateException if the order has no pending shipment request
     */
    public Order releaseShipmentClaim(OrderId orderId, String reason, List<Notice> notices) {
        return validator.attemptUpdate(orderId, EnumSet.of(OrderStatus.ASSEMBLED), order -> {
            ShipmentRequestEntity shipment = shipmentRepository.findById(orderId.getValue())
                    .filter(entity -> entity.getStatus() == ShipmentRequestStatus.PENDING)
                    .orElseThrow(() -> new IllegalStateException(
                            "Order " + orderId + " has no pending shipment request"));
            shipment.markFailed(reason);
            enqueue(order, notices);
        });
    }

    /**
     * Stores an accepted carrier shipment without moving the order.
     */
    @Transactional
    public void markShipmentAccepted(OrderId orderId, String carrierId, String rawResponse) {
        shipmentRepository.findById(orderId.getValue())
                .ifPresent(entity -> entity.markAccepted(carrierId, rawResponse));
    }

    /**
     * ASSEMBLED to SHIPPED, together with the accepted request and the
     * placeholder tracking value.
     */
    public Order completeShipment(OrderId orderId, String carrierId, String rawResponse, List<Notice> notices) {
        return validator.attemptTransition(orderId, EnumSet.of(OrderStatus.ASSEMBLED), OrderStatus.SHIPPED, order -> {
            shipmentRepository.findById(orderId.getValue())
                    .ifPresent(entity -> {
                        if (entity.getStatus() != ShipmentRequestStatus.ACCEPTED) {
                            entity.markAccepted(carrierId, rawResponse);
                        }
                    });
            if (Order.isPlaceholderTracking(order.getTrackingNumber())) {
                order.setTrackingNumber(Order.placeholderTracking(orderId));
            }
            order.setExtension(OrderExtension.copyOf(order.getExtension())
                    .put(OrderExtension.CARRIER_ID, carrierId)
                    .asMap());
            enqueue(order, notices);
        });
    }

    /**
     * Writes a tracking number on a shipped order.
     *
     * @param onlyOverPlaceholder when true, an already real tracking number is kept
     * @return true if the tracking number was written
     */
    public boolean recordTrackingNumber(OrderId orderId, String trackingNumber, boolean onlyOverPlaceholder,
                                        List<Notice> notices) {
        boolean[] written = {false};
        validator.attemptUpdate(orderId, EnumSet.of(OrderStatus.SHIPPED), order -> {
            if (onlyOverPlaceholder && !Order.isPlaceholderTracking(order.getTrackingNumber())) {
                return;
            }
            if (trackingNumber.equals(order.getTrackingNumber())) {
                return;
            }
            order.setTrackingNumber(trackingNumber);
            enqueue(order, notices);
            written[0] = true;
        });
        return written[0];
    }

    /**
     * Stores the latest carrier status of a shipped order. Notices are
     * enqueued only when the status differs from the last one seen.
     *
     * @return true if the status changed
     */
    public boolean recordCarrierStatus(OrderId orderId, String carrierStatus, boolean terminal,
                                       List<Notice> notices) {
        boolean[] changed = {false};
        validator.attemptUpdate(orderId, EnumSet.of(OrderStatus.SHIPPED), order ->
                shipmentRepository.findById(orderId.getValue()).ifPresent(shipment -> {
                    if (terminal) {
                        shipment.setTrackingTerminal(true);
                    }
                    if (carrierStatus.equals(shipment.getLastPolledStatus())) {
                        return;
                    }
                    shipment.setLastPolledStatus(carrierStatus);
                    enqueue(order, notices);
                    changed[0] = true;
                }));
        return changed[0];
    }

    /**
     * SHIPPED to ARCHIVED; stops any further carrier polling.
     */
    public Order archiveOrder(OrderId orderId, List<Notice> notices) {
        return validator.attemptTransition(orderId, EnumSet.of(OrderStatus.SHIPPED), OrderStatus.ARCHIVED, order -> {
            shipmentRepository.findById(orderId.getValue())
                    .ifPresent(shipment -> shipment.setTrackingTerminal(true));
            enqueue(order, notices);
        });
    }

    private void enqueue(OrderEntity order, List<Notice> notices) {
        if (!notices.isEmpty()) {
            outbox.enqueue(OrderId.of(order.getId()), order.getOwnerChatId(), notices);
        }
    }
}
