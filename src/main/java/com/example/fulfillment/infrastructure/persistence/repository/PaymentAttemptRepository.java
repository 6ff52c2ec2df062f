package com.example.fulfillment.infrastructure.persistence.repository;

import com.example.fulfillment.domain.model.OrderStatus;
import com.example.fulfillment.domain.model.PaymentAttemptStatus;
import com.example.fulfillment.domain.model.PaymentKind;
import com.example.fulfillment.infrastructure.persistence.entity.PaymentAttemptEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JPA Repository for payment attempts.
 */
@Repository
public interface PaymentAttemptRepository extends JpaRepository<PaymentAttemptEntity, String> {

    List<PaymentAttemptEntity> findByOrderIdOrderByCreatedAtAsc(String orderId);

    List<PaymentAttemptEntity> findByOrderIdAndStatusOrderByCreatedAtAsc(String orderId, PaymentAttemptStatus status);

    Optional<PaymentAttemptEntity> findFirstByOrderIdAndKindAndStatusOrderByCreatedAtDesc(
            String orderId, PaymentKind kind, PaymentAttemptStatus status);

    /**
     * Orders in the given status that hold a pending attempt of the given kind
     * created before the cutoff.
     */
    @Query("SELECT DISTINCT a.orderId FROM PaymentAttemptEntity a, OrderEntity o " +
           "WHERE o.id = a.orderId AND o.status = :orderStatus AND a.kind = :kind " +
           "AND a.status = :attemptStatus AND a.createdAt < :cutoff")
    List<String> findOrderIdsWithAttemptsBefore(@Param("orderStatus") OrderStatus orderStatus,
                                                @Param("kind") PaymentKind kind,
                                                @Param("attemptStatus") PaymentAttemptStatus attemptStatus,
                                                @Param("cutoff") Instant cutoff);
}
