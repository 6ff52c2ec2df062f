package com.example.fulfillment.infrastructure.persistence.repository;

import com.example.fulfillment.domain.model.OrderStatus;
import com.example.fulfillment.infrastructure.persistence.entity.OrderEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * JPA Repository for Order entities.
 */
@Repository
public interface OrderJpaRepository extends JpaRepository<OrderEntity, String> {

    /**
     * Compare-and-set on status. Returns the number of rows updated: 1 when the
     * stored status was in {@code expected}, 0 otherwise.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE OrderEntity o SET o.status = :target, o.statusChangedAt = :now, o.updatedAt = :now " +
           "WHERE o.id = :id AND o.status IN :expected")
    int compareAndSetStatus(@Param("id") String id,
                            @Param("expected") Collection<OrderStatus> expected,
                            @Param("target") OrderStatus target,
                            @Param("now") Instant now);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM OrderEntity o WHERE o.id = :id")
    Optional<OrderEntity> findByIdForUpdate(@Param("id") String id);

    @Query("SELECT o.id FROM OrderEntity o WHERE o.status = :status AND o.statusChangedAt < :cutoff " +
           "ORDER BY o.statusChangedAt ASC")
    List<String> findIdsByStatusChangedBefore(@Param("status") OrderStatus status,
                                              @Param("cutoff") Instant cutoff,
                                              Pageable page);

    long countByStatus(OrderStatus status);
}
