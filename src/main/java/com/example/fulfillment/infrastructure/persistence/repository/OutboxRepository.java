package com.example.fulfillment.infrastructure.persistence.repository;

import com.example.fulfillment.infrastructure.persistence.entity.OutboxEvent;
import com.example.fulfillment.infrastructure.persistence.entity.OutboxEventStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * JPA Repository for OutboxEvent entities.
 */
@Repository
public interface OutboxRepository extends JpaRepository<OutboxEvent, String> {

    @Query("SELECT o FROM OutboxEvent o WHERE o.status = :status ORDER BY o.createdAt ASC LIMIT :limit")
    List<OutboxEvent> findByStatus(@Param("status") OutboxEventStatus status, @Param("limit") int limit);

    @Query("SELECT o FROM OutboxEvent o WHERE o.status = :status AND o.retryCount < :maxRetries " +
           "ORDER BY o.createdAt ASC LIMIT :limit")
    List<OutboxEvent> findRetryable(@Param("status") OutboxEventStatus status,
                                    @Param("maxRetries") int maxRetries,
                                    @Param("limit") int limit);

    @Modifying
    @Query("DELETE FROM OutboxEvent o WHERE o.status = :status AND o.processedAt < :before")
    int deleteByStatusBefore(@Param("status") OutboxEventStatus status, @Param("before") Instant before);

    List<OutboxEvent> findByAggregateIdOrderByCreatedAtAsc(String aggregateId);
}
