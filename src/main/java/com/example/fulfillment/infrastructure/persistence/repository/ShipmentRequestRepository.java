package com.example.fulfillment.infrastructure.persistence.repository;

import com.example.fulfillment.domain.model.OrderStatus;
import com.example.fulfillment.domain.model.ShipmentRequestStatus;
import com.example.fulfillment.infrastructure.persistence.entity.ShipmentRequestEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * JPA Repository for shipment requests.
 */
@Repository
public interface ShipmentRequestRepository extends JpaRepository<ShipmentRequestEntity, String> {

    /**
     * Accepted shipments of orders in the given status whose carrier status
     * has not reached a terminal value, least recently polled first.
     */
    @Query("SELECT s FROM ShipmentRequestEntity s, OrderEntity o " +
           "WHERE o.id = s.orderId AND o.status = :orderStatus AND s.status = :requestStatus " +
           "AND s.carrierId IS NOT NULL AND s.trackingTerminal = false " +
           "ORDER BY s.updatedAt ASC")
    List<ShipmentRequestEntity> findPollable(@Param("orderStatus") OrderStatus orderStatus,
                                             @Param("requestStatus") ShipmentRequestStatus requestStatus,
                                             Pageable page);
}
