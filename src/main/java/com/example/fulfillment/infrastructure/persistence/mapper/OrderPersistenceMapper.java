package com.example.fulfillment.infrastructure.persistence.mapper;

import com.example.fulfillment.domain.model.*;
import com.example.fulfillment.infrastructure.persistence.entity.CustomerEntity;
import com.example.fulfillment.infrastructure.persistence.entity.OrderEntity;
import com.example.fulfillment.infrastructure.persistence.entity.PaymentAttemptEntity;
import com.example.fulfillment.infrastructure.persistence.entity.ShipmentRequestEntity;
import org.springframework.stereotype.Component;

/**
 * Mapper between domain objects and persistence entities.
 */
@Component
public class OrderPersistenceMapper {

    public OrderEntity toEntity(Order order) {
        OrderEntity entity = new OrderEntity();
        entity.setId(order.getOrderId().getValue());
        entity.setOwnerChatId(order.getOwnerChatId());
        entity.setTotalAmount(order.getTotalAmount().getMinorUnits());
        entity.setCurrency(order.getTotalAmount().getCurrency());
        entity.setFulfillmentKind(order.getFulfillmentKind());
        entity.setStatus(order.getStatus());
        entity.setDeliveryAddress(order.getDeliveryAddress());
        entity.setTrackingNumber(order.getTrackingNumber());
        entity.setExtension(order.getExtension().asMap());
        entity.setCreatedAt(order.getCreatedAt());
        entity.setStatusChangedAt(order.getStatusChangedAt());
        return entity;
    }

    public Order toDomain(OrderEntity entity) {
        return Order.reconstitute(
                OrderId.of(entity.getId()),
                entity.getOwnerChatId(),
                Money.ofMinor(entity.getTotalAmount(), entity.getCurrency()),
                entity.getFulfillmentKind(),
                entity.getStatus(),
                entity.getDeliveryAddress(),
                entity.getTrackingNumber(),
                OrderExtension.copyOf(entity.getExtension()),
                entity.getCreatedAt(),
                entity.getStatusChangedAt()
        );
    }

    public PaymentAttemptEntity toEntity(PaymentAttempt attempt) {
        PaymentAttemptEntity entity = new PaymentAttemptEntity();
        entity.setGatewayId(attempt.getGatewayId());
        entity.setOrderId(attempt.getOrderId().getValue());
        entity.setKind(attempt.getKind());
        entity.setAmount(attempt.getAmount().getMinorUnits());
        entity.setCurrency(attempt.getAmount().getCurrency());
        entity.setConfirmationUrl(attempt.getConfirmationUrl());
        entity.setCreatedAt(attempt.getCreatedAt());
        return entity;
    }

    public PaymentAttempt toDomain(PaymentAttemptEntity entity) {
        return PaymentAttempt.reconstitute(
                entity.getGatewayId(),
                OrderId.of(entity.getOrderId()),
                entity.getKind(),
                Money.ofMinor(entity.getAmount(), entity.getCurrency()),
                entity.getStatus(),
                entity.getConfirmationUrl(),
                entity.getCreatedAt()
        );
    }

    public ShipmentRequest toDomain(ShipmentRequestEntity entity) {
        return ShipmentRequest.reconstitute(
                OrderId.of(entity.getOrderId()),
                entity.getStatus(),
                entity.getCarrierId(),
                entity.getLastPolledStatus(),
                entity.isTrackingTerminal(),
                entity.getErrorMessage(),
                entity.getUpdatedAt()
        );
    }

    public CustomerProfile toDomain(CustomerEntity entity) {
        return new CustomerProfile(entity.getChatId(), entity.getFullName(), entity.getPhone(), entity.getEmail());
    }

    public void copyInto(CustomerProfile profile, CustomerEntity entity) {
        entity.setChatId(profile.chatId());
        entity.setFullName(profile.fullName());
        entity.setPhone(profile.phone());
        entity.setEmail(profile.email());
    }
}
