package com.example.fulfillment.infrastructure.adapter.in.web.mapper;

import com.example.fulfillment.application.dto.CheckoutCommand;
import com.example.fulfillment.application.dto.DeliveryChangeCommand;
import com.example.fulfillment.application.dto.PaymentWebhookEvent;
import com.example.fulfillment.domain.model.PaymentKind;
import com.example.fulfillment.infrastructure.adapter.in.web.dto.CheckoutRequest;
import com.example.fulfillment.infrastructure.adapter.in.web.dto.DeliveryChangeRequest;
import com.example.fulfillment.infrastructure.adapter.in.web.dto.PaymentWebhookRequest;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Mapper between web DTOs and application DTOs.
 */
@Component
public class OrderWebMapper {

    public CheckoutCommand toCommand(CheckoutRequest request) {
        return new CheckoutCommand(
                request.chatId(),
                request.fullName(),
                request.phone(),
                request.email(),
                request.totalAmount(),
                request.fulfillmentKind(),
                request.deliveryAddress(),
                request.pickupPointCode(),
                request.postalCode(),
                request.deliveryCost(),
                request.deliveryPeriod(),
                request.giftMessage());
    }

    public DeliveryChangeCommand toCommand(DeliveryChangeRequest request) {
        return new DeliveryChangeCommand(request.deliveryAddress(), request.pickupPointCode(), request.postalCode());
    }

    /**
     * @throws IllegalArgumentException for an unknown kind
     */
    public PaymentKind toPaymentKind(String kind) {
        return PaymentKind.fromWireValue(kind)
                .orElseThrow(() -> new IllegalArgumentException("Unknown payment kind: " + kind));
    }

    public PaymentWebhookEvent toEvent(PaymentWebhookRequest request) {
        PaymentWebhookRequest.PaymentObject payment = request.object();
        Map<String, Object> metadata = payment != null && payment.metadata() != null
                ? payment.metadata()
                : Map.of();
        return new PaymentWebhookEvent(
                request.event(),
                payment != null ? payment.id() : null,
                asString(metadata.get("order_id")),
                asString(metadata.get("payment_kind")));
    }

    private static String asString(Object value) {
        return value != null ? String.valueOf(value) : null;
    }
}
