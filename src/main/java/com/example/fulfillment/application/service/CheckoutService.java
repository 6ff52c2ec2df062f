package com.example.fulfillment.application.service;

import com.example.fulfillment.application.dto.CheckoutCommand;
import com.example.fulfillment.application.dto.OrderStatusView;
import com.example.fulfillment.application.port.in.CheckoutUseCase;
import com.example.fulfillment.application.port.in.GetOrderStatusUseCase;
import com.example.fulfillment.domain.model.*;
import com.example.fulfillment.infrastructure.persistence.OrderPersistenceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Checkout confirmation and the order read model.
 */
@Service
public class CheckoutService implements CheckoutUseCase, GetOrderStatusUseCase {

    private static final Logger log = LoggerFactory.getLogger(CheckoutService.class);

    private final OrderPersistenceService persistenceService;
    private final int prepayPercent;
    private final String currency;

    public CheckoutService(
            OrderPersistenceService persistenceService,
            @Value("${fulfillment.payment.prepay-percent:30}") int prepayPercent,
            @Value("${fulfillment.payment.currency:RUB}") String currency) {
        this.persistenceService = persistenceService;
        this.prepayPercent = prepayPercent;
        this.currency = currency;
    }

    @Override
    public OrderStatusView checkout(CheckoutCommand command) {
        CustomerProfile owner = new CustomerProfile(
                command.chatId(), command.fullName(), command.phone(), command.email());

        OrderExtension extension = OrderExtension.empty()
                .put(OrderExtension.PICKUP_POINT_CODE, command.pickupPointCode())
                .put(OrderExtension.POSTAL_CODE, command.postalCode())
                .put(OrderExtension.DELIVERY_COST, command.deliveryCostMinor())
                .put(OrderExtension.DELIVERY_PERIOD, command.deliveryPeriod())
                .put(OrderExtension.GIFT_MESSAGE, command.giftMessage());

        Order order = Order.create(
                command.chatId(),
                Money.ofMinor(command.totalAmountMinor(), currency),
                command.fulfillmentKind(),
                command.deliveryAddress(),
                extension);

        Order saved = persistenceService.createOrder(order, owner);
        log.info("Checkout confirmed: order {} for chat {}, total {}, kind {}",
                saved.getOrderId(), saved.getOwnerChatId(), saved.getTotalAmount(), saved.getFulfillmentKind());
        return toView(saved);
    }

    @Override
    public OrderStatusView getStatus(OrderId orderId) {
        return toView(persistenceService.loadOrder(orderId));
    }

    private OrderStatusView toView(Order order) {
        return OrderStatusView.from(
                order,
                persistenceService.findAttempts(order.getOrderId()),
                persistenceService.findShipment(order.getOrderId()).orElse(null),
                prepayPercent);
    }
}
