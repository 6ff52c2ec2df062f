package com.example.fulfillment.unit.domain;

import com.example.fulfillment.domain.exception.InvalidOrderException;
import com.example.fulfillment.domain.model.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for Order aggregate and related domain objects.
 */
@DisplayName("Order Domain Tests")
class OrderTest {

    private static final int PREPAY_PERCENT = 30;

    private static Order orderIn(OrderStatus status, FulfillmentKind kind, long total) {
        Instant now = Instant.now();
        return Order.reconstitute(OrderId.generate(), 42L, Money.ofMinor(total), kind, status,
                "Moscow", null, OrderExtension.empty(), now, now);
    }

    @Nested
    @DisplayName("Order Creation")
    class OrderCreation {

        @Test
        @DisplayName("should_create_order_in_new_status")
        void should_create_order_in_new_status() {
            // When
            Order order = Order.create(42L, Money.ofMinor(350_000), FulfillmentKind.FULL, "Moscow",
                    OrderExtension.empty().put(OrderExtension.PICKUP_POINT_CODE, "MSK42"));

            // Then
            assertThat(order.getOrderId()).isNotNull();
            assertThat(order.getStatus()).isEqualTo(OrderStatus.NEW);
            assertThat(order.getTrackingNumber()).isNull();
            assertThat(order.getExtension().getString(OrderExtension.PICKUP_POINT_CODE)).contains("MSK42");
            assertThat(order.getStatusChangedAt()).isEqualTo(order.getCreatedAt());
        }

        @Test
        @DisplayName("should_reject_zero_total")
        void should_reject_zero_total() {
            assertThatThrownBy(() -> Order.create(42L, Money.zero(), FulfillmentKind.FULL, "Moscow", null))
                    .isInstanceOf(InvalidOrderException.class);
        }
    }

    @Nested
    @DisplayName("Amounts")
    class Amounts {

        @Test
        @DisplayName("should_split_prepay_and_remainder")
        void should_split_prepay_and_remainder() {
            Order order = orderIn(OrderStatus.NEW, FulfillmentKind.PREPAY_REMAINDER, 100_001);

            assertThat(order.amountDue(PaymentKind.PREPAY, PREPAY_PERCENT).getMinorUnits()).isEqualTo(30_001);
            assertThat(order.amountDue(PaymentKind.REMAINDER, PREPAY_PERCENT).getMinorUnits()).isEqualTo(70_000);
        }

        @Test
        @DisplayName("should_reject_payment_kind_of_other_fulfillment_kind")
        void should_reject_payment_kind_of_other_fulfillment_kind() {
            Order order = orderIn(OrderStatus.NEW, FulfillmentKind.FULL, 350_000);

            assertThatThrownBy(() -> order.amountDue(PaymentKind.PREPAY, PREPAY_PERCENT))
                    .isInstanceOf(InvalidOrderException.class);
        }

        @Test
        @DisplayName("should_derive_paid_amount_from_status")
        void should_derive_paid_amount_from_status() {
            assertThat(orderIn(OrderStatus.PENDING_PAYMENT, FulfillmentKind.PREPAY_REMAINDER, 350_000)
                    .paidAmount(PREPAY_PERCENT).getMinorUnits()).isZero();
            assertThat(orderIn(OrderStatus.PAID_PARTIALLY, FulfillmentKind.PREPAY_REMAINDER, 350_000)
                    .paidAmount(PREPAY_PERCENT).getMinorUnits()).isEqualTo(105_000);
            assertThat(orderIn(OrderStatus.SHIPPED, FulfillmentKind.FULL, 350_000)
                    .paidAmount(PREPAY_PERCENT).getMinorUnits()).isEqualTo(350_000);
        }
    }

    @Nested
    @DisplayName("Tracking and extension")
    class TrackingAndExtension {

        @Test
        @DisplayName("should_treat_box_prefixed_and_empty_tracking_as_placeholder")
        void should_treat_box_prefixed_and_empty_tracking_as_placeholder() {
            OrderId orderId = OrderId.generate();

            assertThat(Order.isPlaceholderTracking(Order.placeholderTracking(orderId))).isTrue();
            assertThat(Order.isPlaceholderTracking(null)).isTrue();
            assertThat(Order.isPlaceholderTracking(" ")).isTrue();
            assertThat(Order.isPlaceholderTracking("1234567890")).isFalse();
        }

        @Test
        @DisplayName("should_hand_out_detached_extension_copies")
        void should_hand_out_detached_extension_copies() {
            Order order = orderIn(OrderStatus.NEW, FulfillmentKind.FULL, 350_000);

            order.getExtension().put(OrderExtension.GIFT_MESSAGE, "Happy birthday");

            assertThat(order.getExtension().getString(OrderExtension.GIFT_MESSAGE)).isEmpty();
        }

        @Test
        @DisplayName("should_track_pending_payments_per_kind")
        void should_track_pending_payments_per_kind() {
            OrderExtension extension = OrderExtension.empty()
                    .putPendingPayment(PaymentKind.PREPAY, "pay-1")
                    .put(OrderExtension.PAYMENT_ID, "pay-0");

            assertThat(extension.pendingPayments()).containsEntry("prepay", "pay-1");
            assertThat(extension.isRecordedPayment("pay-0")).isTrue();

            extension.removePendingPayment(PaymentKind.PREPAY);

            assertThat(extension.view()).doesNotContainKey(OrderExtension.PENDING_PAYMENTS);
        }
    }

    @Test
    @DisplayName("should_parse_order_id_leniently_for_untrusted_input")
    void should_parse_order_id_leniently_for_untrusted_input() {
        assertThat(OrderId.tryParse("not-a-uuid")).isEmpty();
        assertThat(OrderId.tryParse(null)).isEmpty();
        assertThat(OrderId.tryParse(" 7d4e1a52-2a61-4c39-9d1d-3a7f2a1b9c00 "))
                .map(OrderId::getValue)
                .contains("7d4e1a52-2a61-4c39-9d1d-3a7f2a1b9c00");
    }
}
