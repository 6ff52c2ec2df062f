package com.example.fulfillment.domain.model;

import com.example.fulfillment.domain.exception.InvalidOrderException;

import java.time.Instant;
import java.util.Objects;

/**
 * Aggregate Root representing a customer order. Instances are snapshots of
 * the stored state; status changes are applied only through the transition
 * validator and never by mutating this object.
 */
public final class Order {

    static final String PLACEHOLDER_TRACKING_PREFIX = "BOX";

    private final OrderId orderId;
    private final long ownerChatId;
    private final Money totalAmount;
    private final FulfillmentKind fulfillmentKind;
    private final OrderStatus status;
    private final String deliveryAddress;
    private final String trackingNumber;
    private final OrderExtension extension;
    private final Instant createdAt;
    private final Instant statusChangedAt;

    private Order(OrderId orderId, long ownerChatId, Money totalAmount, FulfillmentKind fulfillmentKind,
                  OrderStatus status, String deliveryAddress, String trackingNumber,
                  OrderExtension extension, Instant createdAt, Instant statusChangedAt) {
        this.orderId = Objects.requireNonNull(orderId, "OrderId cannot be null");
        this.ownerChatId = ownerChatId;
        this.totalAmount = Objects.requireNonNull(totalAmount, "Total amount cannot be null");
        this.fulfillmentKind = Objects.requireNonNull(fulfillmentKind, "Fulfillment kind cannot be null");
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        this.deliveryAddress = deliveryAddress;
        this.trackingNumber = trackingNumber;
        this.extension = extension != null ? extension : OrderExtension.empty();
        this.createdAt = Objects.requireNonNull(createdAt, "CreatedAt cannot be null");
        this.statusChangedAt = statusChangedAt != null ? statusChangedAt : createdAt;
    }

    /**
     * Creates a new order in {@link OrderStatus#NEW} at checkout confirmation.
     *
     * @throws InvalidOrderException if the total is not positive
     */
    public static Order create(long ownerChatId, Money totalAmount, FulfillmentKind fulfillmentKind,
                               String deliveryAddress, OrderExtension extension) {
        if (totalAmount == null || totalAmount.isZero()) {
            throw new InvalidOrderException("Order total must be positive");
        }
        Instant now = Instant.now();
        return new Order(OrderId.generate(), ownerChatId, totalAmount, fulfillmentKind, OrderStatus.NEW,
                deliveryAddress, null, extension, now, now);
    }

    /**
     * Reconstitutes an Order from persistence.
     */
    public static Order reconstitute(OrderId orderId, long ownerChatId, Money totalAmount,
                                     FulfillmentKind fulfillmentKind, OrderStatus status,
                                     String deliveryAddress, String trackingNumber,
                                     OrderExtension extension, Instant createdAt, Instant statusChangedAt) {
        return new Order(orderId, ownerChatId, totalAmount, fulfillmentKind, status, deliveryAddress,
                trackingNumber, extension, createdAt, statusChangedAt);
    }

    /**
     * Temporary tracking value stored when the carrier accepts a shipment,
     * until the carrier assigns its own number.
     */
    public static String placeholderTracking(OrderId orderId) {
        return PLACEHOLDER_TRACKING_PREFIX + orderId.getValue();
    }

    public static boolean isPlaceholderTracking(String trackingNumber) {
        return trackingNumber == null
                || trackingNumber.isBlank()
                || trackingNumber.startsWith(PLACEHOLDER_TRACKING_PREFIX);
    }

    /**
     * Amount to charge for a payment of the given kind.
     *
     * @param kind          payment kind
     * @param prepayPercent prepayment share for prepay/remainder orders
     * @throws InvalidOrderException if the kind does not apply to this order
     */
    public Money amountDue(PaymentKind kind, int prepayPercent) {
        if (!kind.appliesTo(fulfillmentKind)) {
            throw new InvalidOrderException(
                    "Payment kind " + kind + " does not apply to a " + fulfillmentKind + " order");
        }
        Money prepay = totalAmount.percentRoundedUp(prepayPercent);
        return switch (kind) {
            case FULL -> totalAmount;
            case PREPAY -> prepay;
            case REMAINDER -> totalAmount.subtract(prepay);
        };
    }

    /**
     * Amount collected so far, derived from the status.
     */
    public Money paidAmount(int prepayPercent) {
        if (status.isPaymentSettled()) {
            return totalAmount;
        }
        if (status == OrderStatus.PAID_PARTIALLY) {
            return totalAmount.percentRoundedUp(prepayPercent);
        }
        return Money.ofMinor(0, totalAmount.getCurrency());
    }

    public boolean hasPlaceholderTracking() {
        return isPlaceholderTracking(trackingNumber);
    }

    public OrderId getOrderId() {
        return orderId;
    }

    public long getOwnerChatId() {
        return ownerChatId;
    }

    public Money getTotalAmount() {
        return totalAmount;
    }

    public FulfillmentKind getFulfillmentKind() {
        return fulfillmentKind;
    }

    public OrderStatus getStatus() {
        return status;
    }

    public String getDeliveryAddress() {
        return deliveryAddress;
    }

    public String getTrackingNumber() {
        return trackingNumber;
    }

    public OrderExtension getExtension() {
        return OrderExtension.copyOf(extension.view());
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getStatusChangedAt() {
        return statusChangedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Order order = (Order) o;
        return Objects.equals(orderId, order.orderId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(orderId);
    }

    @Override
    public String toString() {
        return "Order{" +
                "orderId=" + orderId +
                ", status=" + status +
                ", kind=" + fulfillmentKind +
                ", totalAmount=" + totalAmount +
                '}';
    }
}
