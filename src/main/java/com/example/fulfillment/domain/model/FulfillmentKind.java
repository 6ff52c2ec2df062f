package com.example.fulfillment.domain.model;

/**
 * How the customer chose to pay for an order.
 */
public enum FulfillmentKind {

    /**
     * One payment for the total amount.
     */
    FULL,

    /**
     * A rounded-up prepayment share, then the remainder before assembly.
     */
    PREPAY_REMAINDER
}
