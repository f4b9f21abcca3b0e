package com.flagship.storefront_payments.order;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Fulfilment status of an order. Only COMPLETED is ever written by the payment flows;
 * the remaining values belong to the order collaborators.
 */
public enum OrderStatus {

    PENDING("pending"),
    PROCESSING("processing"),
    SHIPPED("shipped"),
    DELIVERED("delivered"),
    COMPLETED("completed"),
    CANCELLED("cancelled");

    private final String value;

    OrderStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
