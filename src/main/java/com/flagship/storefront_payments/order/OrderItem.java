package com.flagship.storefront_payments.order;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A line of an order. Written once together with its order and never updated.
 */
@Value
public class OrderItem {
    UUID id;
    UUID orderId;
    UUID contentId;
    int quantity;
    BigDecimal unitPrice;
    BigDecimal totalPrice;

    /**
     * Creates a line not yet attached to an order. The line total is derived, never supplied.
     */
    public static OrderItem of(UUID contentId, int quantity, BigDecimal unitPrice) {
        if (contentId == null) {
            throw new IllegalArgumentException("Content ID is required");
        }
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be greater than 0, was " + quantity);
        }
        if (unitPrice == null || unitPrice.signum() < 0) {
            throw new IllegalArgumentException("Unit price must be non-negative");
        }
        return new OrderItem(
            UUID.randomUUID(),
            null,
            contentId,
            quantity,
            unitPrice,
            unitPrice.multiply(BigDecimal.valueOf(quantity))
        );
    }

    OrderItem belongingTo(UUID orderId) {
        return new OrderItem(id, orderId, contentId, quantity, unitPrice, totalPrice);
    }
}
