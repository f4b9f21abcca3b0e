package com.flagship.storefront_payments.order;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Order fixtures. Totals add up: 1300.00 + 208.00 + 100.00 - 108.00 = 1500.00.
 */
public final class TestOrders {

    public static final BigDecimal TOTAL = new BigDecimal("1500.00");

    private TestOrders() {
    }

    public static Order pending(UUID userId) {
        return pending(userId, "ORD-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase());
    }

    public static Order pending(UUID userId, String orderNumber) {
        return Order.create(
            userId,
            orderNumber,
            new BigDecimal("1300.00"),
            new BigDecimal("208.00"),
            new BigDecimal("100.00"),
            new BigDecimal("108.00"),
            TOTAL,
            List.of(
                OrderItem.of(UUID.randomUUID(), 2, new BigDecimal("400.00")),
                OrderItem.of(UUID.randomUUID(), 1, new BigDecimal("500.00"))
            )
        );
    }

    public static Order withState(Order order, OrderStatus status, PaymentStatus paymentStatus, String reference) {
        Instant now = Instant.now();
        return new Order(
            order.getId(),
            order.getUserId(),
            order.getOrderNumber(),
            order.getSubTotal(),
            order.getTax(),
            order.getShipping(),
            order.getDiscount(),
            order.getTotalPrice(),
            status,
            paymentStatus,
            reference != null ? "paystack" : null,
            reference,
            order.getItems(),
            order.getCreatedAt(),
            now,
            paymentStatus == PaymentStatus.PAID ? now : null,
            status == OrderStatus.CANCELLED ? now : null
        );
    }

    public static Order awaitingPayment(UUID userId, String reference) {
        return withState(pending(userId), OrderStatus.PENDING, PaymentStatus.PENDING, reference);
    }
}
