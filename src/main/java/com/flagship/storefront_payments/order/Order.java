package com.flagship.storefront_payments.order;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Order domain object as seen by the payment flows.
 *
 * Amounts are fixed when the order is created: {@code totalPrice} must equal
 * {@code subTotal + tax + shipping - discount} and nothing here recomputes it.
 * Payment state changes only through the guarded writes of {@link OrderStore},
 * which check the sets on {@link PaymentStatus}.
 */
@Value
public class Order {
    UUID id;
    UUID userId;
    String orderNumber;
    BigDecimal subTotal;
    BigDecimal tax;
    BigDecimal shipping;
    BigDecimal discount;
    BigDecimal totalPrice;
    OrderStatus status;
    PaymentStatus paymentStatus;
    String paymentMethod;
    String paymentReference;
    List<OrderItem> items;
    Instant createdAt;
    Instant updatedAt;
    Instant completedAt;
    Instant cancelledAt;

    /**
     * Creates a new unpaid order.
     *
     * @throws IllegalArgumentException if any amount is negative, the total does not add up,
     *                                  or there are no items
     */
    public static Order create(UUID userId, String orderNumber,
                               BigDecimal subTotal, BigDecimal tax, BigDecimal shipping,
                               BigDecimal discount, BigDecimal totalPrice, List<OrderItem> items) {
        if (userId == null) {
            throw new IllegalArgumentException("User ID is required");
        }
        if (orderNumber == null || orderNumber.isBlank()) {
            throw new IllegalArgumentException("Order number is required");
        }
        requireNonNegative("sub_total", subTotal);
        requireNonNegative("tax", tax);
        requireNonNegative("shipping", shipping);
        requireNonNegative("discount", discount);
        requireNonNegative("total_price", totalPrice);

        BigDecimal expected = subTotal.add(tax).add(shipping).subtract(discount);
        if (expected.compareTo(totalPrice) != 0) {
            throw new IllegalArgumentException(String.format(
                "Order total %s does not match sub_total + tax + shipping - discount = %s",
                totalPrice, expected));
        }
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("An order needs at least one item");
        }

        UUID id = UUID.randomUUID();
        Instant now = Instant.now();
        return new Order(
            id,
            userId,
            orderNumber,
            subTotal,
            tax,
            shipping,
            discount,
            totalPrice,
            OrderStatus.PENDING,
            PaymentStatus.PENDING,
            null,
            null,
            items.stream().map(item -> item.belongingTo(id)).toList(),
            now,
            now,
            null,
            null
        );
    }

    public boolean isOwnedBy(UUID callerId) {
        return userId.equals(callerId);
    }

    public boolean isSettled() {
        return paymentStatus.isSettled();
    }

    public boolean isCancelled() {
        return status == OrderStatus.CANCELLED;
    }

    private static void requireNonNegative(String field, BigDecimal amount) {
        if (amount == null) {
            throw new IllegalArgumentException(field + " is required");
        }
        if (amount.signum() < 0) {
            throw new IllegalArgumentException(field + " must be non-negative, was " + amount);
        }
    }
}
