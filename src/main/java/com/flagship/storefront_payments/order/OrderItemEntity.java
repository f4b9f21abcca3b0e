package com.flagship.storefront_payments.order;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * JPA entity for order lines. All columns are write-once.
 * The owning {@code order_id} column is mapped by {@link OrderEntity#getItems()}.
 */
@Entity
@Table(name = "order_items")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OrderItemEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "content_id", nullable = false, updatable = false)
    private UUID contentId;

    @Column(nullable = false, updatable = false)
    private int quantity;

    @Column(name = "unit_price", nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal unitPrice;

    @Column(name = "total_price", nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal totalPrice;

    static OrderItemEntity fromDomain(OrderItem item) {
        return new OrderItemEntity(
            item.getId(),
            item.getContentId(),
            item.getQuantity(),
            item.getUnitPrice(),
            item.getTotalPrice()
        );
    }

    OrderItem toDomain(UUID orderId) {
        return new OrderItem(id, orderId, contentId, quantity, unitPrice, totalPrice);
    }
}
