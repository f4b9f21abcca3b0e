package com.flagship.storefront_payments.order;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OneToMany;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * JPA entity for orders.
 *
 * Key design principles:
 * - No setters: payment columns only change through the guarded updates in {@link OrderRepository}
 * - Amounts, owner and order number are not updatable
 * - fromDomain() is the only way to create instances
 */
@Entity
@Table(
    name = "orders",
    indexes = {
        @Index(name = "idx_orders_user_id", columnList = "user_id"),
        @Index(name = "idx_orders_payment_reference", columnList = "payment_reference")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OrderEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "order_number", nullable = false, updatable = false, unique = true)
    private String orderNumber;

    @Column(name = "sub_total", nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal subTotal;

    @Column(nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal tax;

    @Column(nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal shipping;

    @Column(nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal discount;

    @Column(name = "total_price", nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal totalPrice;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private OrderStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 20)
    private PaymentStatus paymentStatus;

    @Column(name = "payment_method", length = 50)
    private String paymentMethod;

    @Column(name = "payment_reference", unique = true)
    private String paymentReference;

    @OneToMany(cascade = {CascadeType.PERSIST, CascadeType.MERGE})
    @JoinColumn(name = "order_id", nullable = false, updatable = false)
    private List<OrderItemEntity> items = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        if (this.updatedAt == null) {
            this.updatedAt = this.createdAt;
        }
    }

    static OrderEntity fromDomain(Order order) {
        return new OrderEntity(
            order.getId(),
            order.getUserId(),
            order.getOrderNumber(),
            order.getSubTotal(),
            order.getTax(),
            order.getShipping(),
            order.getDiscount(),
            order.getTotalPrice(),
            order.getStatus(),
            order.getPaymentStatus(),
            order.getPaymentMethod(),
            order.getPaymentReference(),
            new ArrayList<>(order.getItems().stream().map(OrderItemEntity::fromDomain).toList()),
            order.getCreatedAt(),
            order.getUpdatedAt(),
            order.getCompletedAt(),
            order.getCancelledAt()
        );
    }

    public Order toDomain() {
        return new Order(
            id,
            userId,
            orderNumber,
            subTotal,
            tax,
            shipping,
            discount,
            totalPrice,
            status,
            paymentStatus,
            paymentMethod,
            paymentReference,
            items.stream().map(item -> item.toDomain(id)).toList(),
            createdAt,
            updatedAt,
            completedAt,
            cancelledAt
        );
    }
}
