package com.flagship.storefront_payments.order;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link OrderStore} over a map. Each guarded write is atomic under the store's lock and
 * checks the same {@link PaymentStatus} sets as the conditional UPDATEs of {@link JpaOrderStore}.
 */
public class InMemoryOrderStore implements OrderStore {

    private final Map<UUID, Order> orders = new ConcurrentHashMap<>();
    private final AtomicInteger successfulWrites = new AtomicInteger();

    public Order put(Order order) {
        orders.put(order.getId(), order);
        return order;
    }

    public Order get(UUID orderId) {
        return orders.get(orderId);
    }

    public int successfulWrites() {
        return successfulWrites.get();
    }

    @Override
    public Optional<Order> findOwnedById(UUID orderId, UUID userId) {
        return findById(orderId).filter(order -> order.isOwnedBy(userId));
    }

    @Override
    public Optional<Order> findOwnedByReference(String reference, UUID userId) {
        return findByReference(reference).filter(order -> order.isOwnedBy(userId));
    }

    @Override
    public Optional<Order> findById(UUID orderId) {
        return Optional.ofNullable(orders.get(orderId));
    }

    @Override
    public Optional<Order> findByReference(String reference) {
        return orders.values().stream()
            .filter(order -> Objects.equals(order.getPaymentReference(), reference))
            .findFirst();
    }

    @Override
    public Order create(Order order) {
        return put(order);
    }

    @Override
    public synchronized boolean recordInitiation(UUID orderId, UUID userId, String reference, String method, Instant at) {
        Order order = orders.get(orderId);
        if (order == null || !order.isOwnedBy(userId)
                || !PaymentStatus.INITIABLE.contains(order.getPaymentStatus()) || order.isCancelled()) {
            return false;
        }
        return write(updated(order, order.getStatus(), PaymentStatus.PENDING, method, reference, at,
            order.getCompletedAt()));
    }

    @Override
    public synchronized boolean markInitiationFailed(UUID orderId, UUID userId, Instant at) {
        Order order = orders.get(orderId);
        if (order == null || !order.isOwnedBy(userId)
                || !PaymentStatus.INITIABLE.contains(order.getPaymentStatus())) {
            return false;
        }
        return write(updated(order, order.getStatus(), PaymentStatus.FAILED,
            order.getPaymentMethod(), order.getPaymentReference(), at, order.getCompletedAt()));
    }

    @Override
    public synchronized boolean markPaid(UUID orderId, String reference, Instant at) {
        Order order = orders.get(orderId);
        if (!awaitingVerdictUnder(order, reference)) {
            return false;
        }
        return write(updated(order, OrderStatus.COMPLETED, PaymentStatus.PAID,
            order.getPaymentMethod(), reference, at, at));
    }

    @Override
    public synchronized boolean markPaymentFailed(UUID orderId, String reference, Instant at) {
        Order order = orders.get(orderId);
        if (!awaitingVerdictUnder(order, reference)) {
            return false;
        }
        return write(updated(order, order.getStatus(), PaymentStatus.FAILED,
            order.getPaymentMethod(), reference, at, order.getCompletedAt()));
    }

    private boolean awaitingVerdictUnder(Order order, String reference) {
        return order != null
            && PaymentStatus.AWAITING_VERDICT.contains(order.getPaymentStatus())
            && Objects.equals(order.getPaymentReference(), reference);
    }

    private static Order updated(Order order, OrderStatus status, PaymentStatus paymentStatus,
                                 String method, String reference, Instant at, Instant completedAt) {
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
            method,
            reference,
            order.getItems(),
            order.getCreatedAt(),
            at,
            completedAt,
            order.getCancelledAt()
        );
    }

    private boolean write(Order updated) {
        orders.put(updated.getId(), updated);
        successfulWrites.incrementAndGet();
        return true;
    }
}
