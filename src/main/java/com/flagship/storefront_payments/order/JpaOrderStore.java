package com.flagship.storefront_payments.order;

import com.flagship.storefront_payments.exception.OrderStoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * PostgreSQL-backed {@link OrderStore}.
 *
 * Bridges the domain {@link Order} and {@link OrderEntity}. Guarded writes join the
 * caller's transaction when there is one, so an outbox event written by the caller
 * commits or rolls back together with the status change.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaOrderStore implements OrderStore {

    private final OrderRepository orderRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<Order> findOwnedById(UUID orderId, UUID userId) {
        return read(() -> orderRepository.findByIdAndUserId(orderId, userId).map(OrderEntity::toDomain));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Order> findOwnedByReference(String reference, UUID userId) {
        return read(() -> orderRepository.findByPaymentReferenceAndUserId(reference, userId)
            .map(OrderEntity::toDomain));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Order> findById(UUID orderId) {
        return read(() -> orderRepository.findById(orderId).map(OrderEntity::toDomain));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Order> findByReference(String reference) {
        return read(() -> orderRepository.findByPaymentReference(reference).map(OrderEntity::toDomain));
    }

    @Override
    @Transactional
    public Order create(Order order) {
        try {
            OrderEntity saved = orderRepository.save(OrderEntity.fromDomain(order));
            log.debug("Saved order {} ({})", saved.getId(), saved.getOrderNumber());
            return saved.toDomain();
        } catch (DataAccessException e) {
            throw new OrderStoreException("Failed to save order " + order.getOrderNumber(), e);
        }
    }

    @Override
    @Transactional
    public boolean recordInitiation(UUID orderId, UUID userId, String reference, String method, Instant at) {
        return write("recordInitiation", orderId, () -> orderRepository.recordInitiation(
            orderId, userId, reference, method, at,
            PaymentStatus.PENDING, PaymentStatus.INITIABLE, OrderStatus.CANCELLED));
    }

    @Override
    @Transactional
    public boolean markInitiationFailed(UUID orderId, UUID userId, Instant at) {
        return write("markInitiationFailed", orderId, () -> orderRepository.markInitiationFailed(
            orderId, userId, at, PaymentStatus.FAILED, PaymentStatus.INITIABLE));
    }

    @Override
    @Transactional
    public boolean markPaid(UUID orderId, String reference, Instant at) {
        return write("markPaid", orderId, () -> orderRepository.markPaid(
            orderId, reference, at, PaymentStatus.AWAITING_VERDICT, PaymentStatus.PAID, OrderStatus.COMPLETED));
    }

    @Override
    @Transactional
    public boolean markPaymentFailed(UUID orderId, String reference, Instant at) {
        return write("markPaymentFailed", orderId, () -> orderRepository.markPaymentFailed(
            orderId, reference, at, PaymentStatus.AWAITING_VERDICT, PaymentStatus.FAILED));
    }

    private Optional<Order> read(Supplier<Optional<Order>> query) {
        try {
            return query.get();
        } catch (DataAccessException e) {
            throw new OrderStoreException("Failed to read order", e);
        }
    }

    private boolean write(String operation, UUID orderId, Supplier<Integer> update) {
        try {
            int rows = update.get();
            log.debug("{} on order {} affected {} row(s)", operation, orderId, rows);
            return rows == 1;
        } catch (DataAccessException e) {
            throw new OrderStoreException("Failed to update order " + orderId + " (" + operation + ")", e);
        }
    }
}
