package com.flagship.storefront_payments.order;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence port for orders.
 *
 * Reads issued on behalf of a user are always scoped by that user. Every mutation is a
 * single guarded write: it only applies when the row is still in the expected state,
 * and the returned flag tells the caller whether it won. Callers never read-modify-write.
 */
public interface OrderStore {

    Optional<Order> findOwnedById(UUID orderId, UUID userId);

    Optional<Order> findOwnedByReference(String reference, UUID userId);

    /**
     * Unscoped lookup, for service-identity callers (gateway webhooks) and re-reads after
     * a guarded write on an order whose ownership was already checked.
     */
    Optional<Order> findById(UUID orderId);

    Optional<Order> findByReference(String reference);

    Order create(Order order);

    /**
     * Stores a new gateway reference and method and resets the payment to PENDING,
     * provided the order is still owned by the user, not settled and not cancelled.
     */
    boolean recordInitiation(UUID orderId, UUID userId, String reference, String method, Instant at);

    /**
     * Marks the payment FAILED after the gateway refused to open a transaction.
     * A settled order is never demoted.
     */
    boolean markInitiationFailed(UUID orderId, UUID userId, Instant at);

    /**
     * PENDING to PAID, completing the order. Applies only while the stored reference
     * equals {@code reference}.
     */
    boolean markPaid(UUID orderId, String reference, Instant at);

    /**
     * PENDING to FAILED. Applies only while the stored reference equals {@code reference}.
     */
    boolean markPaymentFailed(UUID orderId, String reference, Instant at);
}
