package com.flagship.storefront_payments.order;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for orders.
 *
 * The update queries are compare-and-swap writes: the WHERE clause carries the expected
 * prior state and the affected-row count tells the caller whether the swap happened.
 * They bypass the persistence context, so {@code updated_at} is set explicitly.
 */
@Repository
public interface OrderRepository extends JpaRepository<OrderEntity, UUID> {

    Optional<OrderEntity> findByIdAndUserId(UUID id, UUID userId);

    Optional<OrderEntity> findByPaymentReferenceAndUserId(String paymentReference, UUID userId);

    Optional<OrderEntity> findByPaymentReference(String paymentReference);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE OrderEntity o
        SET o.paymentReference = :reference,
            o.paymentMethod = :method,
            o.paymentStatus = :pending,
            o.updatedAt = :at
        WHERE o.id = :orderId
          AND o.userId = :userId
          AND o.paymentStatus IN :initiable
          AND o.status <> :cancelled
        """)
    int recordInitiation(@Param("orderId") UUID orderId,
                         @Param("userId") UUID userId,
                         @Param("reference") String reference,
                         @Param("method") String method,
                         @Param("at") Instant at,
                         @Param("pending") PaymentStatus pending,
                         @Param("initiable") Collection<PaymentStatus> initiable,
                         @Param("cancelled") OrderStatus cancelled);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE OrderEntity o
        SET o.paymentStatus = :failed,
            o.updatedAt = :at
        WHERE o.id = :orderId
          AND o.userId = :userId
          AND o.paymentStatus IN :initiable
        """)
    int markInitiationFailed(@Param("orderId") UUID orderId,
                             @Param("userId") UUID userId,
                             @Param("at") Instant at,
                             @Param("failed") PaymentStatus failed,
                             @Param("initiable") Collection<PaymentStatus> initiable);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE OrderEntity o
        SET o.paymentStatus = :paid,
            o.status = :completed,
            o.completedAt = :at,
            o.updatedAt = :at
        WHERE o.id = :orderId
          AND o.paymentStatus IN :awaiting
          AND o.paymentReference = :reference
        """)
    int markPaid(@Param("orderId") UUID orderId,
                 @Param("reference") String reference,
                 @Param("at") Instant at,
                 @Param("awaiting") Collection<PaymentStatus> awaiting,
                 @Param("paid") PaymentStatus paid,
                 @Param("completed") OrderStatus completed);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE OrderEntity o
        SET o.paymentStatus = :failed,
            o.updatedAt = :at
        WHERE o.id = :orderId
          AND o.paymentStatus IN :awaiting
          AND o.paymentReference = :reference
        """)
    int markPaymentFailed(@Param("orderId") UUID orderId,
                          @Param("reference") String reference,
                          @Param("at") Instant at,
                          @Param("awaiting") Collection<PaymentStatus> awaiting,
                          @Param("failed") PaymentStatus failed);
}
