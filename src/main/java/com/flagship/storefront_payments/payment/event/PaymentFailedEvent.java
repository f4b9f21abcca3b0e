package com.flagship.storefront_payments.payment.event;

import com.flagship.storefront_payments.order.Order;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when an order's payment moves to FAILED.
 *
 * Reasons: {@code initiation_failed}, {@code amount_mismatch}, or the gateway's own
 * terminal status ({@code failed}, {@code abandoned}).
 */
@Value
public class PaymentFailedEvent implements PaymentEvent {
    UUID eventId;
    UUID orderId;
    String orderNumber;
    UUID userId;
    String paymentReference;
    String failureReason;
    String previousStatus;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PaymentFailed";

    public static final String REASON_INITIATION_FAILED = "initiation_failed";
    public static final String REASON_AMOUNT_MISMATCH = "amount_mismatch";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PaymentFailedEvent of(Order order, String reference, String failureReason,
                                        Instant occurredAt) {
        return new PaymentFailedEvent(
            UUID.randomUUID(),
            order.getId(),
            order.getOrderNumber(),
            order.getUserId(),
            reference,
            failureReason,
            order.getPaymentStatus().getValue(),
            occurredAt
        );
    }
}
