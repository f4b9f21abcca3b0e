package com.flagship.storefront_payments.payment.event;

import com.flagship.storefront_payments.order.Order;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when a gateway transaction has been opened for an order.
 */
@Value
public class PaymentInitiatedEvent implements PaymentEvent {
    UUID eventId;
    UUID orderId;
    String orderNumber;
    UUID userId;
    String paymentReference;
    String paymentMethod;
    BigDecimal amount;
    String currency;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PaymentInitiated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PaymentInitiatedEvent of(Order order, String reference, String method,
                                           String currency, Instant occurredAt) {
        return new PaymentInitiatedEvent(
            UUID.randomUUID(),
            order.getId(),
            order.getOrderNumber(),
            order.getUserId(),
            reference,
            method,
            order.getTotalPrice(),
            currency,
            occurredAt
        );
    }
}
