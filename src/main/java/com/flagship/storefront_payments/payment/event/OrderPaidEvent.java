package com.flagship.storefront_payments.payment.event;

import com.flagship.storefront_payments.gateway.GatewayVerification;
import com.flagship.storefront_payments.order.Order;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published exactly once per order, by whichever reconciliation wins the PENDING to PAID write.
 * Downstream fulfilment (content access, receipts) keys off this event.
 */
@Value
public class OrderPaidEvent implements PaymentEvent {
    UUID eventId;
    UUID orderId;
    String orderNumber;
    UUID userId;
    String paymentReference;
    BigDecimal amount;
    String currency;
    String channel;
    Instant gatewayPaidAt;
    Instant occurredAt;

    public static final String EVENT_TYPE = "OrderPaid";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static OrderPaidEvent of(Order order, String reference, GatewayVerification verification,
                                    Instant occurredAt) {
        return new OrderPaidEvent(
            UUID.randomUUID(),
            order.getId(),
            order.getOrderNumber(),
            order.getUserId(),
            reference,
            verification.getAmountMajorUnits(),
            verification.getCurrency(),
            verification.getChannel(),
            verification.getPaidAt(),
            occurredAt
        );
    }
}
