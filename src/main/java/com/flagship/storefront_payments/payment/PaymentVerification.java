package com.flagship.storefront_payments.payment;

import com.flagship.storefront_payments.gateway.GatewayVerification;
import com.flagship.storefront_payments.order.Order;
import com.flagship.storefront_payments.order.OrderStatus;
import com.flagship.storefront_payments.order.PaymentStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Normalized result of a verification, combining the order's committed state with
 * what the gateway reported.
 */
@Value
@Builder
public class PaymentVerification {

    static final String SETTLED_TRANSACTION_STATUS = "success";

    UUID orderId;
    String orderNumber;
    String paymentReference;
    PaymentStatus paymentStatus;
    OrderStatus orderStatus;
    String transactionStatus;
    BigDecimal amount;
    String currency;
    Instant paidAt;
    String channel;
    BigDecimal fees;
    ReconciliationOutcome outcome;

    public boolean isStillPending() {
        return outcome == ReconciliationOutcome.STILL_PENDING;
    }

    /**
     * Result served for a settled order without asking the gateway again.
     */
    public static PaymentVerification settled(Order order) {
        return PaymentVerification.builder()
                .orderId(order.getId())
                .orderNumber(order.getOrderNumber())
                .paymentReference(order.getPaymentReference())
                .paymentStatus(order.getPaymentStatus())
                .orderStatus(order.getStatus())
                .transactionStatus(order.getPaymentStatus() == PaymentStatus.PAID
                        ? SETTLED_TRANSACTION_STATUS
                        : order.getPaymentStatus().getValue())
                .amount(order.getTotalPrice())
                .paidAt(order.getCompletedAt())
                .outcome(ReconciliationOutcome.ALREADY_SETTLED)
                .build();
    }

    static PaymentVerification of(Order current, String reference, GatewayVerification verification,
                                  ReconciliationOutcome outcome) {
        return PaymentVerification.builder()
                .orderId(current.getId())
                .orderNumber(current.getOrderNumber())
                .paymentReference(reference)
                .paymentStatus(current.getPaymentStatus())
                .orderStatus(current.getStatus())
                .transactionStatus(verification.getRawStatus())
                .amount(verification.getAmountMajorUnits())
                .currency(verification.getCurrency())
                .paidAt(verification.getPaidAt())
                .channel(verification.getChannel())
                .fees(verification.getFeesMajorUnits())
                .outcome(outcome)
                .build();
    }
}
