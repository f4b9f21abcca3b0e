package com.flagship.storefront_payments.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.storefront_payments.order.OrderStatus;
import com.flagship.storefront_payments.order.PaymentStatus;
import com.flagship.storefront_payments.payment.PaymentVerification;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class VerifyPaymentResponse {

    @JsonProperty("success")
    boolean success;

    @JsonProperty("order_id")
    UUID orderId;

    @JsonProperty("order_number")
    String orderNumber;

    @JsonProperty("payment_reference")
    String paymentReference;

    @JsonProperty("payment_status")
    PaymentStatus paymentStatus;

    @JsonProperty("order_status")
    OrderStatus orderStatus;

    @JsonProperty("transaction_status")
    String transactionStatus;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("paid_at")
    Instant paidAt;

    @JsonProperty("channel")
    String channel;

    @JsonProperty("fees")
    BigDecimal fees;

    @JsonProperty("still_pending")
    boolean stillPending;

    public static VerifyPaymentResponse from(PaymentVerification verification) {
        return VerifyPaymentResponse.builder()
            .success(true)
            .orderId(verification.getOrderId())
            .orderNumber(verification.getOrderNumber())
            .paymentReference(verification.getPaymentReference())
            .paymentStatus(verification.getPaymentStatus())
            .orderStatus(verification.getOrderStatus())
            .transactionStatus(verification.getTransactionStatus())
            .amount(verification.getAmount())
            .currency(verification.getCurrency())
            .paidAt(verification.getPaidAt())
            .channel(verification.getChannel())
            .fees(verification.getFees())
            .stillPending(verification.isStillPending())
            .build();
    }
}
