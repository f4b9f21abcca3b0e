package com.flagship.storefront_payments.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.storefront_payments.order.Order;
import com.flagship.storefront_payments.order.OrderStatus;
import com.flagship.storefront_payments.order.PaymentStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class PaymentStatusResponse {

    @JsonProperty("order_id")
    UUID orderId;

    @JsonProperty("order_number")
    String orderNumber;

    @JsonProperty("payment_status")
    PaymentStatus paymentStatus;

    @JsonProperty("order_status")
    OrderStatus orderStatus;

    @JsonProperty("payment_method")
    String paymentMethod;

    @JsonProperty("payment_reference")
    String paymentReference;

    @JsonProperty("total_price")
    BigDecimal totalPrice;

    @JsonProperty("completed_at")
    Instant completedAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static PaymentStatusResponse from(Order order) {
        return PaymentStatusResponse.builder()
            .orderId(order.getId())
            .orderNumber(order.getOrderNumber())
            .paymentStatus(order.getPaymentStatus())
            .orderStatus(order.getStatus())
            .paymentMethod(order.getPaymentMethod())
            .paymentReference(order.getPaymentReference())
            .totalPrice(order.getTotalPrice())
            .completedAt(order.getCompletedAt())
            .updatedAt(order.getUpdatedAt())
            .build();
    }
}
