package com.flagship.storefront_payments.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.storefront_payments.order.PaymentStatus;
import com.flagship.storefront_payments.payment.PaymentInitiation;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class InitiatePaymentResponse {

    @JsonProperty("success")
    boolean success;

    @JsonProperty("order_id")
    UUID orderId;

    @JsonProperty("order_number")
    String orderNumber;

    @JsonProperty("payment_reference")
    String paymentReference;

    @JsonProperty("authorization_url")
    String authorizationUrl;

    @JsonProperty("access_code")
    String accessCode;

    @JsonProperty("payment_status")
    PaymentStatus paymentStatus;

    public static InitiatePaymentResponse from(PaymentInitiation initiation) {
        return InitiatePaymentResponse.builder()
            .success(true)
            .orderId(initiation.getOrderId())
            .orderNumber(initiation.getOrderNumber())
            .paymentReference(initiation.getPaymentReference())
            .authorizationUrl(initiation.getAuthorizationUrl())
            .accessCode(initiation.getAccessCode())
            .paymentStatus(initiation.getPaymentStatus())
            .build();
    }
}
