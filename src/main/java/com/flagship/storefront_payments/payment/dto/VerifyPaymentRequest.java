package com.flagship.storefront_payments.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

/**
 * At least one of {@code reference} and {@code order_id} must be present.
 */
public record VerifyPaymentRequest(
        @JsonProperty("reference") String reference,
        @JsonProperty("order_id") UUID orderId) {
}
