package com.flagship.storefront_payments.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

import java.util.UUID;

public record InitiatePaymentRequest(
        @NotNull(message = "Order ID is required")
        @JsonProperty("order_id")
        UUID orderId) {
}
