package com.flagship.storefront_payments.gateway.paystack;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Body of {@code POST /transaction/initialize}. {@code amount} is in minor units.
 */
public record InitializeTransactionRequest(
        String email,
        long amount,
        String currency,
        String reference,
        @JsonProperty("callback_url") String callbackUrl,
        List<String> channels,
        Map<String, Object> metadata) {
}
