package com.flagship.storefront_payments.gateway.paystack;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Transaction as returned by {@code GET /transaction/verify/{reference}}.
 * Amounts are in minor units.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TransactionData(
        Long id,
        String status,
        String reference,
        Long amount,
        String currency,
        @JsonProperty("paid_at") Instant paidAt,
        String channel,
        Long fees,
        @JsonProperty("gateway_response") String gatewayResponse) {
}
