package com.flagship.storefront_payments.gateway;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Request to open a gateway transaction. {@code amount} is in major units.
 */
@Value
@Builder
public class InitiateTransaction {
    String email;
    BigDecimal amount;
    String currency;
    String reference;
    Map<String, Object> metadata;
}
