package com.flagship.storefront_payments.gateway;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * The gateway's verdict on a transaction. Amounts are in minor units as reported.
 */
@Value
@Builder
public class GatewayVerification {
    String reference;
    TransactionStatus status;
    String rawStatus;
    long amountMinorUnits;
    String currency;
    Instant paidAt;
    String channel;
    Long feesMinorUnits;
    String gatewayMessage;

    public BigDecimal getAmountMajorUnits() {
        return MinorUnits.toMajor(amountMinorUnits);
    }

    public BigDecimal getFeesMajorUnits() {
        return feesMinorUnits != null ? MinorUnits.toMajor(feesMinorUnits) : null;
    }
}
