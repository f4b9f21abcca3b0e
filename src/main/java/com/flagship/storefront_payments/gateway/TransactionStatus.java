package com.flagship.storefront_payments.gateway;

import java.util.Locale;

/**
 * Gateway-neutral transaction status.
 */
public enum TransactionStatus {
    SUCCESS,
    FAILED,
    ABANDONED,
    PENDING,
    REVERSED,
    UNKNOWN;

    /**
     * Maps the gateway's status string. Anything unrecognized is UNKNOWN, which the
     * reconciliation treats as not yet settled.
     */
    public static TransactionStatus fromGateway(String status) {
        if (status == null) {
            return UNKNOWN;
        }
        return switch (status.trim().toLowerCase(Locale.ROOT)) {
            case "success" -> SUCCESS;
            case "failed" -> FAILED;
            case "abandoned" -> ABANDONED;
            case "pending", "ongoing", "processing", "queued" -> PENDING;
            case "reversed" -> REVERSED;
            default -> UNKNOWN;
        };
    }
}
