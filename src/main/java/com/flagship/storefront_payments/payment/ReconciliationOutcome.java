package com.flagship.storefront_payments.payment;

/**
 * What a gateway verdict means for an order.
 */
public enum ReconciliationOutcome {

    /** Gateway reports success for the full amount in the expected currency. */
    PAID(true),

    /** Gateway reports a terminal failure (failed or abandoned). */
    FAILED(true),

    /** Gateway reports success, but for a different amount or currency than the order. */
    AMOUNT_MISMATCH(true),

    /** Gateway has no final answer yet; nothing is written. */
    STILL_PENDING(false),

    /** The order was already paid or refunded; the gateway was not consulted. */
    ALREADY_SETTLED(false);

    private final boolean requiresWrite;

    ReconciliationOutcome(boolean requiresWrite) {
        this.requiresWrite = requiresWrite;
    }

    public boolean requiresWrite() {
        return requiresWrite;
    }
}
