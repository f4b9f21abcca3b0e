package com.flagship.storefront_payments.order;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Payment status of an order.
 *
 * Transitions:
 * <pre>
 *   PENDING --verify success--> PAID --(refund collaborator)--> REFUNDED
 *   PENDING --verify failed / initiation failed--> FAILED
 *   FAILED  --initiate--> PENDING
 * </pre>
 * PAID and REFUNDED are settled: nothing in this service moves an order out of them.
 *
 * The guard sets below are the only encoding of this table. {@link OrderStore}
 * implementations check them in their conditional writes.
 */
public enum PaymentStatus {

    PENDING("pending"),
    PAID("paid"),
    FAILED("failed"),
    REFUNDED("refunded");

    /**
     * Statuses from which a new gateway transaction, or a refused attempt to open one,
     * may be recorded.
     */
    public static final Set<PaymentStatus> INITIABLE =
            Collections.unmodifiableSet(EnumSet.of(PENDING, FAILED));

    /**
     * Statuses a gateway verdict may be applied to. The verdict moves the order to PAID or FAILED.
     */
    public static final Set<PaymentStatus> AWAITING_VERDICT =
            Collections.unmodifiableSet(EnumSet.of(PENDING));

    private final String value;

    PaymentStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isSettled() {
        return this == PAID || this == REFUNDED;
    }

    public boolean isInitiable() {
        return INITIABLE.contains(this);
    }

    public boolean isAwaitingVerdict() {
        return AWAITING_VERDICT.contains(this);
    }
}
