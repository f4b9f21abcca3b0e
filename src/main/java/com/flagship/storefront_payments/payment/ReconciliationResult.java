package com.flagship.storefront_payments.payment;

import lombok.Value;

/**
 * Outcome of applying a gateway verdict, and whether this caller's guarded write won.
 * {@code applied == false} with an outcome that requires a write means another
 * reconciliation changed the order first.
 */
@Value
public class ReconciliationResult {
    ReconciliationOutcome outcome;
    boolean applied;

    public boolean lostRace() {
        return outcome.requiresWrite() && !applied;
    }
}
