package com.flagship.storefront_payments.webhook;

/**
 * How a signed webhook delivery was handled. All of them are acknowledged with 200.
 */
public enum WebhookOutcome {
    RECONCILED,
    DUPLICATE,
    IGNORED,
    UNKNOWN_ORDER,
    MALFORMED,
    FAILED
}
