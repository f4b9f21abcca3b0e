package com.flagship.storefront_payments.gateway;

import com.flagship.storefront_payments.exception.GatewayException;

/**
 * Client for the external payment gateway.
 *
 * Both calls are synchronous, bounded by the client's timeouts, and never retried here:
 * a failed call surfaces as {@link GatewayException} and the caller decides what to record.
 */
public interface PaymentGatewayClient {

    /**
     * Opens a transaction and returns where the customer should be redirected.
     */
    GatewayInitiation initiate(InitiateTransaction transaction);

    /**
     * Asks the gateway for the authoritative state of a transaction.
     */
    GatewayVerification verify(String reference);

    /**
     * Short gateway name, stored as the order's payment method.
     */
    String getName();
}
