package com.flagship.storefront_payments.exception;

import lombok.Getter;

import java.util.Map;

/**
 * Raised when the payment gateway rejects a call or cannot be reached.
 *
 * {@code unreachable} separates transport failures (timeouts, refused connections)
 * from answers where the gateway responded but said no.
 */
@Getter
public class GatewayException extends PaymentException {

    private final String gateway;
    private final boolean unreachable;

    public GatewayException(String gateway, String message) {
        this(gateway, message, false, null);
    }

    public GatewayException(String gateway, String message, boolean unreachable, Throwable cause) {
        super(ErrorCode.GATEWAY_ERROR, message, Map.of("gateway", gateway), cause);
        this.gateway = gateway;
        this.unreachable = unreachable;
    }
}
