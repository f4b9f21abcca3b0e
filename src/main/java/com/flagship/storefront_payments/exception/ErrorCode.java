package com.flagship.storefront_payments.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Error categories surfaced by the payment API, each bound to the HTTP status it maps to.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "Unauthorized"),
    ORDER_NOT_FOUND(HttpStatus.NOT_FOUND, "Order not found"),
    ORDER_ALREADY_PAID(HttpStatus.BAD_REQUEST, "Order has already been paid"),
    ORDER_CANCELLED(HttpStatus.BAD_REQUEST, "Cannot pay for a cancelled order"),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST, "Invalid request"),
    GATEWAY_ERROR(HttpStatus.BAD_GATEWAY, "Payment gateway error"),
    PERSISTENCE_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Order store unavailable");

    private final HttpStatus status;
    private final String message;
}
