package com.flagship.storefront_payments.gateway.paystack;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Envelope of every Paystack response. {@code status == false} means the call was rejected
 * and {@code message} says why.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PaystackResponse<T>(boolean status, String message, T data) {
}
