package com.flagship.storefront_payments.exception;

public class AuthenticationException extends PaymentException {

    public AuthenticationException(String message) {
        super(ErrorCode.UNAUTHORIZED, message);
    }
}
