package com.flagship.storefront_payments.exception;

import java.util.Map;

public class PaymentValidationException extends PaymentException {

    public PaymentValidationException(String message) {
        super(ErrorCode.INVALID_REQUEST, message);
    }

    public PaymentValidationException(String message, Map<String, String> details) {
        super(ErrorCode.INVALID_REQUEST, message, details);
    }
}
