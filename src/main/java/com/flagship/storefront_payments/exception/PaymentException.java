package com.flagship.storefront_payments.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.Map;

/**
 * Root of the payment error hierarchy.
 *
 * Every failure the payment flows raise on purpose extends this type, so the
 * exception handler can turn it into an {@link ApiError} without knowing the subclass.
 */
@Getter
public abstract class PaymentException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, String> details;

    protected PaymentException(ErrorCode errorCode, String message) {
        this(errorCode, message, Collections.emptyMap(), null);
    }

    protected PaymentException(ErrorCode errorCode, String message, Map<String, String> details) {
        this(errorCode, message, details, null);
    }

    protected PaymentException(ErrorCode errorCode, String message,
                               Map<String, String> details, Throwable cause) {
        super(message != null ? message : errorCode.getMessage(), cause);
        this.errorCode = errorCode;
        this.details = details != null ? details : Collections.emptyMap();
    }
}
