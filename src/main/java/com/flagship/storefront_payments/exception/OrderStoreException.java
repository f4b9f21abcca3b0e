package com.flagship.storefront_payments.exception;

public class OrderStoreException extends PaymentException {

    public OrderStoreException(String message, Throwable cause) {
        super(ErrorCode.PERSISTENCE_ERROR, message, null, cause);
    }
}
