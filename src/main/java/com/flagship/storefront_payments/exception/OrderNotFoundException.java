package com.flagship.storefront_payments.exception;

import java.util.Map;

/**
 * Raised when an order does not exist or is not owned by the caller.
 * The two cases are deliberately indistinguishable to the client.
 */
public class OrderNotFoundException extends PaymentException {

    public OrderNotFoundException(String lookupKey) {
        super(ErrorCode.ORDER_NOT_FOUND, "Order not found", Map.of("lookup", lookupKey));
    }
}
