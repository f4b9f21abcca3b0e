package com.flagship.storefront_payments.exception;

import com.flagship.storefront_payments.order.Order;

import java.util.LinkedHashMap;
import java.util.Map;

public class OrderAlreadyPaidException extends PaymentException {

    public OrderAlreadyPaidException(Order order) {
        super(ErrorCode.ORDER_ALREADY_PAID, "Order has already been paid", detailsOf(order));
    }

    private static Map<String, String> detailsOf(Order order) {
        Map<String, String> details = new LinkedHashMap<>();
        details.put("order_id", order.getId().toString());
        details.put("order_number", order.getOrderNumber());
        details.put("payment_status", order.getPaymentStatus().getValue());
        return details;
    }
}
