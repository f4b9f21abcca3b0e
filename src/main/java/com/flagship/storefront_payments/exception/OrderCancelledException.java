package com.flagship.storefront_payments.exception;

import com.flagship.storefront_payments.order.Order;

import java.util.Map;

public class OrderCancelledException extends PaymentException {

    public OrderCancelledException(Order order) {
        super(ErrorCode.ORDER_CANCELLED, "Cannot pay for a cancelled order",
                Map.of("order_id", order.getId().toString(),
                       "order_number", order.getOrderNumber()));
    }
}
