package com.flagship.storefront_payments.payment;

import com.flagship.storefront_payments.order.PaymentStatus;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class PaymentInitiation {
    UUID orderId;
    String orderNumber;
    String paymentReference;
    String authorizationUrl;
    String accessCode;
    PaymentStatus paymentStatus;
}
