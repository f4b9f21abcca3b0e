package com.flagship.storefront_payments.gateway;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Builds gateway references of the form {@code {orderNumber}-{epochMillis}}.
 *
 * Two initiations of the same order within one millisecond produce the same reference;
 * the unique index on orders.payment_reference rejects the second write.
 */
@Component
@RequiredArgsConstructor
public class PaymentReferenceGenerator {

    private final Clock clock;

    public String generate(String orderNumber) {
        if (orderNumber == null || orderNumber.isBlank()) {
            throw new IllegalArgumentException("Order number is required to build a reference");
        }
        return orderNumber + "-" + clock.millis();
    }
}
