package com.flagship.storefront_payments.gateway.paystack;

import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

/**
 * Declarative HTTP client for the Paystack transaction API.
 *
 * Timeouts, the bearer secret and the no-retry policy come from
 * {@link PaystackFeignConfiguration}; the base URL is {@code paystack.base-url}.
 */
@FeignClient(
    name = "paystack",
    url = "${paystack.base-url:https://api.paystack.co}",
    configuration = PaystackFeignConfiguration.class
)
public interface PaystackApi {

    @PostMapping("/transaction/initialize")
    PaystackResponse<InitializeTransactionData> initialize(@RequestBody InitializeTransactionRequest request);

    @GetMapping("/transaction/verify/{reference}")
    PaystackResponse<TransactionData> verify(@PathVariable("reference") String reference);
}
