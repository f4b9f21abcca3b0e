package com.flagship.storefront_payments.gateway.paystack;

import feign.Request;
import feign.RequestInterceptor;
import feign.Retryer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.http.HttpHeaders;

import java.util.concurrent.TimeUnit;

/**
 * Client-scoped Feign configuration for {@link PaystackApi}.
 *
 * Not annotated with {@code @Configuration}: these beans live only in the Paystack
 * client's child context and must not leak into other Feign clients.
 */
public class PaystackFeignConfiguration {

    /**
     * Bounded connect and read timeouts. A gateway call never holds a request thread
     * longer than their sum.
     */
    @Bean
    public Request.Options paystackRequestOptions(
            @Value("${paystack.connect-timeout-ms:3000}") long connectTimeoutMs,
            @Value("${paystack.read-timeout-ms:10000}") long readTimeoutMs) {
        return new Request.Options(
                connectTimeoutMs, TimeUnit.MILLISECONDS,
                readTimeoutMs, TimeUnit.MILLISECONDS,
                true
        );
    }

    @Bean
    public RequestInterceptor paystackAuthorizationInterceptor(
            @Value("${paystack.secret-key:}") String secretKey) {
        return template -> template.header(HttpHeaders.AUTHORIZATION, "Bearer " + secretKey);
    }

    /**
     * Initialization is not idempotent on the gateway side, so nothing is retried here.
     */
    @Bean
    public Retryer paystackRetryer() {
        return Retryer.NEVER_RETRY;
    }
}
