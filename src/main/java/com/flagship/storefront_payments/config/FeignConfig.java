package com.flagship.storefront_payments.config;

import com.flagship.storefront_payments.gateway.paystack.PaystackApi;
import org.springframework.cloud.openfeign.EnableFeignClients;
import org.springframework.context.annotation.Configuration;

/**
 * Enables the gateway's Feign clients. Kept off the application class so web slice
 * tests do not try to build HTTP clients.
 */
@Configuration
@EnableFeignClients(basePackageClasses = PaystackApi.class)
public class FeignConfig {
}
