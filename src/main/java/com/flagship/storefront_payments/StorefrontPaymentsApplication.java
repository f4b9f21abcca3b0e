package com.flagship.storefront_payments;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class StorefrontPaymentsApplication {

    public static void main(String[] args) {
        SpringApplication.run(StorefrontPaymentsApplication.class, args);
    }
}
