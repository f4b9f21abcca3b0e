package com.flagship.storefront_payments.gateway;

import lombok.Value;

@Value
public class GatewayInitiation {
    String authorizationUrl;
    String accessCode;
    String reference;
}
