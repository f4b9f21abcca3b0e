package com.flagship.storefront_payments.security;

import lombok.Value;

import java.util.UUID;

/**
 * The authenticated user behind a request, as asserted by a verified bearer token.
 * Passed explicitly to every user-scoped operation.
 */
@Value
public class CallerIdentity {

    public static final String REQUEST_ATTRIBUTE = CallerIdentity.class.getName();

    UUID userId;
    String email;

    public boolean hasEmail() {
        return email != null && !email.isBlank();
    }
}
