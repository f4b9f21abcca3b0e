package com.flagship.storefront_payments.webhook;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Checks the {@code x-paystack-signature} header: hex HMAC-SHA512 of the raw request body,
 * keyed with the Paystack secret key. Comparison is constant-time.
 */
@Component
@Slf4j
public class WebhookSignatureVerifier {

    private static final String ALGORITHM = "HmacSHA512";

    private final String secretKey;

    public WebhookSignatureVerifier(@Value("${paystack.secret-key:}") String secretKey) {
        this.secretKey = secretKey;
    }

    public boolean isValid(byte[] payload, String signature) {
        if (secretKey == null || secretKey.isBlank()) {
            log.error("Webhook received but paystack.secret-key is not configured");
            return false;
        }
        if (payload == null || signature == null || signature.isBlank()) {
            return false;
        }

        byte[] provided;
        try {
            provided = HexFormat.of().parseHex(signature.trim().toLowerCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return false;
        }
        return MessageDigest.isEqual(hmac(payload), provided);
    }

    /**
     * Hex signature of {@code payload}, as the gateway would compute it.
     */
    public String sign(byte[] payload) {
        return HexFormat.of().formatHex(hmac(payload));
    }

    private byte[] hmac(byte[] payload) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secretKey.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return mac.doFinal(payload);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA512 is not available", e);
        }
    }
}
