package com.flagship.storefront_payments.webhook;

import com.flagship.storefront_payments.exception.AuthenticationException;
import com.flagship.storefront_payments.observability.PaymentMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Receives Paystack webhooks. The body is read as raw bytes because the signature
 * covers them exactly.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class PaystackWebhookController {

    static final String SIGNATURE_HEADER = "x-paystack-signature";

    private final WebhookSignatureVerifier signatureVerifier;
    private final PaystackWebhookHandler webhookHandler;
    private final PaymentMetrics paymentMetrics;

    @PostMapping("/payments/webhook")
    public ResponseEntity<Map<String, Object>> receive(
            @RequestHeader(name = SIGNATURE_HEADER, required = false) String signature,
            @RequestBody(required = false) byte[] payload) {

        if (!signatureVerifier.isValid(payload, signature)) {
            log.warn("Rejected webhook with {} signature", signature == null ? "missing" : "invalid");
            paymentMetrics.recordWebhook("unknown", "invalid_signature");
            throw new AuthenticationException("Invalid webhook signature");
        }

        WebhookOutcome outcome = webhookHandler.handle(payload);
        return ResponseEntity.ok(Map.of("received", true, "outcome", outcome.name().toLowerCase()));
    }
}
