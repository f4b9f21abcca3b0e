package com.flagship.storefront_payments.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.storefront_payments.observability.PaymentMetrics;
import com.flagship.storefront_payments.payment.PaymentVerification;
import com.flagship.storefront_payments.payment.PaymentVerifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a signed Paystack webhook into a reconciliation.
 *
 * Only the event name and the transaction reference are read from the payload; the payment
 * verdict always comes from a fresh verification call, so a replayed or reordered delivery
 * cannot push an order into the wrong state. Deliveries whose reconciliation reached a final
 * verdict are remembered and skipped when the gateway redelivers them.
 *
 * Never throws: the gateway retries anything that is not a 2xx, and retrying a delivery
 * we cannot process does not help.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PaystackWebhookHandler {

    static final Set<String> HANDLED_EVENTS = Set.of(
            "charge.success", "charge.failed", "charge.abandoned", "charge.pending");

    private final ObjectMapper objectMapper;
    private final PaymentVerifier paymentVerifier;
    private final WebhookDeduplicationService deduplicationService;
    private final PaymentMetrics paymentMetrics;

    public WebhookOutcome handle(byte[] payload) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (IOException e) {
            log.warn("Webhook body is not valid JSON: {}", e.getMessage());
            return done("unknown", WebhookOutcome.MALFORMED);
        }

        String event = root.path("event").asText("");
        String reference = root.path("data").path("reference").asText("");

        if (!HANDLED_EVENTS.contains(event)) {
            log.info("Ignoring webhook event {}", event.isEmpty() ? "<none>" : event);
            return done(event, WebhookOutcome.IGNORED);
        }
        if (reference.isBlank()) {
            log.warn("Webhook {} has no transaction reference", event);
            return done(event, WebhookOutcome.MALFORMED);
        }

        log.info("Webhook received: event={}, reference={}", event, reference);

        try {
            if (deduplicationService.isProcessed(event, reference)) {
                log.info("Webhook {} for {} already handled", event, reference);
                return done(event, WebhookOutcome.DUPLICATE);
            }

            Optional<PaymentVerification> verification = paymentVerifier.reconcileAsService(reference);
            if (verification.isEmpty()) {
                return done(event, WebhookOutcome.UNKNOWN_ORDER);
            }

            PaymentVerification result = verification.get();
            if (!result.isStillPending()) {
                deduplicationService.markProcessed(event, reference, result.getOutcome().name());
            }
            log.info("Webhook {} reconciled order {}: outcome={}, paymentStatus={}",
                    event, result.getOrderNumber(), result.getOutcome(), result.getPaymentStatus().getValue());
            return done(event, WebhookOutcome.RECONCILED);

        } catch (Exception e) {
            log.error("Webhook {} for {} could not be reconciled: {}", event, reference, e.getMessage(), e);
            return done(event, WebhookOutcome.FAILED);
        }
    }

    private WebhookOutcome done(String event, WebhookOutcome outcome) {
        paymentMetrics.recordWebhook(event, outcome.name());
        return outcome;
    }
}
