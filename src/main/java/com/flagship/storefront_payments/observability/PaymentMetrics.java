package com.flagship.storefront_payments.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralized metrics for the payment flows.
 *
 * Metrics exposed:
 * - payments.initiations{result}: initiation attempts by result
 * - payments.verifications{outcome}: reconciliation outcomes
 * - payments.paid / payments.failed{reason}: committed transitions
 * - payments.cas.conflicts{transition}: guarded writes lost to a concurrent writer
 * - gateway.calls{gateway, operation, result}: timer around every gateway request
 * - webhooks.received{event, result}: gateway webhook deliveries
 * - payments.latency{operation}: end-to-end operation latency
 */
@Component
public class PaymentMetrics {

    private final MeterRegistry registry;

    private final Counter paymentsPaid;
    private final Timer reconciliationTimer;

    public PaymentMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.paymentsPaid = Counter.builder("payments.paid")
                .description("Number of orders moved to paid")
                .register(registry);

        this.reconciliationTimer = Timer.builder("payments.reconciliation.duration")
                .description("Time taken to commit a reconciliation verdict")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordInitiation(String result) {
        registry.counter("payments.initiations", "result", sanitizeTag(result)).increment();
    }

    public void recordVerification(String outcome) {
        registry.counter("payments.verifications", "outcome", sanitizeTag(outcome)).increment();
    }

    public void incrementPaymentsPaid() {
        paymentsPaid.increment();
    }

    public void recordPaymentFailed(String reason) {
        registry.counter("payments.failed", "reason", sanitizeTag(reason)).increment();
    }

    /**
     * Records a guarded write that matched no row because another writer got there first.
     */
    public void recordCasConflict(String transition) {
        registry.counter("payments.cas.conflicts", "transition", sanitizeTag(transition)).increment();
    }

    public void recordGatewayCall(String gateway, String operation, String result, long durationMs) {
        registry.timer("gateway.calls",
                "gateway", sanitizeTag(gateway),
                "operation", sanitizeTag(operation),
                "result", sanitizeTag(result)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordWebhook(String event, String result) {
        registry.counter("webhooks.received",
                "event", sanitizeTag(event),
                "result", sanitizeTag(result)
        ).increment();
    }

    public void recordOperationLatency(String operation, long durationMs) {
        registry.timer("payments.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public <T> T timeReconciliation(Supplier<T> operation) {
        return reconciliationTimer.record(operation);
    }

    /**
     * Sanitizes a tag value to keep cardinality bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
