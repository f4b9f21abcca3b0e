package com.flagship.storefront_payments.webhook;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A webhook delivery that has been fully reconciled, keyed by {@code event:reference}.
 */
@Entity
@Table(name = "processed_webhook_events")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ProcessedWebhookEventEntity {

    @Id
    @Column(name = "dedup_key", nullable = false, updatable = false)
    private String dedupKey;

    @Column(name = "event", nullable = false, length = 50)
    private String event;

    @Column(name = "payment_reference", nullable = false)
    private String paymentReference;

    @Column(name = "outcome", nullable = false, length = 50)
    private String outcome;

    @Column(name = "processed_at", nullable = false)
    private Instant processedAt;

    static ProcessedWebhookEventEntity of(String dedupKey, String event, String reference,
                                          String outcome, Instant processedAt) {
        return new ProcessedWebhookEventEntity(dedupKey, event, reference, outcome, processedAt);
    }
}
