package com.flagship.storefront_payments.payment.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for payment events.
 *
 * Events are facts about an order's payment, written to the outbox in the same
 * transaction as the status change they describe.
 */
public interface PaymentEvent {

    /**
     * Unique identifier for this event instance, for consumer-side deduplication.
     */
    UUID getEventId();

    /**
     * The order this event is about; also the Kafka partition key.
     */
    UUID getOrderId();

    Instant getOccurredAt();

    String getEventType();
}
