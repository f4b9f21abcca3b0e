package com.flagship.storefront_payments.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.storefront_payments.payment.event.PaymentEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Writes payment events to the outbox.
 *
 * If the order change commits, its event is guaranteed to be written; if it rolls back,
 * so does the event. Publishing to Kafka happens later in {@link OutboxPublisher}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    public static final String ORDER_AGGREGATE = "Order";

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;

    /**
     * Saves a payment event within the caller's transaction.
     *
     * MANDATORY propagation: calling this outside a transaction is a programming error,
     * since the event would no longer be atomic with the order change.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(PaymentEvent event) {
        return saveEvent(ORDER_AGGREGATE, event.getOrderId(), event.getEventType(), event);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(String aggregateType, UUID aggregateId,
                                 String eventType, Object payload) {
        String jsonPayload = serializePayload(payload);

        OutboxEvent event = OutboxEvent.create(aggregateType, aggregateId, eventType, jsonPayload);
        OutboxEventEntity saved = repository.save(OutboxEventEntity.fromDomain(event));

        log.debug("Saved outbox event: type={}, aggregateType={}, aggregateId={}",
                eventType, aggregateType, aggregateId);

        return saved.toDomain();
    }

    /**
     * Row locks are released when this returns; see
     * {@link OutboxEventRepository#findUnpublishedEventsForUpdate(int)}.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findUnpublishedEvents(int limit) {
        return repository.findUnpublishedEventsForUpdate(limit)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished();
            repository.save(entity);
            log.debug("Marked event {} as published", eventId);
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String errorMessage) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markFailed(errorMessage);
            repository.save(entity);
            log.warn("Marked event {} as failed (retry #{}): {}",
                    eventId, entity.getRetryCount(), errorMessage);
        });
    }

    /**
     * Events written for one order, in commit order. Used for auditing.
     */
    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForOrder(UUID orderId) {
        return repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(ORDER_AGGREGATE, orderId)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    private String serializePayload(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload", e);
        }
    }
}
