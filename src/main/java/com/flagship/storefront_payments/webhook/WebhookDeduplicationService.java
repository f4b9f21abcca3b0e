package com.flagship.storefront_payments.webhook;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Remembers which webhook deliveries were already reconciled, keyed by {@code (event, reference)}.
 *
 * Strategy:
 * 1. Try Redis first (fast, but can be unavailable)
 * 2. Fall back to the processed_webhook_events table (always available)
 * 3. Write both on success
 *
 * Deduplication only saves gateway calls: a delivery that slips through is still
 * harmless, since the state machine commits at most one transition per order.
 */
@Service
@Slf4j
public class WebhookDeduplicationService {

    private static final String REDIS_KEY_PREFIX = "webhook:";

    private final ProcessedWebhookEventRepository repository;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final Clock clock;
    private final Duration redisTtl;

    public WebhookDeduplicationService(ProcessedWebhookEventRepository repository,
                                       Optional<StringRedisTemplate> redisTemplate,
                                       Clock clock,
                                       @Value("${webhook.dedup.redis-ttl-hours:72}") long redisTtlHours) {
        this.repository = repository;
        this.redisTemplate = redisTemplate;
        this.clock = clock;
        this.redisTtl = Duration.ofHours(redisTtlHours);
    }

    public boolean isProcessed(String event, String reference) {
        String key = dedupKey(event, reference);

        if (redisTemplate.isPresent()) {
            try {
                if (Boolean.TRUE.equals(redisTemplate.get().hasKey(REDIS_KEY_PREFIX + key))) {
                    log.debug("Webhook {} found in Redis", key);
                    return true;
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for webhook {}. Falling back to database. Error: {}",
                        key, e.getMessage());
            }
        }

        boolean processed = repository.existsById(key);
        if (processed) {
            cache(key);
        }
        return processed;
    }

    /**
     * Records a reconciled delivery. Recording the same key twice is an upsert.
     */
    public void markProcessed(String event, String reference, String outcome) {
        String key = dedupKey(event, reference);
        repository.save(ProcessedWebhookEventEntity.of(key, event, reference, outcome, clock.instant()));
        cache(key);
        log.debug("Recorded webhook {} with outcome {}", key, outcome);
    }

    static String dedupKey(String event, String reference) {
        return event + ":" + reference;
    }

    private void cache(String key) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + key, "1", redisTtl);
        } catch (Exception e) {
            // the database row is the source of truth
            log.debug("Failed to cache webhook {} in Redis: {}", key, e.getMessage());
        }
    }
}
