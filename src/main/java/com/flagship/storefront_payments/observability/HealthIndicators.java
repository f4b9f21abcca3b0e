package com.flagship.storefront_payments.observability;

import com.flagship.storefront_payments.outbox.OutboxEventRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Actuator health contributors for the payment service.
 */
public class HealthIndicators {

    private static final String REDIS_NOTE = "Webhook deduplication falls back to the database";

    /**
     * Unhealthy when too many payment events are waiting to be published.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        static final long BACKLOG_WARNING_THRESHOLD = 1000;
        static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();

                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();
            } catch (Exception e) {
                return Health.down().withDetail("error", describe(e)).build();
            }
        }
    }

    /**
     * Redis only backs the webhook dedup fast path, so an outage is DEGRADED, not DOWN.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            RedisConnectionFactory connectionFactory = redisTemplate.getConnectionFactory();
            if (connectionFactory == null) {
                return degraded("No connection factory configured");
            }
            try (RedisConnection connection = connectionFactory.getConnection()) {
                String response = connection.ping();
                if ("PONG".equals(response)) {
                    return Health.up().withDetail("response", response).build();
                }
                return degraded("Unexpected ping response: " + response);
            } catch (Exception e) {
                return degraded(describe(e));
            }
        }

        private static Health degraded(String error) {
            return Health.status("DEGRADED")
                    .withDetail("error", error)
                    .withDetail("note", REDIS_NOTE)
                    .build();
        }
    }

    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                var metrics = kafkaTemplate.metrics();
                if (metrics == null || metrics.isEmpty()) {
                    // producer connects lazily; nothing published yet
                    return Health.unknown()
                            .withDetail("note", "No producer connection established yet")
                            .build();
                }
                return Health.up().withDetail("metricsCount", metrics.size()).build();
            } catch (Exception e) {
                return Health.down().withDetail("error", describe(e)).build();
            }
        }
    }

    /**
     * Without a secret key every initiation, verification and webhook fails.
     */
    @Component("paystackHealth")
    public static class PaystackHealthIndicator implements HealthIndicator {

        private final boolean secretKeyConfigured;

        public PaystackHealthIndicator(@Value("${paystack.secret-key:}") String secretKey) {
            this.secretKeyConfigured = secretKey != null && !secretKey.isBlank();
        }

        @Override
        public Health health() {
            return (secretKeyConfigured ? Health.up() : Health.down())
                    .withDetail("secretKeyConfigured", secretKeyConfigured)
                    .build();
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
