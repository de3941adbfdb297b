package com.flagship.investment_ledger.observability;

import com.flagship.investment_ledger.outbox.OutboxService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicators for the outbox backlog, Redis and Kafka.
 */
public class HealthIndicators {

    /**
     * Unhealthy when too many events wait to be published or any reached the retry limit.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxService outboxService;

        public OutboxHealthIndicator(OutboxService outboxService) {
            this.outboxService = outboxService;
        }

        @Override
        public Health health() {
            try {
                long backlog = outboxService.countUnpublished();
                long deadLettered = outboxService.countDeadLettered();

                Health.Builder builder;
                if (backlog >= BACKLOG_CRITICAL_THRESHOLD) {
                    builder = Health.down();
                } else if (backlog >= BACKLOG_WARNING_THRESHOLD || deadLettered > 0) {
                    builder = Health.status("WARNING");
                } else {
                    builder = Health.up();
                }
                return builder
                        .withDetail("backlogSize", backlog)
                        .withDetail("deadLettered", deadLettered)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();
            } catch (RuntimeException e) {
                return Health.down(e).build();
            }
        }
    }

    /**
     * Redis only backs the idempotency fast path, so an outage is DEGRADED rather than DOWN.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private static final String FALLBACK_NOTE = "Idempotency lookups fall back to the database";

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            RedisConnectionFactory factory = redisTemplate.getConnectionFactory();
            if (factory == null) {
                return Health.status("DEGRADED")
                        .withDetail("error", "No connection factory configured")
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }
            try (RedisConnection connection = factory.getConnection()) {
                String result = connection.ping();
                return "PONG".equals(result)
                        ? Health.up().withDetail("response", result).build()
                        : Health.down().withDetail("response", String.valueOf(result)).build();
            } catch (RuntimeException e) {
                return Health.status("DEGRADED")
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }
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
                    return Health.down()
                            .withDetail("error", "No Kafka producer connections established")
                            .build();
                }
                return Health.up().withDetail("metricsCount", metrics.size()).build();
            } catch (RuntimeException e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }
}
