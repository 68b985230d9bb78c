package com.flagship.pos_core.observability;

import com.flagship.pos_core.outbox.OutboxEventRepository;
import com.flagship.pos_core.reservation.StockReservationRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Actuator health contributors for the transaction core.
 */
public class HealthIndicators {

    /**
     * Unhealthy when sale events pile up faster than they are published.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

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
                return Health.down().withDetail("error", e.getMessage()).build();
            }
        }
    }

    /**
     * Lapsed holds still marked ACTIVE. They no longer block stock, but a
     * growing count means the sweep is not running.
     */
    @Component("reservationSweepHealth")
    public static class ReservationSweepHealthIndicator implements HealthIndicator {

        private static final long LAPSED_WARNING_THRESHOLD = 500;

        private final StockReservationRepository reservationRepository;
        private final Clock clock;

        public ReservationSweepHealthIndicator(StockReservationRepository reservationRepository, Clock clock) {
            this.reservationRepository = reservationRepository;
            this.clock = clock;
        }

        @Override
        public Health health() {
            try {
                long lapsed = reservationRepository.countLapsed(clock.instant());
                Health.Builder builder = lapsed < LAPSED_WARNING_THRESHOLD
                        ? Health.up()
                        : Health.status("WARNING");
                return builder
                        .withDetail("lapsedActiveReservations", lapsed)
                        .withDetail("warningThreshold", LAPSED_WARNING_THRESHOLD)
                        .build();
            } catch (Exception e) {
                return Health.down().withDetail("error", e.getMessage()).build();
            }
        }
    }

    /**
     * Redis only backs the idempotency fast path, so an outage degrades
     * rather than fails the service.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            try {
                var connectionFactory = redisTemplate.getConnectionFactory();
                if (connectionFactory == null) {
                    return degraded("No connection factory configured");
                }
                try (var connection = connectionFactory.getConnection()) {
                    String result = connection.ping();
                    if ("PONG".equals(result)) {
                        return Health.up().withDetail("response", result).build();
                    }
                    return Health.down().withDetail("response", result != null ? result : "null").build();
                }
            } catch (Exception e) {
                return degraded(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }

        private Health degraded(String error) {
            return Health.status("DEGRADED")
                    .withDetail("error", error)
                    .withDetail("note", "Payment idempotency falls back to the database")
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
                    return Health.down()
                            .withDetail("error", "No Kafka connections established")
                            .withDetail("note", "Sale events stay in the outbox until Kafka is reachable")
                            .build();
                }
                return Health.up().withDetail("metricsCount", metrics.size()).build();
            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }
}
