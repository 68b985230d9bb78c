package com.flagship.pos_core.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Micrometer meters for the sale lifecycle.
 *
 * - pos.sales.completed{payment_type,status}
 * - pos.sales.rejected{code}
 * - pos.reservations{outcome}
 * - pos.reservations.expired
 * - pos.payments.recorded{method}
 * - pos.refunds.processed{type}
 * - pos.credit.overrides
 * - pos.sale.completion.duration
 */
@Component
public class SaleMetrics {

    private final MeterRegistry registry;

    private final Counter reservationsExpired;
    private final Counter creditOverrides;
    private final Timer completionTimer;

    public SaleMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.reservationsExpired = Counter.builder("pos.reservations.expired")
                .description("Reservations moved to EXPIRED by the sweep")
                .register(registry);

        this.creditOverrides = Counter.builder("pos.credit.overrides")
                .description("Credit sales allowed past the limit by a forced override")
                .register(registry);

        this.completionTimer = Timer.builder("pos.sale.completion.duration")
                .description("Time taken to complete a sale, including the commit")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordSaleCompleted(String paymentType, String status) {
        registry.counter("pos.sales.completed",
                "payment_type", sanitizeTag(paymentType),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordRejection(String code) {
        registry.counter("pos.sales.rejected", "code", sanitizeTag(code)).increment();
    }

    public void recordReservation(String outcome) {
        registry.counter("pos.reservations", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordReservationsExpired(int count) {
        reservationsExpired.increment(count);
    }

    public void recordPayment(String method) {
        registry.counter("pos.payments.recorded", "method", sanitizeTag(method)).increment();
    }

    public void recordRefund(String type) {
        registry.counter("pos.refunds.processed", "type", sanitizeTag(type)).increment();
    }

    public void recordCreditOverride() {
        creditOverrides.increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    public <T> T timeCompletion(Supplier<T> operation) {
        return completionTimer.record(operation);
    }

    public void recordLatency(String operation, Duration duration) {
        registry.timer("pos.operation.latency", "operation", sanitizeTag(operation)).record(duration);
    }

    /**
     * Keeps tag cardinality bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
