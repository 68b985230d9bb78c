package com.flagship.pos_core.observability;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refreshes the outbox gauges from the database on a fixed rate, so a
 * Prometheus scrape never runs a query itself.
 */
@Component
@RequiredArgsConstructor
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;

    /**
     * Backlog size, oldest pending age and dead-lettered count. Interval is
     * {@code metrics.refresh.interval} in milliseconds.
     */
    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshOutboxMetrics() {
        outboxMetrics.refreshMetrics();
    }
}
