package com.flagship.pos_core.outbox;

import com.flagship.pos_core.config.PosProperties;
import com.flagship.pos_core.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Polls the outbox and publishes sale events to Kafka.
 *
 * Each pass:
 * 1. claims a batch of unpublished events below the retry limit
 * 2. sends each one and waits for the broker acknowledgement
 * 3. marks it published, or bumps its retry count with the error
 *
 * Records are keyed by aggregate id so every event of one sale lands on the
 * same partition in commit order. The event type travels as a header.
 *
 * Failure handling:
 * - a send that fails or times out counts as one retry
 * - events that exhaust their retries stay in the table for inspection and
 *   are no longer claimed
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    static final String EVENT_TYPE_HEADER = "event-type";

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;
    private final PosProperties properties;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Value("${outbox.publisher.send-timeout-ms:10000}")
    private long sendTimeoutMs;

    /**
     * One polling pass. Runs every {@code outbox.publisher.poll-interval-ms};
     * errors are logged and the next pass tries again.
     */
    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.findPublishableEvents(batchSize, maxRetries);
            if (events.isEmpty()) {
                return;
            }

            log.debug("Found {} unpublished events to process", events.size());
            events.forEach(this::publishEvent);
        } catch (Exception e) {
            log.error("Error in outbox publisher polling loop", e);
        }
    }

    /**
     * Sends synchronously so events of one sale never overtake each other.
     */
    private void publishEvent(OutboxEvent event) {
        ProducerRecord<String, String> record = new ProducerRecord<>(
            properties.getKafka().getTopic(),
            event.getAggregateId().toString(),
            event.getPayload()
        );
        record.headers().add(EVENT_TYPE_HEADER, event.getEventType().getBytes(StandardCharsets.UTF_8));

        try {
            SendResult<String, String> result = kafkaTemplate.send(record).get(sendTimeoutMs, TimeUnit.MILLISECONDS);

            log.debug("Published event: eventId={}, topic={}, partition={}, offset={}, eventType={}",
                    event.getId(),
                    result.getRecordMetadata().topic(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getEventType());

            // only an acknowledged send leaves the backlog
            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail(event, "Interrupted while publishing");
        } catch (ExecutionException | TimeoutException e) {
            fail(event, e.getMessage());
        }
    }

    private void fail(OutboxEvent event, String error) {
        log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                event.getId(), event.getEventType(), error);
        outboxService.markFailed(event.getId(), error);
        outboxMetrics.recordEventPublishFailed(event.getEventType());
        if (event.getRetryCount() + 1 >= maxRetries) {
            log.warn("Event {} exhausted {} retries and will no longer be published. eventType={}, aggregateId={}",
                    event.getId(), maxRetries, event.getEventType(), event.getAggregateId());
        }
    }

    /**
     * Runs one polling pass immediately.
     */
    public void triggerPublish() {
        publishPendingEvents();
    }
}
