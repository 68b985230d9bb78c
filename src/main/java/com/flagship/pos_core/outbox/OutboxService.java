package com.flagship.pos_core.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Writes events to the outbox inside the caller's transaction and hands
 * them to the publisher afterwards.
 *
 * A sale commit and its events either both exist or neither does. Kafka is
 * never contacted here.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * @throws org.springframework.transaction.IllegalTransactionStateException
     *         when called without an active transaction
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(String aggregateType, UUID aggregateId,
                                 String eventType, Object payload) {
        String jsonPayload = serializePayload(payload);

        OutboxEvent event = OutboxEvent.create(aggregateType, aggregateId, eventType, jsonPayload, clock.instant());
        OutboxEventEntity saved = repository.save(OutboxEventEntity.fromDomain(event));

        log.debug("Saved outbox event: type={}, aggregateType={}, aggregateId={}",
                eventType, aggregateType, aggregateId);

        return saved.toDomain();
    }

    /**
     * Claims the next batch with SKIP LOCKED in its own short transaction.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findPublishableEvents(int limit, int maxRetries) {
        return repository.findPublishableForUpdate(limit, maxRetries)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished(clock.instant());
            log.debug("Marked event {} as published", eventId);
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String errorMessage) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markFailed(errorMessage);
            log.warn("Marked event {} as failed (retry #{}): {}",
                    eventId, entity.getRetryCount(), errorMessage);
        });
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForAggregate(String aggregateType, UUID aggregateId) {
        return repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(aggregateType, aggregateId)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsOfType(UUID aggregateId, String eventType) {
        return repository.findByAggregateIdAndEventTypeOrderBySequenceNumberAsc(aggregateId, eventType)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    private String serializePayload(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload", e);
        }
    }
}
