package com.flagship.pos_core.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An event waiting in the outbox for delivery to Kafka.
 *
 * Written in the same transaction as the sale, payment or credit change it
 * describes, so it exists exactly when that change committed.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // "Sale"
    UUID aggregateId;
    String eventType;          // e.g. "sale.completed"
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until delivered
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, UUID aggregateId,
                                     String eventType, String payload, Instant now) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            now,
            null,
            0,
            null,
            null   // assigned by the database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean isDeadLettered(int maxRetries) {
        return !isPublished() && retryCount >= maxRetries;
    }
}
