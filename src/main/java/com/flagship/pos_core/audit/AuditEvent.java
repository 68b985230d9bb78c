package com.flagship.pos_core.audit;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Wire shape of an audit event on the sale events topic.
 */
@Value
@Builder
public class AuditEvent {

    @JsonProperty("event_id")
    UUID eventId;

    @JsonProperty("event_type")
    String eventType;

    @JsonProperty("sale_id")
    UUID saleId;

    @JsonProperty("actor_id")
    UUID actorId;

    @JsonProperty("correlation_id")
    String correlationId;

    String description;

    Map<String, Object> data;

    @JsonProperty("occurred_at")
    Instant occurredAt;
}
