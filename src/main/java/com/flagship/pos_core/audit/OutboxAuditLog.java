package com.flagship.pos_core.audit;

import com.flagship.pos_core.observability.CorrelationContext;
import com.flagship.pos_core.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Map;
import java.util.UUID;

/**
 * Audit log backed by the transactional outbox. Delivery to Kafka happens
 * later in {@link com.flagship.pos_core.outbox.OutboxPublisher}, so a broker
 * outage delays audit events but never fails a sale.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxAuditLog implements AuditLog {

    static final String AGGREGATE_TYPE = "Sale";

    private final OutboxService outboxService;
    private final Clock clock;

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void logEvent(String eventType, UUID saleId, UUID actorId,
                         Map<String, Object> payload, String description) {
        AuditEvent event = AuditEvent.builder()
            .eventId(UUID.randomUUID())
            .eventType(eventType)
            .saleId(saleId)
            .actorId(actorId)
            .correlationId(CorrelationContext.getCorrelationId())
            .description(description)
            .data(payload != null ? payload : Map.of())
            .occurredAt(clock.instant())
            .build();

        outboxService.saveEvent(AGGREGATE_TYPE, saleId, eventType, event);
        log.debug("Audit event {} recorded for sale {}", eventType, saleId);
    }
}
