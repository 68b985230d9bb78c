package com.flagship.pos_core.audit;

import java.util.Map;
import java.util.UUID;

/**
 * Sink for sale audit events.
 *
 * Implementations must join the caller's transaction: an event is recorded
 * exactly when the change it describes commits.
 */
public interface AuditLog {

    String SALE_OPENED = "sale.opened";
    String STOCK_RESERVED = "stock.reserved";
    String STOCK_RELEASED = "stock.released";
    String SALE_TYPE_CHANGED = "sale.type_changed";
    String SALE_COMPLETED = "sale.completed";
    String SALE_ABANDONED = "sale.abandoned";
    String PAYMENT_RECORDED = "payment.recorded";
    String REFUND_PROCESSED = "refund.processed";
    String SALE_CANCELLED = "sale.cancelled";
    String CREDIT_CHARGED = "credit.charged";
    String CREDIT_PAYMENT = "credit.payment";
    String CREDIT_OVERRIDE = "credit.override";

    void logEvent(String eventType, UUID saleId, UUID actorId, Map<String, Object> payload, String description);
}
