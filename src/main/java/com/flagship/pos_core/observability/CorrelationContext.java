package com.flagship.pos_core.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-local correlation id plus the MDC keys used while a sale is being
 * worked on.
 *
 * The correlation id arrives on X-Correlation-ID (or is generated), is
 * echoed back on the response and is copied into outbox payloads so a
 * published sale event can be traced to the request that caused it.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String SALE_ID_MDC_KEY = "saleId";
    public static final String BUSINESS_ID_MDC_KEY = "businessId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short form, readable in log lines.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Tags subsequent log lines on this thread with the sale being handled.
     */
    public static void putSale(UUID businessId, UUID saleId) {
        if (businessId != null) {
            MDC.put(BUSINESS_ID_MDC_KEY, businessId.toString());
        }
        if (saleId != null) {
            MDC.put(SALE_ID_MDC_KEY, saleId.toString());
        }
    }

    public static void clearSale() {
        MDC.remove(SALE_ID_MDC_KEY);
        MDC.remove(BUSINESS_ID_MDC_KEY);
    }
}
