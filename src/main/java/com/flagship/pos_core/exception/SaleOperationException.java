package com.flagship.pos_core.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base type for recoverable, caller-surfaced failures of sale operations.
 *
 * Thrown inside the operation's transaction, so the aggregate is rolled back
 * and left unmodified. Details carry the numbers a caller needs to correct
 * the request (available quantity, amount due, credit limit) without
 * re-reading full state.
 */
public abstract class SaleOperationException extends RuntimeException {

    private final Map<String, String> details;

    protected SaleOperationException(String message, Map<String, String> details) {
        super(message);
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    /**
     * Stable machine-readable error code, e.g. INSUFFICIENT_STOCK.
     */
    public abstract String getCode();

    public Map<String, String> getDetails() {
        return details;
    }
}
