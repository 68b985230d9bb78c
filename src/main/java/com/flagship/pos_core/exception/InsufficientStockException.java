package com.flagship.pos_core.exception;

import java.util.Map;
import java.util.UUID;

/**
 * Not enough stock to reserve or, at commit time, to decrement.
 */
public class InsufficientStockException extends SaleOperationException {

    private final int available;
    private final int requested;

    public InsufficientStockException(String resource, UUID resourceId, int available, int requested) {
        super(String.format("Insufficient stock on %s %s: available=%d, requested=%d",
                        resource, resourceId, available, requested),
                Map.of(
                        "resource", resource,
                        "resource_id", String.valueOf(resourceId),
                        "available", String.valueOf(available),
                        "requested", String.valueOf(requested)));
        this.available = available;
        this.requested = requested;
    }

    public int getAvailable() {
        return available;
    }

    public int getRequested() {
        return requested;
    }

    @Override
    public String getCode() {
        return "INSUFFICIENT_STOCK";
    }
}
