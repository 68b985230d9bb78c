package com.flagship.pos_core.exception;

import java.util.Map;
import java.util.UUID;

/**
 * Operation attempted while the sale is in a status that does not allow it,
 * e.g. completing a sale that is no longer DRAFT.
 */
public class InvalidStateTransitionException extends SaleOperationException {

    public InvalidStateTransitionException(UUID saleId, Enum<?> currentStatus, String operation, String message) {
        super(message,
                Map.of(
                        "sale_id", String.valueOf(saleId),
                        "current_status", String.valueOf(currentStatus),
                        "operation", operation));
    }

    public InvalidStateTransitionException(UUID saleId, Enum<?> currentStatus, String operation) {
        this(saleId, currentStatus, operation,
                String.format("Cannot %s sale %s in %s status", operation, saleId, currentStatus));
    }

    @Override
    public String getCode() {
        return "INVALID_STATE_TRANSITION";
    }
}
