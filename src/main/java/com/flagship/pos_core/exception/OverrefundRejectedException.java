package com.flagship.pos_core.exception;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

/**
 * Refund asking for more than is left to return on a line or on the sale.
 */
public class OverrefundRejectedException extends SaleOperationException {

    private OverrefundRejectedException(String message, Map<String, String> details) {
        super(message, details);
    }

    public static OverrefundRejectedException forQuantity(UUID saleItemId, int refundable, int requested) {
        return new OverrefundRejectedException(
                String.format("Refund quantity %d exceeds refundable quantity %d for item %s",
                        requested, refundable, saleItemId),
                Map.of(
                        "sale_item_id", String.valueOf(saleItemId),
                        "refundable_quantity", String.valueOf(refundable),
                        "requested_quantity", String.valueOf(requested)));
    }

    public static OverrefundRejectedException forAmount(UUID saleId, BigDecimal refundable, BigDecimal requested) {
        return new OverrefundRejectedException(
                String.format("Refund amount %s exceeds refundable amount %s for sale %s",
                        requested, refundable, saleId),
                Map.of(
                        "sale_id", String.valueOf(saleId),
                        "refundable_amount", refundable.toPlainString(),
                        "requested_amount", requested.toPlainString()));
    }

    @Override
    public String getCode() {
        return "OVERREFUND_REJECTED";
    }
}
