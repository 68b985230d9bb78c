package com.flagship.pos_core.exception;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

/**
 * Payment larger than what is still owed on the sale.
 */
public class OverpaymentRejectedException extends SaleOperationException {

    public OverpaymentRejectedException(UUID saleId, BigDecimal amountDue, BigDecimal requested) {
        super(String.format("Payment amount (%s) exceeds amount due (%s) on sale %s",
                        requested, amountDue, saleId),
                Map.of(
                        "sale_id", String.valueOf(saleId),
                        "amount_due", amountDue.toPlainString(),
                        "amount_requested", requested.toPlainString()));
    }

    @Override
    public String getCode() {
        return "OVERPAYMENT_REJECTED";
    }
}
