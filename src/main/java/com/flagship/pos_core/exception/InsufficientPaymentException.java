package com.flagship.pos_core.exception;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

/**
 * A non-credit sale must be fully paid at checkout.
 */
public class InsufficientPaymentException extends SaleOperationException {

    public InsufficientPaymentException(UUID saleId, BigDecimal totalAmount, BigDecimal paid) {
        super(String.format("Payments (%s) do not cover total (%s) of sale %s; use CREDIT for deferred payment",
                        paid, totalAmount, saleId),
                Map.of(
                        "sale_id", String.valueOf(saleId),
                        "total_amount", totalAmount.toPlainString(),
                        "amount_paid", paid.toPlainString(),
                        "amount_due", totalAmount.subtract(paid).toPlainString()));
    }

    @Override
    public String getCode() {
        return "INSUFFICIENT_PAYMENT";
    }
}
