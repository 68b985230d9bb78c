package com.flagship.pos_core.exception;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

/**
 * Credit sale denied by the credit guard. Overridable only by an explicit,
 * audited manager override.
 */
public class CreditLimitExceededException extends SaleOperationException {

    public CreditLimitExceededException(UUID customerId, String reason, BigDecimal creditLimit,
                                        BigDecimal outstandingBalance, BigDecimal requested) {
        super(String.format("Credit purchase of %s denied for customer %s: %s", requested, customerId, reason),
                Map.of(
                        "customer_id", String.valueOf(customerId),
                        "reason", reason,
                        "credit_limit", creditLimit.toPlainString(),
                        "outstanding_balance", outstandingBalance.toPlainString(),
                        "available_credit", creditLimit.subtract(outstandingBalance).toPlainString(),
                        "requested", requested.toPlainString()));
    }

    @Override
    public String getCode() {
        return "CREDIT_LIMIT_EXCEEDED";
    }
}
