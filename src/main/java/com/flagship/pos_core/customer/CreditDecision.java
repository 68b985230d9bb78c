package com.flagship.pos_core.customer;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Outcome of a credit check. {@code overridden} is true when the purchase
 * was denied on the numbers but allowed by a forced override.
 */
@Value
public class CreditDecision {
    boolean allowed;
    String reason;
    boolean overridden;
    BigDecimal creditLimit;
    BigDecimal outstandingBalance;
    BigDecimal requested;

    static CreditDecision evaluate(CustomerEntity customer, BigDecimal amount) {
        BigDecimal limit = customer.getCreditLimit();
        BigDecimal outstanding = customer.getOutstandingBalance();

        if (customer.isCreditBlocked()) {
            return new CreditDecision(false, "Customer credit is blocked", false, limit, outstanding, amount);
        }
        BigDecimal exposure = outstanding.add(amount);
        if (exposure.compareTo(limit) > 0) {
            return new CreditDecision(false,
                String.format("Outstanding %s plus %s exceeds credit limit %s", outstanding, amount, limit),
                false, limit, outstanding, amount);
        }
        return new CreditDecision(true, null, false, limit, outstanding, amount);
    }

    CreditDecision overridden() {
        return new CreditDecision(true, reason, true, creditLimit, outstandingBalance, requested);
    }
}
