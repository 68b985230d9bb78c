package com.flagship.pos_core.sale;

/**
 * How a sale is settled at completion. Only CREDIT may complete with an
 * amount still due.
 */
public enum PaymentType {
    CASH,
    CARD,
    MOBILE,
    CREDIT;

    public boolean isCredit() {
        return this == CREDIT;
    }
}
