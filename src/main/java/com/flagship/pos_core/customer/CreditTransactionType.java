package com.flagship.pos_core.customer;

public enum CreditTransactionType {
    /** Credit sale raised the balance. */
    CHARGE,
    /** Payment or return lowered the balance. */
    PAYMENT
}
