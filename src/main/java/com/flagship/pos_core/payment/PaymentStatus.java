package com.flagship.pos_core.payment;

/**
 * Outcome of a recorded payment. Only SUCCESSFUL payments count towards
 * a sale's amount_paid.
 */
public enum PaymentStatus {
    SUCCESSFUL,
    FAILED
}
