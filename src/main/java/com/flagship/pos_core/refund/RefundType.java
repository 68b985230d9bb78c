package com.flagship.pos_core.refund;

public enum RefundType {
    /** Returns every remaining unit of the sale. */
    FULL,
    PARTIAL
}
