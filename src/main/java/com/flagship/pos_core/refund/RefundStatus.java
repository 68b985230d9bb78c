package com.flagship.pos_core.refund;

public enum RefundStatus {
    PROCESSED
}
