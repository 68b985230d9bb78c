package com.flagship.pos_core.sale;

/**
 * Lifecycle of a sale.
 *
 * <pre>
 * DRAFT ──complete──▶ COMPLETED | PARTIAL | PENDING
 * DRAFT ──abandon───▶ CANCELLED
 * PENDING ──payment/offset──▶ PARTIAL | COMPLETED
 * PARTIAL ──payment/offset──▶ COMPLETED
 * PENDING | PARTIAL | COMPLETED ──refund──▶ REFUNDED
 * PENDING | PARTIAL | COMPLETED | REFUNDED ──cancel──▶ CANCELLED
 * </pre>
 */
public enum SaleStatus {
    /**
     * Open cart. The only state in which items, type and prices may change.
     */
    DRAFT,

    /**
     * Completed on credit with nothing paid yet.
     */
    PENDING,

    /**
     * Completed on credit with part of the total paid.
     */
    PARTIAL,

    /**
     * Fully paid.
     */
    COMPLETED,

    /**
     * Refunds cover the whole total.
     */
    REFUNDED,

    /**
     * Abandoned as a draft, or cancelled after completion with every item
     * refunded. Terminal.
     */
    CANCELLED;

    public boolean canTransitionTo(SaleStatus target) {
        return switch (this) {
            case DRAFT -> target == COMPLETED || target == PARTIAL || target == PENDING || target == CANCELLED;
            case PENDING -> target == PARTIAL || target == COMPLETED || target == REFUNDED || target == CANCELLED;
            case PARTIAL -> target == COMPLETED || target == REFUNDED || target == CANCELLED;
            case COMPLETED -> target == REFUNDED || target == CANCELLED;
            case REFUNDED -> target == CANCELLED;
            case CANCELLED -> false;
        };
    }

    /**
     * Statuses where {@code amount_paid + amount_due == total_amount} holds.
     */
    public boolean isSettled() {
        return this == PENDING || this == PARTIAL || this == COMPLETED || this == REFUNDED;
    }

    public boolean acceptsPayments() {
        return this == PENDING || this == PARTIAL;
    }

    public boolean isRefundable() {
        return this == PENDING || this == PARTIAL || this == COMPLETED;
    }

    public boolean isCancellable() {
        return isSettled();
    }
}
