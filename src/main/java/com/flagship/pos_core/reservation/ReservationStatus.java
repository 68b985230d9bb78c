package com.flagship.pos_core.reservation;

/**
 * Lifecycle of a stock hold.
 *
 * ACTIVE is the only state that counts against availability, and only
 * until its expiry instant. All other states are terminal.
 */
public enum ReservationStatus {
    /**
     * Holding stock for a cart.
     */
    ACTIVE,

    /**
     * Converted into a sale at commit; stock left the shelf.
     */
    CONSUMED,

    /**
     * Given back by item removal or cart abandonment.
     */
    RELEASED,

    /**
     * Lapsed without a commit.
     */
    EXPIRED
}
