package com.flagship.pos_core.payment;

/**
 * Tender a payment was made with. RETURN_OFFSET is booked by the refund
 * processor when returned goods settle an unpaid balance, never by a caller.
 */
public enum PaymentMethod {
    CASH,
    CARD,
    MOBILE,
    BANK_TRANSFER,
    RETURN_OFFSET
}
