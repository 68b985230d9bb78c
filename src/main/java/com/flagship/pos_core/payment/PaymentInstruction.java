package com.flagship.pos_core.payment;

import lombok.Value;

import java.math.BigDecimal;

/**
 * One tender handed over at checkout.
 */
@Value
public class PaymentInstruction {
    BigDecimal amount;
    PaymentMethod method;
    String reference;
}
