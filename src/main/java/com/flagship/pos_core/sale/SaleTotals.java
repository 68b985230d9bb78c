package com.flagship.pos_core.sale;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Collection;

/**
 * Sale-level totals derived from its lines and order adjustments.
 *
 * subtotal     = sum(line subtotal)
 * tax_amount   = sum(line tax) + order tax
 * total_amount = subtotal - discount + tax_amount
 * amount_due   = max(total_amount - amount_paid, 0)
 */
@Value
public class SaleTotals {
    BigDecimal subtotal;
    BigDecimal taxAmount;
    BigDecimal totalAmount;
    BigDecimal amountDue;

    public static SaleTotals compute(Collection<LineAmounts> lines, BigDecimal discountAmount,
                                     BigDecimal orderTaxAmount, BigDecimal amountPaid) {
        BigDecimal subtotal = Money.ZERO;
        BigDecimal lineTax = Money.ZERO;
        for (LineAmounts line : lines) {
            subtotal = subtotal.add(line.getSubtotal());
            lineTax = lineTax.add(line.getTaxAmount());
        }

        BigDecimal discount = Money.of(discountAmount);
        BigDecimal orderTax = Money.of(orderTaxAmount);
        if (discount.signum() < 0 || orderTax.signum() < 0) {
            throw new IllegalArgumentException("Discount and order tax must not be negative");
        }

        BigDecimal tax = lineTax.add(orderTax);
        BigDecimal total = subtotal.subtract(discount).add(tax);
        if (total.signum() < 0) {
            throw new IllegalArgumentException(
                "Discount " + discount + " exceeds the sale value " + subtotal.add(tax));
        }

        BigDecimal due = Money.nonNegative(total.subtract(Money.of(amountPaid)));
        return new SaleTotals(subtotal, tax, total, due);
    }
}
