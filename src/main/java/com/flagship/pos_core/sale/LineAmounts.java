package com.flagship.pos_core.sale;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Money of one line item.
 *
 * subtotal    = unit_price * quantity - line discount
 * tax_amount  = subtotal * tax_rate / 100
 * total_price = subtotal + tax_amount
 */
@Value
public class LineAmounts {
    BigDecimal gross;
    BigDecimal discount;
    BigDecimal subtotal;
    BigDecimal taxAmount;
    BigDecimal totalPrice;

    public static LineAmounts compute(BigDecimal unitPrice, int quantity,
                                      BigDecimal discountPercentage, BigDecimal taxRate) {
        if (unitPrice == null || unitPrice.signum() < 0) {
            throw new IllegalArgumentException("Unit price must be zero or positive");
        }
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be positive");
        }
        requirePercentage(discountPercentage, "Discount percentage");
        requirePercentage(taxRate, "Tax rate");

        BigDecimal gross = Money.of(unitPrice.multiply(BigDecimal.valueOf(quantity)));
        BigDecimal discount = Money.percentOf(gross, discountPercentage);
        BigDecimal subtotal = gross.subtract(discount);
        BigDecimal tax = Money.percentOf(subtotal, taxRate);
        return new LineAmounts(gross, discount, subtotal, tax, subtotal.add(tax));
    }

    private static void requirePercentage(BigDecimal value, String name) {
        if (value != null && (value.signum() < 0 || value.compareTo(BigDecimal.valueOf(100)) > 0)) {
            throw new IllegalArgumentException(name + " must be between 0 and 100");
        }
    }
}
