package com.flagship.pos_core.refund;

import com.flagship.pos_core.exception.OverrefundRejectedException;
import com.flagship.pos_core.sale.Money;
import com.flagship.pos_core.sale.SaleEntity;
import com.flagship.pos_core.sale.SaleItemEntity;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Prices returned units.
 *
 * For q of an item's n units:
 * <pre>
 * amount = unit_price * q
 *        - line_discount * q/n - order_discount * w * q/n
 *        + line_tax * q/n      + order_tax * w * q/n
 * </pre>
 * where w is the item's share of the sale subtotal. The refund that returns
 * the last remaining units is priced at total - already refunded so the
 * refunds of a sale always add up to its total exactly.
 */
@Component
public class RefundCalculator {

    private static final MathContext RATIO = MathContext.DECIMAL64;

    public RefundQuote quote(SaleEntity sale, List<RefundLine> requested) {
        if (requested == null || requested.isEmpty()) {
            throw new IllegalArgumentException("At least one item must be refunded");
        }

        Map<UUID, Integer> quantities = new LinkedHashMap<>();
        for (RefundLine line : requested) {
            if (line.getQuantity() <= 0) {
                throw new IllegalArgumentException("Refund quantity must be positive");
            }
            quantities.merge(line.getSaleItemId(), line.getQuantity(), Integer::sum);
        }

        List<RefundQuote.Line> lines = new ArrayList<>();
        BigDecimal sum = Money.ZERO;
        for (Map.Entry<UUID, Integer> entry : quantities.entrySet()) {
            SaleItemEntity item = sale.findItem(entry.getKey())
                .orElseThrow(() -> new IllegalArgumentException(
                    "Item " + entry.getKey() + " is not part of sale " + sale.getId()));
            int quantity = entry.getValue();
            if (quantity > item.getRefundableQuantity()) {
                throw OverrefundRejectedException.forQuantity(item.getId(), item.getRefundableQuantity(), quantity);
            }
            BigDecimal amount = lineAmount(sale, item, quantity);
            lines.add(new RefundQuote.Line(item, quantity, amount));
            sum = sum.add(amount);
        }

        boolean returnsEverything = sale.getItems().stream()
            .allMatch(item -> item.getRefundableQuantity() == quantities.getOrDefault(item.getId(), 0));

        BigDecimal remaining = sale.getRefundableAmount();
        if (returnsEverything) {
            lines = settleRounding(lines, remaining.subtract(sum));
            return new RefundQuote(lines, remaining, true);
        }
        if (sum.compareTo(remaining) > 0) {
            throw OverrefundRejectedException.forAmount(sale.getId(), remaining, sum);
        }
        return new RefundQuote(lines, sum, false);
    }

    BigDecimal lineAmount(SaleEntity sale, SaleItemEntity item, int quantity) {
        BigDecimal fraction = BigDecimal.valueOf(quantity).divide(BigDecimal.valueOf(item.getQuantity()), RATIO);
        BigDecimal weight = sale.getSubtotal().signum() > 0
            ? item.getSubtotal().divide(sale.getSubtotal(), RATIO)
            : BigDecimal.ZERO;

        BigDecimal gross = item.getUnitPrice().multiply(BigDecimal.valueOf(quantity));
        BigDecimal lineDiscount = item.getDiscountAmount().multiply(fraction, RATIO);
        BigDecimal lineTax = item.getTaxAmount().multiply(fraction, RATIO);
        BigDecimal orderDiscount = sale.getDiscountAmount().multiply(weight, RATIO).multiply(fraction, RATIO);
        BigDecimal orderTax = sale.getOrderTaxAmount().multiply(weight, RATIO).multiply(fraction, RATIO);

        return Money.nonNegative(gross.subtract(lineDiscount).subtract(orderDiscount).add(lineTax).add(orderTax));
    }

    /**
     * Puts the rounding difference on the last line.
     */
    private List<RefundQuote.Line> settleRounding(List<RefundQuote.Line> lines, BigDecimal difference) {
        if (difference.signum() == 0 || lines.isEmpty()) {
            return lines;
        }
        List<RefundQuote.Line> adjusted = new ArrayList<>(lines);
        RefundQuote.Line last = adjusted.remove(adjusted.size() - 1);
        adjusted.add(new RefundQuote.Line(last.getItem(), last.getQuantity(),
            Money.nonNegative(last.getAmount().add(difference))));
        return adjusted;
    }
}
