package com.flagship.pos_core.refund;

import com.flagship.pos_core.exception.OverrefundRejectedException;
import com.flagship.pos_core.sale.PaymentType;
import com.flagship.pos_core.sale.SaleEntity;
import com.flagship.pos_core.sale.SaleItemEntity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RefundCalculatorTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    private final RefundCalculator calculator = new RefundCalculator();

    private static SaleEntity newSale() {
        return SaleEntity.open(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), null, null, NOW);
    }

    private static SaleItemEntity addItem(SaleEntity sale, String unitPrice, int quantity,
                                          String discountPct, String taxRate) {
        return sale.addItem(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), quantity,
            new BigDecimal(unitPrice), new BigDecimal(discountPct), new BigDecimal(taxRate),
            BigDecimal.ZERO, NOW);
    }

    private static void completeCash(SaleEntity sale, String orderDiscount) {
        sale.applyCheckoutAdjustments(new BigDecimal(orderDiscount), null, null, NOW);
        sale.chooseSettlement(PaymentType.CASH, NOW);
        sale.applyPayment(sale.getTotalAmount(), NOW);
        sale.finalizeCompletion("RCP-20240301-000001", NOW);
    }

    private static void book(SaleEntity sale, RefundQuote quote) {
        quote.getLines().forEach(line -> line.getItem().recordRefund(line.getQuantity()));
        sale.applyRefund(quote.getAmount(), NOW);
    }

    @Test
    @DisplayName("Returned units carry their share of line and order adjustments")
    void proportionalLineAmount() {
        SaleEntity sale = newSale();
        SaleItemEntity discounted = addItem(sale, "25.00", 2, "10", "16");
        addItem(sale, "10.00", 1, "0", "0");
        completeCash(sale, "5.50");
        assertEquals(new BigDecimal("56.70"), sale.getTotalAmount());

        RefundQuote quote = calculator.quote(sale, List.of(new RefundLine(discounted.getId(), 1)));

        // 25.00 - 2.50 line discount - 2.25 order discount share + 3.60 tax
        assertEquals(new BigDecimal("23.85"), quote.getAmount());
        assertFalse(quote.isReturnsEverything());
    }

    @Test
    @DisplayName("Refunds of every unit add up to the sale total exactly")
    void refundsSumToTotal() {
        SaleEntity sale = newSale();
        SaleItemEntity item = addItem(sale, "10.00", 3, "0", "0");
        completeCash(sale, "10.00");
        assertEquals(new BigDecimal("20.00"), sale.getTotalAmount());

        RefundQuote first = calculator.quote(sale, List.of(new RefundLine(item.getId(), 1)));
        assertEquals(new BigDecimal("6.67"), first.getAmount());
        book(sale, first);

        RefundQuote second = calculator.quote(sale, List.of(new RefundLine(item.getId(), 1)));
        assertEquals(new BigDecimal("6.67"), second.getAmount());
        book(sale, second);

        RefundQuote last = calculator.quote(sale, List.of(new RefundLine(item.getId(), 1)));
        assertTrue(last.isReturnsEverything());
        assertEquals(new BigDecimal("6.66"), last.getAmount());
        book(sale, last);

        assertEquals(0, sale.getAmountRefunded().compareTo(sale.getTotalAmount()));
    }

    @Test
    void remainderRefundCoversEveryOpenLine() {
        SaleEntity sale = newSale();
        SaleItemEntity discounted = addItem(sale, "25.00", 2, "10", "16");
        SaleItemEntity plain = addItem(sale, "10.00", 1, "0", "0");
        completeCash(sale, "5.50");
        book(sale, calculator.quote(sale, List.of(new RefundLine(discounted.getId(), 1))));

        RefundQuote rest = calculator.quote(sale, List.of(
            new RefundLine(discounted.getId(), 1),
            new RefundLine(plain.getId(), 1)));

        assertTrue(rest.isReturnsEverything());
        assertEquals(new BigDecimal("32.85"), rest.getAmount());
        assertEquals(2, rest.getLines().size());
    }

    @Test
    void duplicateLinesForOneItemAreMerged() {
        SaleEntity sale = newSale();
        SaleItemEntity item = addItem(sale, "10.00", 3, "0", "0");
        completeCash(sale, "0");

        RefundQuote quote = calculator.quote(sale, List.of(
            new RefundLine(item.getId(), 1),
            new RefundLine(item.getId(), 1)));

        assertEquals(1, quote.getLines().size());
        assertEquals(2, quote.getLines().get(0).getQuantity());
        assertEquals(new BigDecimal("20.00"), quote.getAmount());
    }

    @Test
    void moreUnitsThanRemainAreRejected() {
        SaleEntity sale = newSale();
        SaleItemEntity item = addItem(sale, "25.00", 2, "0", "0");
        completeCash(sale, "0");

        assertThrows(OverrefundRejectedException.class,
            () -> calculator.quote(sale, List.of(new RefundLine(item.getId(), 3))));
    }

    @Test
    void unknownItemOrEmptyRequestIsInvalid() {
        SaleEntity sale = newSale();
        addItem(sale, "25.00", 2, "0", "0");
        completeCash(sale, "0");

        assertThrows(IllegalArgumentException.class,
            () -> calculator.quote(sale, List.of(new RefundLine(UUID.randomUUID(), 1))));
        assertThrows(IllegalArgumentException.class, () -> calculator.quote(sale, List.of()));
    }
}
