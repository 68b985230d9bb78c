package com.flagship.pos_core.sale;

import com.flagship.pos_core.audit.AuditLog;
import com.flagship.pos_core.context.SaleContext;
import com.flagship.pos_core.inventory.StockLedger;
import com.flagship.pos_core.reservation.ReservationManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a priced, paid DRAFT sale into a finalized one.
 *
 * Runs inside the completing transaction:
 * 1. consume the cart's reservations (all must still be holding)
 * 2. take the units out of the storefront pool and the stock lines, in
 *    (product, stock line) order so concurrent commits lock rows in the same
 *    sequence and cannot deadlock on each other
 * 3. assign the receipt number
 * 4. move the sale to its settled status
 * 5. write sale.completed to the outbox
 *
 * A failure in any step rolls all of them back and the sale stays DRAFT.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CompletionCoordinator {

    private static final Comparator<SaleItemEntity> LOCK_ORDER = Comparator
        .comparing(SaleItemEntity::getProductId)
        .thenComparing(SaleItemEntity::getStockLineId);

    private final ReservationManager reservationManager;
    private final StockLedger stockLedger;
    private final ReceiptNumberGenerator receiptNumberGenerator;
    private final SaleRepository saleRepository;
    private final AuditLog auditLog;
    private final Clock clock;

    /**
     * @return the assigned receipt number
     * @throws com.flagship.pos_core.exception.ReservationExpiredException if any hold lapsed
     * @throws com.flagship.pos_core.exception.InsufficientStockException if the storefront no longer has the units
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public String commit(SaleContext ctx, SaleEntity sale) {
        Instant now = clock.instant();

        reservationManager.consumeForSale(sale.getCartSessionId(), sale.getReservationIds());

        for (SaleItemEntity item : inLockOrder(sale.getItems())) {
            stockLedger.decrement(sale.getStorefrontId(), item.getProductId(), item.getQuantity());
            stockLedger.consumeStockLine(item.getStockLineId(), item.getQuantity());
        }

        String receiptNumber = receiptNumberGenerator.next(sale.getBusinessId(), now);
        sale.finalizeCompletion(receiptNumber, now);
        saleRepository.flush();

        auditLog.logEvent(AuditLog.SALE_COMPLETED, sale.getId(), ctx.getActorId(), completedPayload(sale),
            "Sale completed with receipt " + receiptNumber);

        log.info("Committed sale {}: receipt={}, status={}, total={}, paid={}, due={}",
                sale.getId(), receiptNumber, sale.getStatus(), sale.getTotalAmount(),
                sale.getAmountPaid(), sale.getAmountDue());
        return receiptNumber;
    }

    static List<SaleItemEntity> inLockOrder(List<SaleItemEntity> items) {
        return items.stream()
            .sorted(LOCK_ORDER)
            .toList();
    }

    private Map<String, Object> completedPayload(SaleEntity sale) {
        List<Map<String, Object>> items = sale.getItems().stream()
            .map(item -> {
                Map<String, Object> line = new LinkedHashMap<>();
                line.put("sale_item_id", item.getId());
                line.put("product_id", item.getProductId());
                line.put("stock_line_id", item.getStockLineId());
                line.put("quantity", item.getQuantity());
                line.put("unit_price", item.getUnitPrice());
                line.put("total_price", item.getTotalPrice());
                return line;
            })
            .toList();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("business_id", sale.getBusinessId());
        payload.put("storefront_id", sale.getStorefrontId());
        payload.put("customer_id", sale.getCustomerId());
        payload.put("receipt_number", sale.getReceiptNumber());
        payload.put("sale_type", sale.getSaleType());
        payload.put("payment_type", sale.getPaymentType());
        payload.put("status", sale.getStatus());
        payload.put("subtotal", sale.getSubtotal());
        payload.put("discount_amount", sale.getDiscountAmount());
        payload.put("tax_amount", sale.getTaxAmount());
        payload.put("total_amount", sale.getTotalAmount());
        payload.put("amount_paid", sale.getAmountPaid());
        payload.put("amount_due", sale.getAmountDue());
        payload.put("items", items);
        return payload;
    }
}
