package com.flagship.pos_core.refund;

import com.flagship.pos_core.audit.AuditLog;
import com.flagship.pos_core.context.SaleContext;
import com.flagship.pos_core.exception.InvalidStateTransitionException;
import com.flagship.pos_core.exception.ResourceNotFoundException;
import com.flagship.pos_core.inventory.StockLedger;
import com.flagship.pos_core.observability.CorrelationContext;
import com.flagship.pos_core.observability.SaleMetrics;
import com.flagship.pos_core.payment.PaymentLedger;
import com.flagship.pos_core.sale.SaleEntity;
import com.flagship.pos_core.sale.SaleItemEntity;
import com.flagship.pos_core.sale.SaleRepository;
import com.flagship.pos_core.sale.SaleStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Returns goods against finalized sales and cancels them.
 *
 * A refund first settles whatever is still unpaid on the sale with a
 * RETURN_OFFSET payment and gives the rest back as cash. Returned units go
 * back to the storefront pool and the stock line they were sold from.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RefundProcessor {

    private final SaleRepository saleRepository;
    private final RefundRepository refundRepository;
    private final RefundCalculator refundCalculator;
    private final PaymentLedger paymentLedger;
    private final StockLedger stockLedger;
    private final AuditLog auditLog;
    private final SaleMetrics saleMetrics;
    private final Clock clock;

    /**
     * @param type FULL or PARTIAL; null derives it from whether every
     *             remaining unit is returned
     * @throws InvalidStateTransitionException unless the sale is PENDING, PARTIAL or COMPLETED
     * @throws com.flagship.pos_core.exception.OverrefundRejectedException if a quantity exceeds what is refundable
     */
    @Transactional
    public RefundEntity processRefund(SaleContext ctx, UUID saleId, List<RefundLine> lines,
                                      String reason, RefundType type) {
        SaleEntity sale = lockSale(ctx, saleId);
        if (!sale.getStatus().isRefundable()) {
            throw new InvalidStateTransitionException(saleId, sale.getStatus(), "refund");
        }
        return refund(ctx, sale, lines, reason, type);
    }

    /**
     * Refunds every remaining unit as a FULL refund, then marks the sale
     * CANCELLED. A sale that is already fully refunded is only marked.
     */
    @Transactional
    public SaleEntity cancelSale(SaleContext ctx, UUID saleId, String reason) {
        SaleEntity sale = lockSale(ctx, saleId);
        if (!sale.getStatus().isCancellable()) {
            throw new InvalidStateTransitionException(saleId, sale.getStatus(), "cancel");
        }
        requireReason(reason);

        List<RefundLine> remaining = sale.getItems().stream()
            .filter(item -> item.getRefundableQuantity() > 0)
            .map(item -> new RefundLine(item.getId(), item.getRefundableQuantity()))
            .toList();
        if (!remaining.isEmpty()) {
            refund(ctx, sale, remaining, reason, RefundType.FULL);
        }

        SaleStatus previous = sale.getStatus();
        sale.cancel(clock.instant());
        auditLog.logEvent(AuditLog.SALE_CANCELLED, saleId, ctx.getActorId(), Map.of(
            "previous_status", previous,
            "amount_refunded", sale.getAmountRefunded(),
            "reason", reason
        ), "Sale " + sale.getReceiptNumber() + " cancelled");

        log.info("Cancelled sale {} ({} -> CANCELLED), refunded total {}",
                saleId, previous, sale.getAmountRefunded());
        return sale;
    }

    @Transactional(readOnly = true)
    public List<RefundEntity> refunds(SaleContext ctx, UUID saleId) {
        saleRepository.findByIdAndBusinessId(saleId, ctx.getBusinessId())
            .orElseThrow(() -> new ResourceNotFoundException("Sale", saleId));
        return refundRepository.findBySaleIdOrderByCreatedAtAsc(saleId);
    }

    private RefundEntity refund(SaleContext ctx, SaleEntity sale, List<RefundLine> lines,
                                String reason, RefundType requestedType) {
        requireReason(reason);
        RefundQuote quote = refundCalculator.quote(sale, lines);
        RefundType type = requestedType != null
            ? requestedType
            : quote.isReturnsEverything() ? RefundType.FULL : RefundType.PARTIAL;
        if (type == RefundType.FULL && !quote.isReturnsEverything()) {
            throw new IllegalArgumentException("A FULL refund must return every remaining unit of the sale");
        }

        Instant now = clock.instant();
        BigDecimal amount = quote.getAmount();
        BigDecimal offset = amount.min(sale.getAmountDue());
        UUID refundId = UUID.randomUUID();

        if (offset.signum() > 0) {
            paymentLedger.recordReturnOffset(ctx, sale, offset, refundId);
        }
        sale.applyRefund(amount, now);

        RefundEntity refund = RefundEntity.processed(refundId, ctx.getBusinessId(), sale.getId(), type,
            amount, offset, reason, ctx.getActorId(), now);
        for (RefundQuote.Line line : quote.getLines()) {
            SaleItemEntity item = line.getItem();
            item.recordRefund(line.getQuantity());
            refund.addItem(item.getId(), line.getQuantity(), line.getAmount());
            stockLedger.restock(sale.getStorefrontId(), item.getProductId(), item.getStockLineId(), line.getQuantity());
        }
        refundRepository.save(refund);

        if (offset.signum() > 0) {
            sale.reclassifyAfterPayment(now);
        }
        if (sale.getAmountRefunded().compareTo(sale.getTotalAmount()) >= 0
                && sale.getStatus() != SaleStatus.REFUNDED) {
            sale.markRefunded(now);
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("refund_id", refundId);
        payload.put("refund_type", type);
        payload.put("amount", amount);
        payload.put("offset_amount", offset);
        payload.put("cash_amount", refund.getCashAmount());
        payload.put("items", quote.getLines().stream()
            .map(line -> Map.of("sale_item_id", line.getItem().getId(), "quantity", line.getQuantity()))
            .toList());
        payload.put("status", sale.getStatus());
        auditLog.logEvent(AuditLog.REFUND_PROCESSED, sale.getId(), ctx.getActorId(), payload, reason);
        saleMetrics.recordRefund(type.name());

        log.info("Refund {} on sale {}: type={}, amount={}, offset={}, cash={}, status={}",
                refundId, sale.getId(), type, amount, offset, refund.getCashAmount(), sale.getStatus());
        return refund;
    }

    private SaleEntity lockSale(SaleContext ctx, UUID saleId) {
        SaleEntity sale = saleRepository.findByIdAndBusinessIdForUpdate(saleId, ctx.getBusinessId())
            .orElseThrow(() -> new ResourceNotFoundException("Sale", saleId));
        CorrelationContext.putSale(ctx.getBusinessId(), saleId);
        return sale;
    }

    private void requireReason(String reason) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("A refund reason is required");
        }
    }
}
