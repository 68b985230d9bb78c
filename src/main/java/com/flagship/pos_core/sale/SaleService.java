package com.flagship.pos_core.sale;

import com.flagship.pos_core.audit.AuditLog;
import com.flagship.pos_core.context.SaleContext;
import com.flagship.pos_core.customer.CreditGuard;
import com.flagship.pos_core.customer.CustomerRepository;
import com.flagship.pos_core.exception.InsufficientPaymentException;
import com.flagship.pos_core.exception.InsufficientStockException;
import com.flagship.pos_core.exception.InvalidStateTransitionException;
import com.flagship.pos_core.exception.OverpaymentRejectedException;
import com.flagship.pos_core.exception.ResourceNotFoundException;
import com.flagship.pos_core.exception.SaleOperationException;
import com.flagship.pos_core.inventory.StockLedger;
import com.flagship.pos_core.inventory.StockLine;
import com.flagship.pos_core.observability.CorrelationContext;
import com.flagship.pos_core.observability.SaleMetrics;
import com.flagship.pos_core.payment.PaymentInstruction;
import com.flagship.pos_core.payment.PaymentLedger;
import com.flagship.pos_core.reservation.ReservationManager;
import com.flagship.pos_core.reservation.StockReservationEntity;
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
 * Sale lifecycle operations.
 *
 * Each public method is one transaction that starts by row-locking the sale
 * within the caller's business. Every typed failure rolls the whole
 * operation back, so callers never see a half-applied change.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SaleService {

    private final SaleRepository saleRepository;
    private final CustomerRepository customerRepository;
    private final StockLedger stockLedger;
    private final ReservationManager reservationManager;
    private final CreditGuard creditGuard;
    private final PaymentLedger paymentLedger;
    private final CompletionCoordinator completionCoordinator;
    private final AuditLog auditLog;
    private final SaleMetrics saleMetrics;
    private final Clock clock;

    @Transactional
    public SaleEntity openSale(SaleContext ctx, UUID customerId, SaleType saleType) {
        if (customerId != null) {
            customerRepository.findByIdAndBusinessId(customerId, ctx.getBusinessId())
                .orElseThrow(() -> new ResourceNotFoundException("Customer", customerId));
        }

        SaleEntity sale = saleRepository.save(SaleEntity.open(
            ctx.getBusinessId(), ctx.getStorefrontId(), ctx.getActorId(), customerId, saleType, clock.instant()));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("storefront_id", ctx.getStorefrontId());
        payload.put("customer_id", customerId);
        payload.put("sale_type", sale.getSaleType());
        auditLog.logEvent(AuditLog.SALE_OPENED, sale.getId(), ctx.getActorId(), payload, "Sale opened");

        log.info("Opened {} sale {} in storefront {}", sale.getSaleType(), sale.getId(), ctx.getStorefrontId());
        return sale;
    }

    /**
     * Reserves stock for a new line and prices it.
     *
     * @throws InsufficientStockException if the storefront or the stock line cannot cover the quantity
     */
    @Transactional
    public SaleItemEntity addItem(SaleContext ctx, UUID saleId, AddItemCommand command) {
        SaleEntity sale = lockSale(ctx, saleId);
        sale.requireDraft("add_item");

        StockLine stockLine = stockLedger.findStockLine(ctx.getBusinessId(), command.getStockLineId())
            .orElseThrow(() -> new ResourceNotFoundException("Stock line", command.getStockLineId()));
        UUID productId = command.getProductId() != null ? command.getProductId() : stockLine.getProductId();
        if (!productId.equals(stockLine.getProductId())) {
            throw new IllegalArgumentException(
                "Stock line " + stockLine.getId() + " does not belong to product " + productId);
        }

        int inCart = sale.getItems().stream()
            .filter(item -> item.getProductId().equals(productId))
            .mapToInt(SaleItemEntity::getQuantity)
            .sum();
        int inStorefront = stockLedger.getAvailableQuantity(sale.getStorefrontId(), productId);
        if (inStorefront - inCart < command.getQuantity()) {
            saleMetrics.recordRejection("INSUFFICIENT_STOCK");
            throw new InsufficientStockException("storefront_inventory", productId,
                Math.max(inStorefront - inCart, 0), command.getQuantity());
        }

        StockReservationEntity reservation = reservationManager.reserve(
            ctx.getBusinessId(), stockLine.getId(), command.getQuantity(), sale.getCartSessionId());

        BigDecimal unitPrice = command.getUnitPrice() != null
            ? command.getUnitPrice()
            : stockLine.priceFor(sale.getSaleType());
        SaleItemEntity item = sale.addItem(productId, stockLine.getId(), reservation.getId(),
            command.getQuantity(), unitPrice, command.getDiscountPercentage(), command.getTaxRate(),
            stockLine.getUnitCost(), clock.instant());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sale_item_id", item.getId());
        payload.put("reservation_id", reservation.getId());
        payload.put("stock_line_id", stockLine.getId());
        payload.put("quantity", command.getQuantity());
        payload.put("expires_at", reservation.getExpiresAt());
        auditLog.logEvent(AuditLog.STOCK_RESERVED, saleId, ctx.getActorId(), payload,
            "Reserved " + command.getQuantity() + " units");

        log.info("Added item {} to sale {}: product={}, qty={}, unitPrice={}, total now {}",
                item.getId(), saleId, productId, command.getQuantity(), item.getUnitPrice(), sale.getTotalAmount());
        return item;
    }

    @Transactional
    public SaleEntity removeItem(SaleContext ctx, UUID saleId, UUID itemId) {
        SaleEntity sale = lockSale(ctx, saleId);
        SaleItemEntity item = sale.removeItem(itemId, clock.instant());
        if (item.getReservationId() != null) {
            reservationManager.release(item.getReservationId());
        }

        auditLog.logEvent(AuditLog.STOCK_RELEASED, saleId, ctx.getActorId(), Map.of(
            "sale_item_id", itemId,
            "stock_line_id", item.getStockLineId(),
            "quantity", item.getQuantity()
        ), "Item removed from cart");

        log.info("Removed item {} from sale {}, total now {}", itemId, saleId, sale.getTotalAmount());
        return sale;
    }

    /**
     * Switches between retail and wholesale and reprices every line from its
     * stock line.
     */
    @Transactional
    public SaleEntity changeType(SaleContext ctx, UUID saleId, SaleType saleType) {
        SaleEntity sale = lockSale(ctx, saleId);
        SaleType previous = sale.getSaleType();
        Instant now = clock.instant();
        sale.changeType(saleType, now);

        for (SaleItemEntity item : sale.getItems()) {
            StockLine stockLine = stockLedger.findStockLine(ctx.getBusinessId(), item.getStockLineId())
                .orElseThrow(() -> new ResourceNotFoundException("Stock line", item.getStockLineId()));
            sale.repriceItem(item.getId(), stockLine.priceFor(saleType), now);
        }

        auditLog.logEvent(AuditLog.SALE_TYPE_CHANGED, saleId, ctx.getActorId(), Map.of(
            "from", previous,
            "to", saleType,
            "total_amount", sale.getTotalAmount()
        ), "Sale type changed");

        log.info("Sale {} type changed {} -> {}, total now {}", saleId, previous, saleType, sale.getTotalAmount());
        return sale;
    }

    /**
     * Checks out a DRAFT sale.
     *
     * Non-credit sales must be paid in full. Credit sales need a customer and
     * pass the credit check on the unpaid part before anything is booked;
     * the unpaid part is then charged to the customer's account.
     *
     * @throws InvalidStateTransitionException if the sale is not DRAFT or has no items
     * @throws OverpaymentRejectedException if tenders exceed the total
     * @throws InsufficientPaymentException if a non-credit sale is paid short
     * @throws com.flagship.pos_core.exception.CreditLimitExceededException if credit is denied and not forced
     * @throws com.flagship.pos_core.exception.ReservationExpiredException if a hold lapsed before commit
     */
    @Transactional
    public SaleEntity complete(SaleContext ctx, UUID saleId, CompleteSaleCommand command) {
        try {
            return saleMetrics.timeCompletion(() -> doComplete(ctx, saleId, command));
        } catch (SaleOperationException e) {
            saleMetrics.recordRejection(e.getCode());
            log.warn("Completion of sale {} rejected: {}", saleId, e.getMessage());
            throw e;
        }
    }

    private SaleEntity doComplete(SaleContext ctx, UUID saleId, CompleteSaleCommand command) {
        SaleEntity sale = lockSale(ctx, saleId);
        sale.requireDraft("complete");
        if (!sale.hasItems()) {
            throw new InvalidStateTransitionException(saleId, sale.getStatus(), "complete",
                "Cannot complete sale " + saleId + " with no items");
        }
        PaymentType paymentType = command.getPaymentType();
        if (paymentType == null) {
            throw new IllegalArgumentException("Payment type is required");
        }

        Instant now = clock.instant();
        sale.applyCheckoutAdjustments(command.getDiscountAmount(), command.getTaxAmount(), command.getNotes(), now);
        sale.chooseSettlement(paymentType, now);

        List<PaymentInstruction> tenders = command.getPayments() != null ? command.getPayments() : List.of();
        BigDecimal tendered = tenders.stream()
            .map(PaymentInstruction::getAmount)
            .filter(amount -> amount != null)
            .map(Money::of)
            .reduce(Money.ZERO, BigDecimal::add);

        if (tendered.compareTo(sale.getTotalAmount()) > 0) {
            throw new OverpaymentRejectedException(saleId, sale.getTotalAmount(), tendered);
        }
        if (!paymentType.isCredit() && tendered.compareTo(sale.getTotalAmount()) < 0) {
            throw new InsufficientPaymentException(saleId, sale.getTotalAmount(), tendered);
        }

        BigDecimal exposure = sale.getTotalAmount().subtract(tendered);
        if (paymentType.isCredit()) {
            if (sale.getCustomerId() == null) {
                throw new IllegalArgumentException("Credit sales require a customer");
            }
            if (exposure.signum() > 0) {
                creditGuard.requirePurchase(ctx, sale.getCustomerId(), saleId, exposure, command.isForceCredit());
            }
        }

        paymentLedger.applyAtCompletion(ctx, sale, tenders);
        completionCoordinator.commit(ctx, sale);

        if (paymentType.isCredit() && sale.getAmountDue().signum() > 0) {
            creditGuard.chargeCredit(ctx, sale.getCustomerId(), saleId, sale.getAmountDue());
        }

        saleMetrics.recordSaleCompleted(paymentType.name(), sale.getStatus().name());
        return sale;
    }

    /**
     * Drops a DRAFT cart and gives its reservations back. Abandoning a
     * cancelled sale is a no-op.
     *
     * @throws InvalidStateTransitionException if the sale is already finalized
     */
    @Transactional
    public SaleEntity abandon(SaleContext ctx, UUID saleId) {
        SaleEntity sale = lockSale(ctx, saleId);
        if (sale.getStatus() == SaleStatus.CANCELLED) {
            log.debug("Sale {} already cancelled, nothing to abandon", saleId);
            return sale;
        }
        if (sale.getStatus() != SaleStatus.DRAFT) {
            throw new InvalidStateTransitionException(saleId, sale.getStatus(), "abandon",
                "Sale " + saleId + " is already finalized (" + sale.getStatus() + ")");
        }

        int released = reservationManager.releaseForSession(sale.getCartSessionId()).size();
        sale.abandon(clock.instant());

        auditLog.logEvent(AuditLog.SALE_ABANDONED, saleId, ctx.getActorId(),
            Map.of("reservations_released", released), "Draft sale abandoned");

        log.info("Abandoned sale {}, released {} reservations", saleId, released);
        return sale;
    }

    @Transactional(readOnly = true)
    public SaleEntity get(SaleContext ctx, UUID saleId) {
        return saleRepository.findByIdAndBusinessId(saleId, ctx.getBusinessId())
            .orElseThrow(() -> new ResourceNotFoundException("Sale", saleId));
    }

    private SaleEntity lockSale(SaleContext ctx, UUID saleId) {
        SaleEntity sale = saleRepository.findByIdAndBusinessIdForUpdate(saleId, ctx.getBusinessId())
            .orElseThrow(() -> new ResourceNotFoundException("Sale", saleId));
        CorrelationContext.putSale(ctx.getBusinessId(), saleId);
        return sale;
    }
}
