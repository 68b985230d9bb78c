package com.flagship.pos_core.sale;

import com.flagship.pos_core.exception.InvalidStateTransitionException;
import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * The sale aggregate: a cart while DRAFT, an order afterwards.
 *
 * There are no setters. Every change goes through a method named after the
 * operation, which checks the current status first and keeps
 * {@code amount_paid + amount_due == total_amount} and
 * {@code amount_refunded <= amount_paid} true.
 */
@Entity
@Table(name = "sales")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SaleEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "business_id", nullable = false, updatable = false)
    private UUID businessId;

    @Column(name = "storefront_id", nullable = false, updatable = false)
    private UUID storefrontId;

    @Column(name = "cashier_id", nullable = false, updatable = false)
    private UUID cashierId;

    @Column(name = "customer_id", updatable = false)
    private UUID customerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "sale_type", nullable = false, length = 20)
    private SaleType saleType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SaleStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_type", length = 20)
    private PaymentType paymentType;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal subtotal;

    @Column(name = "discount_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal discountAmount;

    @Column(name = "order_tax_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal orderTaxAmount;

    @Column(name = "tax_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal taxAmount;

    @Column(name = "total_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "amount_paid", nullable = false, precision = 19, scale = 2)
    private BigDecimal amountPaid;

    @Column(name = "amount_due", nullable = false, precision = 19, scale = 2)
    private BigDecimal amountDue;

    @Column(name = "amount_refunded", nullable = false, precision = 19, scale = 2)
    private BigDecimal amountRefunded;

    @Column(name = "receipt_number", length = 64)
    private String receiptNumber;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Version
    @Column(nullable = false)
    private long version;

    @OneToMany(mappedBy = "sale", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("createdAt ASC")
    private List<SaleItemEntity> items = new ArrayList<>();

    public static SaleEntity open(UUID businessId, UUID storefrontId, UUID cashierId,
                                  UUID customerId, SaleType saleType, Instant now) {
        return new SaleEntity(
            UUID.randomUUID(),
            businessId,
            storefrontId,
            cashierId,
            customerId,
            saleType != null ? saleType : SaleType.RETAIL,
            SaleStatus.DRAFT,
            null,
            Money.ZERO,
            Money.ZERO,
            Money.ZERO,
            Money.ZERO,
            Money.ZERO,
            Money.ZERO,
            Money.ZERO,
            Money.ZERO,
            null,
            null,
            now,
            now,
            null,
            0L,
            new ArrayList<>()
        );
    }

    public List<SaleItemEntity> getItems() {
        return Collections.unmodifiableList(items);
    }

    public Optional<SaleItemEntity> findItem(UUID itemId) {
        return items.stream().filter(item -> item.getId().equals(itemId)).findFirst();
    }

    public List<UUID> getReservationIds() {
        return items.stream()
            .map(SaleItemEntity::getReservationId)
            .filter(id -> id != null)
            .toList();
    }

    public boolean hasItems() {
        return !items.isEmpty();
    }

    /**
     * Reservations for this cart are keyed by the sale id.
     */
    public String getCartSessionId() {
        return id.toString();
    }

    public boolean isCredit() {
        return paymentType != null && paymentType.isCredit();
    }

    /**
     * Amount that may still be refunded in money.
     */
    public BigDecimal getRefundableAmount() {
        return totalAmount.subtract(amountRefunded);
    }

    // ---- DRAFT operations ----

    public SaleItemEntity addItem(UUID productId, UUID stockLineId, UUID reservationId, int quantity,
                                  BigDecimal unitPrice, BigDecimal discountPercentage, BigDecimal taxRate,
                                  BigDecimal unitCost, Instant now) {
        requireDraft("add_item");
        SaleItemEntity item = SaleItemEntity.create(this, productId, stockLineId, reservationId,
            quantity, unitPrice, discountPercentage, taxRate, unitCost, now);
        items.add(item);
        recalculateTotals();
        touch(now);
        return item;
    }

    public SaleItemEntity removeItem(UUID itemId, Instant now) {
        requireDraft("remove_item");
        SaleItemEntity item = findItem(itemId)
            .orElseThrow(() -> new IllegalArgumentException("Item " + itemId + " is not part of sale " + id));
        items.remove(item);
        recalculateTotals();
        touch(now);
        return item;
    }

    /**
     * Switches the price list. Callers reprice each item afterwards via
     * {@link #repriceItem}.
     */
    public void changeType(SaleType newType, Instant now) {
        requireDraft("change_type");
        this.saleType = newType;
        touch(now);
    }

    public void repriceItem(UUID itemId, BigDecimal unitPrice, Instant now) {
        requireDraft("change_type");
        findItem(itemId)
            .orElseThrow(() -> new IllegalArgumentException("Item " + itemId + " is not part of sale " + id))
            .reprice(unitPrice);
        recalculateTotals();
        touch(now);
    }

    /**
     * Order-level discount, order tax and notes supplied at checkout.
     */
    public void applyCheckoutAdjustments(BigDecimal discount, BigDecimal orderTax, String notes, Instant now) {
        requireDraft("complete");
        this.discountAmount = Money.of(discount);
        this.orderTaxAmount = Money.of(orderTax);
        if (notes != null) {
            this.notes = notes;
        }
        recalculateTotals();
        touch(now);
    }

    public void chooseSettlement(PaymentType type, Instant now) {
        requireDraft("complete");
        this.paymentType = type;
        touch(now);
    }

    public void recalculateTotals() {
        SaleTotals totals = SaleTotals.compute(
            items.stream().map(SaleItemEntity::amounts).toList(),
            discountAmount,
            orderTaxAmount,
            amountPaid
        );
        this.subtotal = totals.getSubtotal();
        this.taxAmount = totals.getTaxAmount();
        this.totalAmount = totals.getTotalAmount();
        this.amountDue = totals.getAmountDue();
    }

    // ---- money movements ----

    /**
     * Adds a payment that the caller has already bounded by {@code amount_due}.
     */
    public void applyPayment(BigDecimal amount, Instant now) {
        BigDecimal value = Money.of(amount);
        if (value.signum() <= 0) {
            throw new IllegalArgumentException("Payment amount must be positive");
        }
        if (value.compareTo(amountDue) > 0) {
            throw new IllegalStateException(
                "Payment " + value + " exceeds amount due " + amountDue + " on sale " + id);
        }
        this.amountPaid = amountPaid.add(value);
        this.amountDue = Money.nonNegative(totalAmount.subtract(amountPaid));
        touch(now);
    }

    public void applyRefund(BigDecimal amount, Instant now) {
        BigDecimal value = Money.of(amount);
        BigDecimal newRefunded = amountRefunded.add(value);
        if (newRefunded.compareTo(amountPaid) > 0) {
            throw new IllegalStateException(
                "Refunded " + newRefunded + " would exceed paid " + amountPaid + " on sale " + id);
        }
        this.amountRefunded = newRefunded;
        touch(now);
    }

    // ---- transitions ----

    /**
     * DRAFT to its first settled status.
     */
    public void finalizeCompletion(String receiptNumber, Instant now) {
        requireDraft("complete");
        transitionTo(settledStatusForBalance(), "complete");
        this.receiptNumber = receiptNumber;
        this.completedAt = now;
        touch(now);
    }

    /**
     * Re-derives PENDING / PARTIAL / COMPLETED from the balance after money
     * moved on a settled sale.
     */
    public void reclassifyAfterPayment(Instant now) {
        SaleStatus next = settledStatusForBalance();
        if (next != status) {
            transitionTo(next, "record_payment");
        }
        touch(now);
    }

    public void markRefunded(Instant now) {
        transitionTo(SaleStatus.REFUNDED, "refund");
        touch(now);
    }

    public void abandon(Instant now) {
        if (status != SaleStatus.DRAFT) {
            throw new InvalidStateTransitionException(id, status, "abandon");
        }
        transitionTo(SaleStatus.CANCELLED, "abandon");
        touch(now);
    }

    public void cancel(Instant now) {
        if (!status.isCancellable()) {
            throw new InvalidStateTransitionException(id, status, "cancel");
        }
        transitionTo(SaleStatus.CANCELLED, "cancel");
        touch(now);
    }

    public void requireDraft(String operation) {
        if (status != SaleStatus.DRAFT) {
            throw new InvalidStateTransitionException(id, status, operation);
        }
    }

    private SaleStatus settledStatusForBalance() {
        if (amountDue.signum() == 0) {
            return SaleStatus.COMPLETED;
        }
        return amountPaid.signum() > 0 ? SaleStatus.PARTIAL : SaleStatus.PENDING;
    }

    private void transitionTo(SaleStatus target, String operation) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidStateTransitionException(id, status, operation,
                String.format("Cannot %s sale %s: %s -> %s is not allowed", operation, id, status, target));
        }
        this.status = target;
    }

    private void touch(Instant now) {
        this.updatedAt = now;
    }
}
