package com.flagship.pos_core.sale;

import com.flagship.pos_core.exception.OverrefundRejectedException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One product line of a sale, bound to the stock line and reservation it
 * was rung up against.
 *
 * Price and rates are rounded to cents before any amount is derived from
 * them, so the stored line always recomputes to the same amounts. Amounts are
 * recomputed whenever the line is priced. After the sale leaves DRAFT only {@code refundedQuantity} moves.
 */
@Entity
@Table(name = "sale_items")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SaleItemEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "sale_id", nullable = false, updatable = false)
    private SaleEntity sale;

    @Column(name = "product_id", nullable = false, updatable = false)
    private UUID productId;

    @Column(name = "stock_line_id", nullable = false, updatable = false)
    private UUID stockLineId;

    @Column(name = "reservation_id", updatable = false)
    private UUID reservationId;

    @Column(nullable = false, updatable = false)
    private int quantity;

    @Column(name = "unit_price", nullable = false, precision = 19, scale = 2)
    private BigDecimal unitPrice;

    @Column(name = "discount_percentage", nullable = false, precision = 5, scale = 2)
    private BigDecimal discountPercentage;

    @Column(name = "tax_rate", nullable = false, precision = 5, scale = 2)
    private BigDecimal taxRate;

    @Column(name = "unit_cost", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal unitCost;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal subtotal;

    @Column(name = "tax_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal taxAmount;

    @Column(name = "total_price", nullable = false, precision = 19, scale = 2)
    private BigDecimal totalPrice;

    @Column(name = "refunded_quantity", nullable = false)
    private int refundedQuantity;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static SaleItemEntity create(SaleEntity sale, UUID productId, UUID stockLineId, UUID reservationId,
                                 int quantity, BigDecimal unitPrice, BigDecimal discountPercentage,
                                 BigDecimal taxRate, BigDecimal unitCost, Instant now) {
        BigDecimal price = unitPrice != null ? Money.of(unitPrice) : null;
        BigDecimal discountPct = Money.of(discountPercentage);
        BigDecimal rate = Money.of(taxRate);
        LineAmounts amounts = LineAmounts.compute(price, quantity, discountPct, rate);

        return new SaleItemEntity(
            UUID.randomUUID(),
            sale,
            productId,
            stockLineId,
            reservationId,
            quantity,
            price,
            discountPct,
            rate,
            Money.of(unitCost),
            amounts.getSubtotal(),
            amounts.getTaxAmount(),
            amounts.getTotalPrice(),
            0,
            now
        );
    }

    public LineAmounts amounts() {
        return LineAmounts.compute(unitPrice, quantity, discountPercentage, taxRate);
    }

    public int getRefundableQuantity() {
        return quantity - refundedQuantity;
    }

    /**
     * Line discount ({@code unit_price * quantity - subtotal}).
     */
    public BigDecimal getDiscountAmount() {
        return amounts().getDiscount();
    }

    void reprice(BigDecimal newUnitPrice) {
        BigDecimal price = newUnitPrice != null ? Money.of(newUnitPrice) : null;
        LineAmounts amounts = LineAmounts.compute(price, quantity, discountPercentage, taxRate);
        this.unitPrice = price;
        this.subtotal = amounts.getSubtotal();
        this.taxAmount = amounts.getTaxAmount();
        this.totalPrice = amounts.getTotalPrice();
    }

    /**
     * @throws OverrefundRejectedException if more units are returned than remain
     */
    public void recordRefund(int refundQuantity) {
        if (refundQuantity <= 0) {
            throw new IllegalArgumentException("Refund quantity must be positive");
        }
        if (refundQuantity > getRefundableQuantity()) {
            throw OverrefundRejectedException.forQuantity(id, getRefundableQuantity(), refundQuantity);
        }
        this.refundedQuantity += refundQuantity;
    }
}
