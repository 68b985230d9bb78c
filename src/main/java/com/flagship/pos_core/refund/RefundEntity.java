package com.flagship.pos_core.refund;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * A processed return. {@code amount = offsetAmount + cashAmount}: the offset
 * part settled unpaid balance, the cash part went back to the customer.
 */
@Entity
@Table(name = "refunds")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RefundEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "business_id", nullable = false, updatable = false)
    private UUID businessId;

    @Column(name = "sale_id", nullable = false, updatable = false)
    private UUID saleId;

    @Enumerated(EnumType.STRING)
    @Column(name = "refund_type", nullable = false, length = 20)
    private RefundType refundType;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(name = "offset_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal offsetAmount;

    @Column(name = "cash_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal cashAmount;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String reason;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RefundStatus status;

    @Column(name = "processed_by")
    private UUID processedBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @OneToMany(mappedBy = "refund", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<RefundItemEntity> items = new ArrayList<>();

    static RefundEntity processed(UUID id, UUID businessId, UUID saleId, RefundType type, BigDecimal amount,
                                  BigDecimal offsetAmount, String reason, UUID processedBy, Instant now) {
        return new RefundEntity(
            id,
            businessId,
            saleId,
            type,
            amount,
            offsetAmount,
            amount.subtract(offsetAmount),
            reason,
            RefundStatus.PROCESSED,
            processedBy,
            now,
            new ArrayList<>()
        );
    }

    void addItem(UUID saleItemId, int quantity, BigDecimal amount) {
        items.add(RefundItemEntity.of(this, saleItemId, quantity, amount));
    }

    public List<RefundItemEntity> getItems() {
        return Collections.unmodifiableList(items);
    }
}
