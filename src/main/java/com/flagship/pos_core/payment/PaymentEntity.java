package com.flagship.pos_core.payment;

import com.flagship.pos_core.sale.Money;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Money received against a sale. Rows are never updated; the sum of
 * SUCCESSFUL payments of a sale equals its amount_paid.
 *
 * The idempotency key is unique within a business, so a retried request can
 * never book the same payment twice and tenants never see each other's keys.
 */
@Entity
@Immutable
@Table(name = "payments")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PaymentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "business_id", nullable = false)
    private UUID businessId;

    @Column(name = "sale_id", nullable = false)
    private UUID saleId;

    @Column(name = "amount_paid", nullable = false, precision = 19, scale = 2)
    private BigDecimal amountPaid;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", nullable = false, length = 20)
    private PaymentMethod paymentMethod;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentStatus status;

    @Column(length = 100)
    private String reference;

    @Column(name = "idempotency_key")
    private String idempotencyKey;

    @Column(name = "processed_by")
    private UUID processedBy;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    static PaymentEntity successful(UUID businessId, UUID saleId, BigDecimal amount, PaymentMethod method,
                                    String reference, String idempotencyKey, UUID processedBy, Instant now) {
        return new PaymentEntity(
            UUID.randomUUID(),
            businessId,
            saleId,
            Money.of(amount),
            method,
            PaymentStatus.SUCCESSFUL,
            reference,
            idempotencyKey,
            processedBy,
            now
        );
    }
}
