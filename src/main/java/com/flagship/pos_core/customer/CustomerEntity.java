package com.flagship.pos_core.customer;

import com.flagship.pos_core.sale.Money;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A customer's credit account. The outstanding balance changes only through
 * {@link CreditGuard}, which writes a {@link CreditTransactionEntity} for
 * every movement.
 */
@Entity
@Table(name = "customers")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CustomerEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "business_id", nullable = false, updatable = false)
    private UUID businessId;

    @Column(nullable = false)
    private String name;

    @Column(name = "credit_limit", nullable = false, precision = 19, scale = 2)
    private BigDecimal creditLimit;

    @Column(name = "outstanding_balance", nullable = false, precision = 19, scale = 2)
    private BigDecimal outstandingBalance;

    @Column(name = "credit_terms_days", nullable = false)
    private int creditTermsDays;

    @Column(name = "credit_blocked", nullable = false)
    private boolean creditBlocked;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(nullable = false)
    private long version;

    public static CustomerEntity register(UUID businessId, String name, BigDecimal creditLimit,
                                          int creditTermsDays, Instant now) {
        if (creditLimit == null || creditLimit.signum() < 0) {
            throw new IllegalArgumentException("Credit limit must be zero or positive");
        }
        return new CustomerEntity(
            UUID.randomUUID(),
            businessId,
            name,
            Money.of(creditLimit),
            Money.ZERO,
            creditTermsDays,
            false,
            now,
            now,
            0L
        );
    }

    public BigDecimal getAvailableCredit() {
        return creditLimit.subtract(outstandingBalance);
    }

    void charge(BigDecimal amount, Instant now) {
        this.outstandingBalance = outstandingBalance.add(Money.of(amount));
        this.updatedAt = now;
    }

    /**
     * Reduces the balance, never below zero.
     */
    void receivePayment(BigDecimal amount, Instant now) {
        this.outstandingBalance = Money.nonNegative(outstandingBalance.subtract(Money.of(amount)));
        this.updatedAt = now;
    }

    public void block(Instant now) {
        this.creditBlocked = true;
        this.updatedAt = now;
    }

    public void unblock(Instant now) {
        this.creditBlocked = false;
        this.updatedAt = now;
    }
}
