package com.flagship.pos_core.reservation;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * A time-boxed hold of stock line quantity for one cart session.
 *
 * No setters: status only moves through {@link #release}, {@link #consume}
 * and {@link #expire}, each of which refuses to leave a terminal state.
 */
@Entity
@Table(
    name = "stock_reservations",
    indexes = {
        @Index(name = "idx_reservations_stock_line_status", columnList = "stock_line_id, status"),
        @Index(name = "idx_reservations_session_status", columnList = "cart_session_id, status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class StockReservationEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "business_id", nullable = false, updatable = false)
    private UUID businessId;

    @Column(name = "stock_line_id", nullable = false, updatable = false)
    private UUID stockLineId;

    @Column(nullable = false, updatable = false)
    private int quantity;

    @Column(name = "cart_session_id", nullable = false, updatable = false, length = 64)
    private String cartSessionId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ReservationStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private Instant expiresAt;

    @Column(name = "released_at")
    private Instant releasedAt;

    public static StockReservationEntity hold(UUID businessId, UUID stockLineId, int quantity,
                                              String cartSessionId, Instant now, Duration ttl) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Reservation quantity must be positive");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Reservation TTL must be positive");
        }
        return new StockReservationEntity(
            UUID.randomUUID(),
            businessId,
            stockLineId,
            quantity,
            cartSessionId,
            ReservationStatus.ACTIVE,
            now,
            now.plus(ttl),
            null
        );
    }

    /**
     * ACTIVE and not past its expiry at the given instant.
     */
    public boolean isHolding(Instant now) {
        return status == ReservationStatus.ACTIVE && !now.isAfter(expiresAt);
    }

    public boolean isLapsed(Instant now) {
        return status == ReservationStatus.ACTIVE && now.isAfter(expiresAt);
    }

    void release(Instant now) {
        requireActive("release");
        this.status = ReservationStatus.RELEASED;
        this.releasedAt = now;
    }

    void consume(Instant now) {
        if (!isHolding(now)) {
            throw new IllegalStateException(
                String.format("Cannot consume reservation %s in %s status (expires_at=%s)",
                    id, status, expiresAt));
        }
        this.status = ReservationStatus.CONSUMED;
    }

    private void requireActive(String operation) {
        if (status != ReservationStatus.ACTIVE) {
            throw new IllegalStateException(
                String.format("Cannot %s reservation %s in %s status", operation, id, status));
        }
    }
}
