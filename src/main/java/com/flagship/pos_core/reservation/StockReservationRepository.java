package com.flagship.pos_core.reservation;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface StockReservationRepository extends JpaRepository<StockReservationEntity, UUID> {

    /**
     * Quantity currently held on a stock line. Lapsed holds that the sweeper
     * has not reached yet are already excluded here.
     */
    @Query("""
        SELECT COALESCE(SUM(r.quantity), 0) FROM StockReservationEntity r
        WHERE r.stockLineId = :stockLineId
          AND r.status = com.flagship.pos_core.reservation.ReservationStatus.ACTIVE
          AND r.expiresAt >= :now
        """)
    long sumHeldQuantity(@Param("stockLineId") UUID stockLineId, @Param("now") Instant now);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
        SELECT r FROM StockReservationEntity r
        WHERE r.cartSessionId = :sessionId
          AND r.status = com.flagship.pos_core.reservation.ReservationStatus.ACTIVE
        ORDER BY r.createdAt ASC
        """)
    List<StockReservationEntity> findActiveBySessionForUpdate(@Param("sessionId") String sessionId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM StockReservationEntity r WHERE r.id = :id")
    Optional<StockReservationEntity> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Bulk transition of lapsed holds. Returns the number of rows expired.
     */
    @Modifying
    @Query("""
        UPDATE StockReservationEntity r
        SET r.status = com.flagship.pos_core.reservation.ReservationStatus.EXPIRED, r.releasedAt = :now
        WHERE r.status = com.flagship.pos_core.reservation.ReservationStatus.ACTIVE
          AND r.expiresAt < :now
        """)
    int expireLapsed(@Param("now") Instant now);

    @Query("""
        SELECT COUNT(r) FROM StockReservationEntity r
        WHERE r.status = com.flagship.pos_core.reservation.ReservationStatus.ACTIVE
          AND r.expiresAt < :now
        """)
    long countLapsed(@Param("now") Instant now);
}
