package com.flagship.pos_core.reservation;

import com.flagship.pos_core.config.PosProperties;
import com.flagship.pos_core.exception.InsufficientStockException;
import com.flagship.pos_core.exception.ReservationExpiredException;
import com.flagship.pos_core.exception.ResourceNotFoundException;
import com.flagship.pos_core.inventory.StockLedger;
import com.flagship.pos_core.inventory.StockLine;
import com.flagship.pos_core.observability.SaleMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Time-boxed holds against stock line availability, keyed by cart session.
 *
 * available = on_hand - sum(ACTIVE holds that have not lapsed)
 *
 * Every decision that reads availability and then writes a hold runs while
 * holding the stock line row lock, so two carts racing for the last unit
 * are serialized and only one of them wins.
 *
 * Lapsed holds stop counting immediately (the availability query filters on
 * expires_at); the scheduled sweep only makes their status explicit. Both
 * paths give the same visible availability.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReservationManager {

    private static final String STOCK_LINE = "stock_line";

    private final StockReservationRepository repository;
    private final StockLedger stockLedger;
    private final PosProperties properties;
    private final SaleMetrics saleMetrics;
    private final Clock clock;

    /**
     * Reserves with the configured default TTL.
     */
    @Transactional
    public StockReservationEntity reserve(UUID businessId, UUID stockLineId, int quantity, String sessionId) {
        return reserve(businessId, stockLineId, quantity, sessionId, properties.getReservations().getTtl());
    }

    /**
     * Places a hold on a stock line for a cart session.
     *
     * @throws InsufficientStockException if quantity exceeds what is unreserved
     */
    @Transactional
    public StockReservationEntity reserve(UUID businessId, UUID stockLineId, int quantity,
                                          String sessionId, Duration ttl) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Reservation quantity must be positive");
        }
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("Cart session ID is required");
        }

        int onHand = stockLedger.lockStockLine(stockLineId);
        Instant now = clock.instant();
        long held = repository.sumHeldQuantity(stockLineId, now);
        long available = onHand - held;

        if (quantity > available) {
            saleMetrics.recordReservation("insufficient_stock");
            log.warn("Reservation rejected: stockLineId={}, onHand={}, held={}, requested={}, session={}",
                    stockLineId, onHand, held, quantity, sessionId);
            throw new InsufficientStockException(STOCK_LINE, stockLineId, (int) Math.max(available, 0), quantity);
        }

        StockReservationEntity saved = repository.save(
            StockReservationEntity.hold(businessId, stockLineId, quantity, sessionId, now, ttl));
        saleMetrics.recordReservation("success");

        log.info("Reserved {} units of stock line {} for session {} until {}",
                quantity, stockLineId, sessionId, saved.getExpiresAt());
        return saved;
    }

    /**
     * Gives a hold back to the pool. Releasing a hold that already ended
     * (released or expired) is a no-op.
     */
    @Transactional
    public void release(UUID reservationId) {
        StockReservationEntity reservation = repository.findByIdForUpdate(reservationId)
            .orElseThrow(() -> new ResourceNotFoundException("Reservation", reservationId));

        switch (reservation.getStatus()) {
            case ACTIVE -> {
                reservation.release(clock.instant());
                log.info("Released reservation {} ({} units of stock line {})",
                        reservationId, reservation.getQuantity(), reservation.getStockLineId());
            }
            case RELEASED, EXPIRED -> log.debug("Reservation {} already {}, nothing to release",
                    reservationId, reservation.getStatus());
            case CONSUMED -> throw new IllegalStateException(
                "Reservation " + reservationId + " was consumed by a completed sale and cannot be released");
        }
    }

    /**
     * Releases every active hold of a cart, e.g. when the cart is abandoned.
     *
     * @return the holds that were released
     */
    @Transactional
    public List<StockReservationEntity> releaseForSession(String sessionId) {
        Instant now = clock.instant();
        List<StockReservationEntity> active = repository.findActiveBySessionForUpdate(sessionId);
        active.forEach(reservation -> reservation.release(now));
        if (!active.isEmpty()) {
            log.info("Released {} reservations for session {}", active.size(), sessionId);
        }
        return active;
    }

    /**
     * Marks lapsed ACTIVE holds EXPIRED.
     *
     * @return number of holds expired
     */
    @Transactional
    public int sweep(Instant now) {
        int expired = repository.expireLapsed(now);
        if (expired > 0) {
            saleMetrics.recordReservationsExpired(expired);
            log.info("Expired {} lapsed reservations", expired);
        }
        return expired;
    }

    /**
     * Converts the holds of a cart into consumed stock.
     *
     * Validation happens before any hold is touched: if one expected hold is
     * no longer ACTIVE, or has lapsed at this instant, nothing is consumed and
     * the whole completion must fail.
     *
     * @param sessionId cart session
     * @param expectedReservationIds holds the sale's items were created with
     * @return the consumed holds
     * @throws ReservationExpiredException if any expected hold is not usable
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public List<StockReservationEntity> consumeForSale(String sessionId, Collection<UUID> expectedReservationIds) {
        Instant now = clock.instant();
        List<StockReservationEntity> active = repository.findActiveBySessionForUpdate(sessionId);

        Set<UUID> unusable = new LinkedHashSet<>(expectedReservationIds);
        List<StockReservationEntity> consumable = new ArrayList<>();
        List<StockReservationEntity> lapsed = new ArrayList<>();

        for (StockReservationEntity reservation : active) {
            if (!expectedReservationIds.contains(reservation.getId())) {
                continue;
            }
            if (reservation.isHolding(now)) {
                unusable.remove(reservation.getId());
                consumable.add(reservation);
            } else {
                lapsed.add(reservation);
            }
        }

        if (!unusable.isEmpty()) {
            Instant earliestExpiry = repository.findAllById(unusable).stream()
                .map(StockReservationEntity::getExpiresAt)
                .min(Comparator.naturalOrder())
                .orElse(null);
            log.warn("Cannot consume reservations for session {}: unusable={}, lapsed={}",
                    sessionId, unusable, lapsed.size());
            throw new ReservationExpiredException(sessionId, unusable, earliestExpiry);
        }

        consumable.forEach(reservation -> reservation.consume(now));
        log.debug("Consumed {} reservations for session {}", consumable.size(), sessionId);
        return consumable;
    }

    @Transactional(readOnly = true)
    public StockAvailability availability(UUID businessId, UUID stockLineId) {
        StockLine line = stockLedger.findStockLine(businessId, stockLineId)
            .orElseThrow(() -> new ResourceNotFoundException("Stock line", stockLineId));
        long held = repository.sumHeldQuantity(stockLineId, clock.instant());
        return StockAvailability.of(stockLineId, line.getQuantity(), held);
    }
}
