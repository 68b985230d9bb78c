package com.flagship.pos_core.reservation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Background pass that releases abandoned carts' stock without caller action.
 *
 * Disable with pos.reservations.sweeper-enabled=false (tests drive
 * {@link ReservationManager#sweep} directly).
 */
@Component
@ConditionalOnProperty(name = "pos.reservations.sweeper-enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ReservationSweeper {

    private final ReservationManager reservationManager;
    private final Clock clock;

    @Scheduled(fixedRateString = "${pos.reservations.sweep-interval-ms:60000}")
    public void sweepExpiredReservations() {
        try {
            reservationManager.sweep(clock.instant());
        } catch (Exception e) {
            log.error("Error while sweeping expired reservations", e);
        }
    }
}
