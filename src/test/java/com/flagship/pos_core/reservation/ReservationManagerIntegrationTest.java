package com.flagship.pos_core.reservation;

import com.flagship.pos_core.exception.InsufficientStockException;
import com.flagship.pos_core.support.IntegrationTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.IllegalTransactionStateException;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Reservations against a real database: row locking, release and expiry.
 */
class ReservationManagerIntegrationTest extends IntegrationTestSupport {

    @Autowired
    private ReservationManager reservationManager;

    @Autowired
    private StockReservationRepository reservationRepository;

    private UUID businessId;
    private UUID stockLineId;

    @BeforeEach
    void setUp() {
        businessId = UUID.randomUUID();
        stockLineId = insertStockLine(businessId, UUID.randomUUID(), 5, "25.00", null);
    }

    @Test
    @DisplayName("Holds reduce availability until released")
    void reserveAndRelease() {
        printTestHeader("Reserve and Release");

        StockReservationEntity hold = reservationManager.reserve(businessId, stockLineId, 3, "cart-a");
        printOutput("Reservation", hold.getId());

        StockAvailability held = reservationManager.availability(businessId, stockLineId);
        assertEquals(5, held.getOnHand());
        assertEquals(3, held.getReserved());
        assertEquals(2, held.getAvailable());
        assertEquals(START.plus(Duration.ofMinutes(30)), hold.getExpiresAt());

        reservationManager.release(hold.getId());
        reservationManager.release(hold.getId());

        assertEquals(5, reservationManager.availability(businessId, stockLineId).getAvailable());
        assertEquals(ReservationStatus.RELEASED,
            reservationRepository.findById(hold.getId()).orElseThrow().getStatus());
        printSuccess("Released hold returned to the pool; second release was a no-op");
    }

    @Test
    void reservingMoreThanAvailableIsRejected() {
        reservationManager.reserve(businessId, stockLineId, 4, "cart-a");

        InsufficientStockException e = assertThrows(InsufficientStockException.class,
            () -> reservationManager.reserve(businessId, stockLineId, 2, "cart-b"));

        assertEquals("1", e.getDetails().get("available"));
        assertEquals(1, reservationManager.availability(businessId, stockLineId).getAvailable());
    }

    @Test
    @DisplayName("Two carts racing for the last unit: exactly one wins")
    void concurrentReservationsForLastUnit() throws Exception {
        printTestHeader("Concurrent Reservations - Last Unit");
        UUID lastUnitLine = insertStockLine(businessId, UUID.randomUUID(), 1, "10.00", null);

        int threads = 2;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch ready = new CountDownLatch(threads);
        CountDownLatch go = new CountDownLatch(1);
        AtomicInteger won = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();

        for (int i = 0; i < threads; i++) {
            String session = "race-" + i;
            executor.submit(() -> {
                ready.countDown();
                try {
                    go.await();
                    reservationManager.reserve(businessId, lastUnitLine, 1, session);
                    won.incrementAndGet();
                } catch (InsufficientStockException e) {
                    rejected.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }
        ready.await();
        go.countDown();
        executor.shutdown();
        assertTrue(executor.awaitTermination(30, TimeUnit.SECONDS));

        printOutput("Winners", won.get());
        printOutput("Rejected", rejected.get());
        assertEquals(1, won.get());
        assertEquals(1, rejected.get());
        assertEquals(0, reservationManager.availability(businessId, lastUnitLine).getAvailable());
        printSuccess("Row lock serialized the race");
    }

    @Test
    @DisplayName("A lapsed hold stops counting before the sweep and is marked EXPIRED by it")
    void lapsedHoldsFreeStock() {
        StockReservationEntity hold = reservationManager.reserve(businessId, stockLineId, 5, "cart-a");
        assertEquals(0, reservationManager.availability(businessId, stockLineId).getAvailable());

        clock.advance(Duration.ofMinutes(31));

        assertEquals(5, reservationManager.availability(businessId, stockLineId).getAvailable());
        assertEquals(ReservationStatus.ACTIVE,
            reservationRepository.findById(hold.getId()).orElseThrow().getStatus());

        int expired = reservationManager.sweep(clock.instant());

        assertTrue(expired >= 1);
        assertEquals(ReservationStatus.EXPIRED,
            reservationRepository.findById(hold.getId()).orElseThrow().getStatus());
        assertEquals(5, reservationManager.availability(businessId, stockLineId).getAvailable());
    }

    @Test
    void releaseForSessionReleasesEveryActiveHold() {
        reservationManager.reserve(businessId, stockLineId, 1, "cart-multi");
        reservationManager.reserve(businessId, stockLineId, 2, "cart-multi");
        reservationManager.reserve(businessId, stockLineId, 1, "cart-other");

        List<StockReservationEntity> released = reservationManager.releaseForSession("cart-multi");

        assertEquals(2, released.size());
        assertEquals(4, reservationManager.availability(businessId, stockLineId).getAvailable());
    }

    @Test
    void consumingRequiresTheCompletionTransaction() {
        StockReservationEntity hold = reservationManager.reserve(businessId, stockLineId, 1, "cart-a");

        assertThrows(IllegalTransactionStateException.class,
            () -> reservationManager.consumeForSale("cart-a", List.of(hold.getId())));
    }
}
