package com.flagship.pos_core.reservation;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequiredArgsConstructor
public class StockAvailabilityController {

    private final ReservationManager reservationManager;

    @GetMapping("/api/stock-lines/{id}/availability")
    public ResponseEntity<StockAvailability> getAvailability(
            @RequestHeader("X-Business-Id") UUID businessId,
            @PathVariable("id") UUID id) {
        return ResponseEntity.ok(reservationManager.availability(businessId, id));
    }
}
