package com.flagship.pos_core.exception;

import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * One or more holds of a cart lapsed before commit. The sale stays DRAFT.
 */
public class ReservationExpiredException extends SaleOperationException {

    public ReservationExpiredException(String sessionId, Collection<UUID> reservationIds, Instant earliestExpiry) {
        super(String.format("Reservations for session %s are no longer active: %s",
                        sessionId, reservationIds),
                Map.of(
                        "session_id", sessionId,
                        "reservation_ids", reservationIds.stream()
                                .map(UUID::toString)
                                .collect(Collectors.joining(",")),
                        "expired_at", String.valueOf(earliestExpiry)));
    }

    @Override
    public String getCode() {
        return "RESERVATION_EXPIRED";
    }
}
