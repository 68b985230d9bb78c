package com.flagship.pos_core.reservation;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.UUID;

/**
 * Point-in-time view of a stock line: what is on hand, what carts hold,
 * and what can still be reserved.
 */
@Value
public class StockAvailability {

    @JsonProperty("stock_line_id")
    UUID stockLineId;

    @JsonProperty("on_hand")
    int onHand;

    @JsonProperty("reserved")
    int reserved;

    @JsonProperty("available")
    int available;

    public static StockAvailability of(UUID stockLineId, int onHand, long reserved) {
        int held = (int) reserved;
        return new StockAvailability(stockLineId, onHand, held, Math.max(onHand - held, 0));
    }
}
