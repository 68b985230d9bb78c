package com.flagship.pos_core.refund;

import lombok.Value;

import java.util.UUID;

/**
 * Units of one sale item being returned.
 */
@Value
public class RefundLine {
    UUID saleItemId;
    int quantity;
}
