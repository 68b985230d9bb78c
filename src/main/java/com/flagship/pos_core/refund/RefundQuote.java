package com.flagship.pos_core.refund;

import com.flagship.pos_core.sale.SaleItemEntity;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Priced refund before anything is booked.
 */
@Value
public class RefundQuote {
    List<Line> lines;
    BigDecimal amount;
    boolean returnsEverything;

    @Value
    public static class Line {
        SaleItemEntity item;
        int quantity;
        BigDecimal amount;
    }
}
