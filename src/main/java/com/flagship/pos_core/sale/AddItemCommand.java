package com.flagship.pos_core.sale;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Line to ring up. A null unit price is resolved from the stock line by
 * sale type; a null product id is taken from the stock line.
 */
@Value
@Builder
public class AddItemCommand {
    UUID productId;
    UUID stockLineId;
    int quantity;
    BigDecimal unitPrice;
    BigDecimal discountPercentage;
    BigDecimal taxRate;
}
