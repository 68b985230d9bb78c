package com.flagship.pos_core.inventory;

import com.flagship.pos_core.sale.SaleType;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A specific receipt of a product at a specific cost and price.
 * Read from the inventory service's tables.
 */
@Value
public class StockLine {
    UUID id;
    UUID businessId;
    UUID productId;
    int quantity;
    BigDecimal unitCost;
    BigDecimal retailPrice;
    BigDecimal wholesalePrice;

    /**
     * Selling price for the given sale type. Wholesale falls back to retail
     * when no wholesale price is set.
     */
    public BigDecimal priceFor(SaleType saleType) {
        if (saleType == SaleType.WHOLESALE
                && wholesalePrice != null
                && wholesalePrice.compareTo(BigDecimal.ZERO) > 0) {
            return wholesalePrice;
        }
        return retailPrice;
    }
}
