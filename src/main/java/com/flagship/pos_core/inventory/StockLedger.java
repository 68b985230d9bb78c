package com.flagship.pos_core.inventory;

import java.util.Optional;
import java.util.UUID;

/**
 * Boundary to the inventory system of record.
 *
 * The core never owns stock quantities. It locks a stock line while deciding
 * on a reservation, checks and decrements the storefront pool at commit, and
 * puts quantities back when goods are returned.
 */
public interface StockLedger {

    Optional<StockLine> findStockLine(UUID businessId, UUID stockLineId);

    /**
     * Locks the stock line row until the surrounding transaction ends and
     * returns its on-hand quantity. All reservation decisions for one stock
     * line are serialized through this lock.
     */
    int lockStockLine(UUID stockLineId);

    /**
     * Quantity of a product held by a storefront.
     */
    int getAvailableQuantity(UUID storefrontId, UUID productId);

    /**
     * Removes sold units from the storefront pool.
     *
     * @throws com.flagship.pos_core.exception.InsufficientStockException if the pool holds less than qty
     */
    void decrement(UUID storefrontId, UUID productId, int quantity);

    /**
     * Removes sold units from the stock line's on-hand quantity.
     *
     * @throws com.flagship.pos_core.exception.InsufficientStockException if on-hand is less than qty
     */
    void consumeStockLine(UUID stockLineId, int quantity);

    /**
     * Returns refunded units to both the storefront pool and the stock line.
     */
    void restock(UUID storefrontId, UUID productId, UUID stockLineId, int quantity);
}
