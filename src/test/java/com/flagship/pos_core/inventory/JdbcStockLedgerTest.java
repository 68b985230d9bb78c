package com.flagship.pos_core.inventory;

import com.flagship.pos_core.exception.InsufficientStockException;
import com.flagship.pos_core.support.IntegrationTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JdbcStockLedgerTest extends IntegrationTestSupport {

    @Autowired
    private StockLedger stockLedger;

    @Autowired
    private TransactionTemplate transactionTemplate;

    private UUID businessId;
    private UUID storefrontId;
    private UUID productId;
    private UUID stockLineId;

    @BeforeEach
    void setUp() {
        businessId = UUID.randomUUID();
        storefrontId = UUID.randomUUID();
        productId = UUID.randomUUID();
        stockLineId = insertStockLine(businessId, productId, 10, "25.00", "20.00");
        stockStorefront(storefrontId, productId, 6);
    }

    @Test
    @DisplayName("Stock lines are only visible to their own business")
    void findStockLineIsTenantScoped() {
        printTestHeader("Find Stock Line");

        Optional<StockLine> line = stockLedger.findStockLine(businessId, stockLineId);
        printOutput("Stock line", line);

        assertTrue(line.isPresent());
        assertEquals(productId, line.get().getProductId());
        assertEquals(10, line.get().getQuantity());
        assertEquals(0, new BigDecimal("20.00").compareTo(line.get().getWholesalePrice()));
        assertTrue(stockLedger.findStockLine(UUID.randomUUID(), stockLineId).isEmpty());

        printSuccess("Other businesses cannot see the stock line");
    }

    @Test
    @DisplayName("Decrement never takes the storefront pool below zero")
    void decrementRefusesToGoNegative() {
        printTestHeader("Decrement Beyond Pool");

        InsufficientStockException e = assertThrows(InsufficientStockException.class,
            () -> transactionTemplate.executeWithoutResult(status -> stockLedger.decrement(storefrontId, productId, 7)));
        printOutput("Error", e.getMessage());

        assertEquals(6, e.getAvailable());
        assertEquals(7, e.getRequested());
        assertEquals(6, storefrontQuantity(storefrontId, productId));

        transactionTemplate.executeWithoutResult(status -> stockLedger.decrement(storefrontId, productId, 6));
        assertEquals(0, stockLedger.getAvailableQuantity(storefrontId, productId));

        printSuccess("Pool drained to exactly zero and no further");
    }

    @Test
    @DisplayName("Consuming a stock line checks its on-hand quantity")
    void consumeStockLine() {
        printTestHeader("Consume Stock Line");

        transactionTemplate.executeWithoutResult(status -> stockLedger.consumeStockLine(stockLineId, 4));
        assertEquals(6, stockLineQuantity(stockLineId));

        InsufficientStockException e = assertThrows(InsufficientStockException.class,
            () -> transactionTemplate.executeWithoutResult(status -> stockLedger.consumeStockLine(stockLineId, 7)));
        assertEquals(6, e.getAvailable());
        assertEquals(6, stockLineQuantity(stockLineId));

        printSuccess("Stock line consumed within its quantity");
    }

    @Test
    @DisplayName("Restock returns units to both the pool and the stock line")
    void restockBothSides() {
        printTestHeader("Restock");
        UUID otherStorefront = UUID.randomUUID();

        transactionTemplate.executeWithoutResult(status -> {
            stockLedger.restock(storefrontId, productId, stockLineId, 2);
            stockLedger.restock(otherStorefront, productId, stockLineId, 1);
        });

        assertEquals(8, storefrontQuantity(storefrontId, productId));
        assertEquals(1, storefrontQuantity(otherStorefront, productId));
        assertEquals(13, stockLineQuantity(stockLineId));

        printSuccess("Refunded units back on the shelf");
    }

    @Test
    @DisplayName("Writes must join an existing transaction")
    void writesRequireTransaction() {
        printTestHeader("Write Without Transaction");

        assertThrows(IllegalTransactionStateException.class,
            () -> stockLedger.decrement(storefrontId, productId, 1));
        assertThrows(IllegalTransactionStateException.class,
            () -> stockLedger.lockStockLine(stockLineId));
        assertEquals(6, storefrontQuantity(storefrontId, productId));

        printSuccess("No stock moved outside a transaction");
    }
}
