package com.flagship.pos_core.inventory;

import com.flagship.pos_core.exception.InsufficientStockException;
import com.flagship.pos_core.exception.ResourceNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Stock ledger over the inventory tables, using JDBC directly.
 *
 * Decrements are conditional updates ({@code quantity >= ?}) so the database
 * refuses to go negative even if a caller skipped the availability check.
 * Write methods must join the caller's transaction.
 */
@Service
@Slf4j
public class JdbcStockLedger implements StockLedger {

    private static final String STOCK_LINE = "stock_line";
    private static final String STOREFRONT_INVENTORY = "storefront_inventory";

    private final JdbcTemplate jdbcTemplate;

    public JdbcStockLedger(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<StockLine> findStockLine(UUID businessId, UUID stockLineId) {
        List<StockLine> lines = jdbcTemplate.query(
            "SELECT id, business_id, product_id, quantity, unit_cost, retail_price, wholesale_price " +
            "FROM stock_lines WHERE id = ? AND business_id = ?",
            stockLineRowMapper(),
            stockLineId,
            businessId
        );
        return lines.stream().findFirst();
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public int lockStockLine(UUID stockLineId) {
        try {
            Integer onHand = jdbcTemplate.queryForObject(
                "SELECT quantity FROM stock_lines WHERE id = ? FOR UPDATE",
                Integer.class,
                stockLineId
            );
            return onHand != null ? onHand : 0;
        } catch (EmptyResultDataAccessException e) {
            throw new ResourceNotFoundException("Stock line", stockLineId);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public int getAvailableQuantity(UUID storefrontId, UUID productId) {
        List<Integer> quantities = jdbcTemplate.queryForList(
            "SELECT quantity FROM storefront_inventory WHERE storefront_id = ? AND product_id = ?",
            Integer.class,
            storefrontId,
            productId
        );
        return quantities.isEmpty() || quantities.get(0) == null ? 0 : quantities.get(0);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void decrement(UUID storefrontId, UUID productId, int quantity) {
        int updated = jdbcTemplate.update(
            "UPDATE storefront_inventory SET quantity = quantity - ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE storefront_id = ? AND product_id = ? AND quantity >= ?",
            quantity,
            storefrontId,
            productId,
            quantity
        );
        if (updated == 0) {
            int available = getAvailableQuantity(storefrontId, productId);
            throw new InsufficientStockException(STOREFRONT_INVENTORY, productId, available, quantity);
        }
        log.debug("Decremented storefront {} product {} by {}", storefrontId, productId, quantity);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void consumeStockLine(UUID stockLineId, int quantity) {
        int updated = jdbcTemplate.update(
            "UPDATE stock_lines SET quantity = quantity - ? WHERE id = ? AND quantity >= ?",
            quantity,
            stockLineId,
            quantity
        );
        if (updated == 0) {
            Integer onHand = jdbcTemplate.queryForObject(
                "SELECT COALESCE(MAX(quantity), 0) FROM stock_lines WHERE id = ?",
                Integer.class,
                stockLineId
            );
            throw new InsufficientStockException(STOCK_LINE, stockLineId, onHand != null ? onHand : 0, quantity);
        }
        log.debug("Consumed {} units of stock line {}", quantity, stockLineId);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void restock(UUID storefrontId, UUID productId, UUID stockLineId, int quantity) {
        jdbcTemplate.update(
            "INSERT INTO storefront_inventory (storefront_id, product_id, quantity, updated_at) " +
            "VALUES (?, ?, ?, CURRENT_TIMESTAMP) " +
            "ON CONFLICT (storefront_id, product_id) " +
            "DO UPDATE SET quantity = storefront_inventory.quantity + EXCLUDED.quantity, updated_at = CURRENT_TIMESTAMP",
            storefrontId,
            productId,
            quantity
        );
        int updated = jdbcTemplate.update(
            "UPDATE stock_lines SET quantity = quantity + ? WHERE id = ?",
            quantity,
            stockLineId
        );
        if (updated == 0) {
            throw new ResourceNotFoundException("Stock line", stockLineId);
        }
        log.debug("Restocked {} units of product {} to storefront {} (stock line {})",
                quantity, productId, storefrontId, stockLineId);
    }

    private RowMapper<StockLine> stockLineRowMapper() {
        return (rs, rowNum) -> new StockLine(
            UUID.fromString(rs.getString("id")),
            UUID.fromString(rs.getString("business_id")),
            UUID.fromString(rs.getString("product_id")),
            rs.getInt("quantity"),
            rs.getBigDecimal("unit_cost"),
            rs.getBigDecimal("retail_price"),
            rs.getBigDecimal("wholesale_price")
        );
    }
}
