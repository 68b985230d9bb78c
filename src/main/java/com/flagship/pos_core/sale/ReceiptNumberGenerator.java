package com.flagship.pos_core.sale;

import com.flagship.pos_core.config.PosProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * Receipt numbers of the form {@code RCP-20240301-000042}.
 *
 * The counter is one row per business, incremented with an upsert that
 * returns the new value. The row stays locked until the completing
 * transaction ends, so numbers are unique per business and a rolled back
 * completion gives its number back.
 */
@Component
@RequiredArgsConstructor
public class ReceiptNumberGenerator {

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);

    private final JdbcTemplate jdbcTemplate;
    private final PosProperties properties;

    @Transactional(propagation = Propagation.MANDATORY)
    public String next(UUID businessId, Instant now) {
        Long value = jdbcTemplate.queryForObject(
            "INSERT INTO receipt_sequences (business_id, last_value) VALUES (?, 1) " +
            "ON CONFLICT (business_id) DO UPDATE SET last_value = receipt_sequences.last_value + 1 " +
            "RETURNING last_value",
            Long.class,
            businessId
        );
        return format(properties.getReceipts().getPrefix(), now, value != null ? value : 1L);
    }

    static String format(String prefix, Instant now, long sequence) {
        return String.format("%s-%s-%06d", prefix, DATE.format(now), sequence);
    }
}
