package com.flagship.pos_core.sale;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ReceiptNumberGeneratorTest {

    @Test
    void formatsPrefixUtcDateAndZeroPaddedSequence() {
        Instant now = Instant.parse("2024-03-01T23:30:00Z");

        assertEquals("RCP-20240301-000042", ReceiptNumberGenerator.format("RCP", now, 42));
        assertEquals("SHOP-20240301-1234567", ReceiptNumberGenerator.format("SHOP", now, 1_234_567));
    }
}
