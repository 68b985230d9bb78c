package com.flagship.pos_core.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed configuration for the transaction core.
 *
 * Every default lives here and nowhere else:
 * - reservations hold stock for 30 minutes
 * - expired holds are swept every 60 seconds
 * - receipts are numbered RCP-yyyyMMdd-NNNNNN
 * - sale events go to the pos.sales.events topic
 */
@Data
@Validated
@ConfigurationProperties(prefix = "pos")
public class PosProperties {

    private Reservations reservations = new Reservations();
    private Receipts receipts = new Receipts();
    private Kafka kafka = new Kafka();

    @Getter
    @Setter
    public static class Reservations {
        @NotNull
        private Duration ttl = Duration.ofMinutes(30);
        private long sweepIntervalMs = 60_000;
        private boolean sweeperEnabled = true;
    }

    @Getter
    @Setter
    public static class Receipts {
        @NotBlank
        private String prefix = "RCP";
    }

    @Getter
    @Setter
    public static class Kafka {
        @NotBlank
        private String topic = "pos.sales.events";
    }
}
