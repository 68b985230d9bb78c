package com.flagship.pos_core.health;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness probe. Reports DOWN (503) only when the database is unreachable,
 * since no sale operation can run without it. Kafka and Redis outages are
 * visible on the actuator health endpoint instead.
 */
@RestController
public class HealthController {

    private final DataSource dataSource;
    private final Clock clock;

    public HealthController(DataSource dataSource, Clock clock) {
        this.dataSource = dataSource;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        boolean dbHealthy = checkDatabase();

        response.put("status", dbHealthy ? "UP" : "DOWN");
        response.put("timestamp", clock.instant().toString());
        response.put("database", dbHealthy ? "UP" : "DOWN");

        return dbHealthy
            ? ResponseEntity.ok(response)
            : ResponseEntity.status(503).body(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (SQLException e) {
            return false;
        }
    }
}
