package com.flagship.property_acquisition.health;

import com.flagship.property_acquisition.outbox.OutboxService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Simple health check endpoint for liveness/readiness probes.
 * Only the database decides UP or DOWN; the outbox backlog is reported for information.
 */
@RestController
@Slf4j
public class HealthController {

    private final DataSource dataSource;
    private final OutboxService outboxService;

    public HealthController(DataSource dataSource, OutboxService outboxService) {
        this.dataSource = dataSource;
        this.outboxService = outboxService;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");

        if (!dbHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        response.put("outboxBacklog", outboxService.countUnpublished());
        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }
}
