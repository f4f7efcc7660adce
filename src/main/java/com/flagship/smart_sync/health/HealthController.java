package com.flagship.smart_sync.health;

import com.flagship.smart_sync.rail.RailRegistry;
import com.flagship.smart_sync.rail.RailSyncService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness probe. Unlike the Actuator health endpoint, this does not require
 * authorization and reports only what the service needs to serve reads.
 */
@RestController
public class HealthController {

    private final DataSource dataSource;
    private final RailRegistry railRegistry;
    private final Clock clock;

    public HealthController(DataSource dataSource, RailRegistry railRegistry, Clock clock) {
        this.dataSource = dataSource;
        this.railRegistry = railRegistry;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", clock.instant().toString());
        response.put("rails", railRegistry.all().stream().map(RailSyncService::railId).toList());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");

        if (!dbHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }
        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (Exception e) {
            return false;
        }
    }
}
