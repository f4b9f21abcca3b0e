package com.flagship.storefront_payments.health;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unauthenticated liveness/readiness probe.
 * The database decides the status; the gateway key is reported so a misconfigured
 * deployment is visible without reading logs.
 */
@RestController
public class HealthController {

    private final DataSource dataSource;
    private final Clock clock;
    private final boolean gatewayConfigured;

    public HealthController(DataSource dataSource, Clock clock,
                            @Value("${paystack.secret-key:}") String secretKey) {
        this.dataSource = dataSource;
        this.clock = clock;
        this.gatewayConfigured = secretKey != null && !secretKey.isBlank();
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", clock.instant().toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");
        response.put("paymentGateway", gatewayConfigured ? "CONFIGURED" : "NOT_CONFIGURED");

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
