package com.flagship.personal_ledger.health;

import com.flagship.personal_ledger.category.CategoryRepository;
import com.flagship.personal_ledger.category.Category.SystemCategoryKey;
import com.flagship.personal_ledger.common.FlowType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness/readiness endpoint outside /api, so it needs no bearer token.
 *
 * Besides the database connection it checks that every system category is
 * seeded; transfers and balance adjustments cannot be written without them.
 */
@RestController
@Slf4j
public class HealthController {

    private static final int EXPECTED_SYSTEM_CATEGORIES =
            SystemCategoryKey.values().length * FlowType.values().length;

    private final DataSource dataSource;
    private final CategoryRepository categoryRepository;

    public HealthController(DataSource dataSource, CategoryRepository categoryRepository) {
        this.dataSource = dataSource;
        this.categoryRepository = categoryRepository;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");

        boolean seeded = dbHealthy && checkSystemCategories();
        response.put("systemCategories", seeded ? "SEEDED" : "MISSING");

        if (!dbHealthy || !seeded) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }
        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private boolean checkSystemCategories() {
        try {
            return categoryRepository.countSystemCategories() >= EXPECTED_SYSTEM_CATEGORIES;
        } catch (Exception e) {
            log.warn("System category check failed: {}", e.getMessage());
            return false;
        }
    }
}
