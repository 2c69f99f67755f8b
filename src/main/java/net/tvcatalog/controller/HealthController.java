package net.tvcatalog.controller;

import lombok.extern.slf4j.Slf4j;
import net.tvcatalog.repository.CatalogListingRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Service and database liveness check.
 */
@RestController
@Slf4j
public class HealthController {

    private final CatalogListingRepository repository;

    public HealthController(CatalogListingRepository repository) {
        this.repository = repository;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        try {
            body.put("ok", true);
            body.put("db", repository.ping());
            return ResponseEntity.ok(body);
        } catch (DataAccessException ex) {
            log.warn("Health check failed to reach the database: {}", ex.getMessage());
            body.put("ok", false);
            body.put("error", ex.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
        }
    }
}
