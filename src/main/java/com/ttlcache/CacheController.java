package com.ttlcache;

import com.ttlcache.core.CacheHealthReport;
import com.ttlcache.core.CacheStats;
import com.ttlcache.core.HealthStatus;
import com.ttlcache.core.RateLimiter;
import com.ttlcache.storage.CacheHealthReporter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Monitoring and admin endpoints for the application caches and rate limiters
 */
@Slf4j
@RestController
@RequestMapping("/api")
public class CacheController {

    private final CacheHealthReporter healthReporter;
    private final List<RateLimiter> rateLimiters;

    public CacheController(
            CacheHealthReporter healthReporter,
            @Qualifier("apiRateLimiter") RateLimiter apiRateLimiter,
            @Qualifier("authRateLimiter") RateLimiter authRateLimiter,
            @Qualifier("registrationRateLimiter") RateLimiter registrationRateLimiter) {

        this.healthReporter = healthReporter;
        this.rateLimiters = List.of(apiRateLimiter, authRateLimiter, registrationRateLimiter);
    }

    /**
     * Health of every cache; 503 when any cache has a critical alert
     */
    @GetMapping("/cache/health")
    public ResponseEntity<CacheHealthReport> health() {
        CacheHealthReport report = healthReporter.report();
        HttpStatus status = report.getOverallHealth() == HealthStatus.CRITICAL
                ? HttpStatus.SERVICE_UNAVAILABLE
                : HttpStatus.OK;
        return ResponseEntity.status(status).body(report);
    }

    @GetMapping("/cache/{name}/stats")
    public ResponseEntity<CacheStats> stats(@PathVariable String name) {
        return healthReporter.find(name)
                .map(cache -> ResponseEntity.ok(cache.stats()))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * Bulk invalidation by key prefix, e.g. prefix=user:
     */
    @DeleteMapping("/admin/cache/{name}")
    public ResponseEntity<Map<String, Object>> invalidate(
            @PathVariable String name,
            @RequestParam(value = "prefix", defaultValue = "") String prefix) {

        return healthReporter.find(name)
                .map(cache -> {
                    int removed = cache.deletePattern(prefix);
                    log.info("Invalidated {} keys with prefix '{}' in {}", removed, prefix, name);
                    Map<String, Object> response = new HashMap<>();
                    response.put("cache", name);
                    response.put("removed", removed);
                    return ResponseEntity.ok(response);
                })
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @DeleteMapping("/admin/cache/alerts")
    public ResponseEntity<Void> clearAlerts() {
        healthReporter.clearAlerts();
        return ResponseEntity.noContent().build();
    }

    /**
     * Admin endpoint to reset rate limits for a caller identity
     */
    @DeleteMapping("/admin/rate-limit/{identifier}")
    public ResponseEntity<Map<String, String>> resetRateLimit(@PathVariable String identifier) {
        for (RateLimiter limiter : rateLimiters) {
            limiter.reset(limiter.generateKey(identifier));
        }

        Map<String, String> response = new HashMap<>();
        response.put("message", "Rate limits reset for: " + identifier);
        return ResponseEntity.ok(response);
    }
}
