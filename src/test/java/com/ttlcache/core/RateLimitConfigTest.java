package com.ttlcache.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RateLimitConfigTest {

    @Test
    @DisplayName("Should apply defaults from the builder")
    void shouldApplyDefaults() {
        RateLimitConfig config = RateLimitConfig.perMinute(10);

        assertEquals("rate-limiter", config.getName());
        assertEquals(Duration.ofMinutes(1), config.getWindow());
        assertFalse(config.isSkipSuccessfulRequests());
        assertFalse(config.isSkipFailedRequests());
        assertTrue(config.getExponentialBackoff().isEnabled());
        assertEquals(Duration.ofSeconds(1), config.getExponentialBackoff().getBaseDelay());
        assertEquals(Duration.ofMinutes(5), config.getExponentialBackoff().getMaxDelay());
        assertEquals(2.0, config.getExponentialBackoff().getFactor());
        assertDoesNotThrow(config::validate);

        assertEquals(Duration.ofHours(1), RateLimitConfig.perHour(3).getWindow());
    }

    @Test
    @DisplayName("Should reject a non-positive request budget")
    void shouldRejectInvalidMaxRequests() {
        assertThrows(IllegalArgumentException.class, () -> RateLimitConfig.builder()
                .maxRequests(0)
                .window(Duration.ofSeconds(1))
                .build()
                .validate());
    }

    @Test
    @DisplayName("Should reject a missing or non-positive window")
    void shouldRejectInvalidWindow() {
        assertThrows(IllegalArgumentException.class, () -> RateLimitConfig.builder()
                .maxRequests(10)
                .build()
                .validate());

        assertThrows(IllegalArgumentException.class, () -> RateLimitConfig.builder()
                .maxRequests(10)
                .window(Duration.ZERO)
                .build()
                .validate());
    }

    @Test
    @DisplayName("Should reject inconsistent backoff settings")
    void shouldRejectInvalidBackoff() {
        assertThrows(IllegalArgumentException.class, () -> BackoffPolicy.builder()
                .factor(0.5)
                .build()
                .validate());

        assertThrows(IllegalArgumentException.class, () -> BackoffPolicy.builder()
                .baseDelay(Duration.ofMinutes(10))
                .maxDelay(Duration.ofMinutes(1))
                .build()
                .validate());

        assertThrows(IllegalArgumentException.class, () -> RateLimitConfig.builder()
                .maxRequests(10)
                .window(Duration.ofSeconds(1))
                .exponentialBackoff(null)
                .build()
                .validate());

        assertDoesNotThrow(() -> BackoffPolicy.disabled().validate());
    }
}
