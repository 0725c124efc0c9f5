package com.ttlcache.core;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Configuration for rate limiting behavior.
 * Immutable to prevent accidental modifications after creation.
 */
@Value
@Builder
public class RateLimitConfig {
    
    /**
     * Label used in logs and metrics
     */
    @Builder.Default
    String name = "rate-limiter";
    
    /**
     * Length of the counting window. Also the TTL of each stored record.
     */
    Duration window;
    
    /**
     * Maximum number of requests counted in one window
     */
    long maxRequests;
    
    /**
     * Successful requests do not consume the budget
     */
    @Builder.Default
    boolean skipSuccessfulRequests = false;
    
    /**
     * Failed requests do not consume the budget (they still drive backoff)
     */
    @Builder.Default
    boolean skipFailedRequests = false;
    
    @Builder.Default
    BackoffPolicy exponentialBackoff = BackoffPolicy.builder().build();
    
    public void validate() {
        if (maxRequests <= 0) {
            throw new IllegalArgumentException("maxRequests must be positive");
        }
        if (window == null || window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be a positive duration");
        }
        if (exponentialBackoff == null) {
            throw new IllegalArgumentException("exponentialBackoff must not be null");
        }
        exponentialBackoff.validate();
    }
    
    /**
     * Quick factory for common use cases
     */
    public static RateLimitConfig perMinute(long maxRequests) {
        return RateLimitConfig.builder()
                .maxRequests(maxRequests)
                .window(Duration.ofMinutes(1))
                .build();
    }
    
    public static RateLimitConfig perHour(long maxRequests) {
        return RateLimitConfig.builder()
                .maxRequests(maxRequests)
                .window(Duration.ofHours(1))
                .build();
    }
}
