package com.ttlcache.core;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Configuration for a bounded TTL cache and its cleanup scheduler.
 * Immutable to prevent accidental modifications after creation.
 */
@Value
@Builder
public class CacheOptions {
    
    /**
     * Label used in logs, metrics and health reports
     */
    @Builder.Default
    String name = "cache";
    
    /**
     * Time-to-live applied when a write does not supply its own
     */
    @Builder.Default
    Duration ttl = Duration.ofMinutes(5);
    
    /**
     * Maximum number of entries kept at once
     */
    @Builder.Default
    int maxSize = 1000;
    
    /**
     * Delay between two background cleanup runs
     */
    @Builder.Default
    Duration cleanupInterval = Duration.ofSeconds(60);
    
    /**
     * Attempts per cleanup run before giving up and raising a critical alert
     */
    @Builder.Default
    int maxRetries = 3;
    
    /**
     * Heap usage (MB) above which a warning alert is raised.
     * Twice this value triggers aggressive eviction.
     */
    @Builder.Default
    double memoryThresholdMb = 100;
    
    /**
     * Size of the alert ring buffer
     */
    @Builder.Default
    int maxAlerts = 10;
    
    /**
     * Base of the retry delay between failed cleanup attempts: base * 2^attempt
     */
    @Builder.Default
    Duration retryBackoffBase = Duration.ofSeconds(1);
    
    public void validate() {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive");
        }
        if (ttl == null) {
            throw new IllegalArgumentException("ttl must not be null");
        }
        if (cleanupInterval == null || cleanupInterval.isNegative() || cleanupInterval.isZero()) {
            throw new IllegalArgumentException("cleanupInterval must be a positive duration");
        }
        if (maxRetries <= 0) {
            throw new IllegalArgumentException("maxRetries must be positive");
        }
        if (memoryThresholdMb <= 0) {
            throw new IllegalArgumentException("memoryThresholdMb must be positive");
        }
        if (maxAlerts <= 0) {
            throw new IllegalArgumentException("maxAlerts must be positive");
        }
        if (retryBackoffBase == null || retryBackoffBase.isNegative()) {
            throw new IllegalArgumentException("retryBackoffBase cannot be negative");
        }
    }
    
    public static CacheOptions defaults() {
        return CacheOptions.builder().build();
    }
}
