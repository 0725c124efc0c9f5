package com.ttlcache.core;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Exponential block applied after repeated failures:
 * min(baseDelay * factor^failures, maxDelay), plus up to 10% jitter.
 */
@Value
@Builder
public class BackoffPolicy {
    
    @Builder.Default
    boolean enabled = true;
    
    @Builder.Default
    Duration baseDelay = Duration.ofSeconds(1);
    
    @Builder.Default
    Duration maxDelay = Duration.ofMinutes(5);
    
    @Builder.Default
    double factor = 2.0;
    
    public static BackoffPolicy disabled() {
        return BackoffPolicy.builder().enabled(false).build();
    }
    
    public void validate() {
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay cannot be negative");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be at least baseDelay");
        }
        if (factor < 1.0) {
            throw new IllegalArgumentException("factor must be at least 1");
        }
    }
}
