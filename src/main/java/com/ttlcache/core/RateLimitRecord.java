package com.ttlcache.core;

import lombok.Builder;
import lombok.Value;

/**
 * Per-key limiter state, stored as a cache value under the limiter key.
 * Immutable: every update stores a new record.
 */
@Value
@Builder(toBuilder = true)
public class RateLimitRecord {
    
    long count;
    
    /** Epoch millis at which the current window ends */
    long windowResetAt;
    
    long consecutiveFailures;
    
    /** Epoch millis until which the key is blocked, null when not blocked */
    Long blockedUntil;
    
    public static RateLimitRecord fresh(long now, long windowMs) {
        return RateLimitRecord.builder()
                .count(0)
                .windowResetAt(now + windowMs)
                .consecutiveFailures(0)
                .build();
    }
    
    public boolean isBlockedAt(long now) {
        return blockedUntil != null && now < blockedUntil;
    }
    
    public boolean isWindowExpiredAt(long now) {
        return now > windowResetAt;
    }
}
