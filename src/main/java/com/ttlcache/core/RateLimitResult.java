package com.ttlcache.core;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a rate limit check. Being limited is a normal result, not an error.
 */
@Value
@Builder
public class RateLimitResult {
    
    boolean limited;
    
    long remaining;
    
    /** Epoch millis at which the current window ends */
    long resetTime;
    
    /** Seconds until the block lifts, null unless blocked by backoff */
    Long retryAfter;
    
    /** Epoch millis until which the key is blocked, null when not blocked */
    Long blockedUntil;
}
