package com.ttlcache.core;

/**
 * Admission control on top of a {@link CacheStore}.
 * Callers check before handling a request and record the outcome afterwards.
 */
public interface RateLimiter {
    
    /**
     * Build the storage key for a caller identity (user id, ip, api key, ...)
     */
    String generateKey(String identifier);
    
    /**
     * Read-only check. Never throws; an unreadable record counts as a fresh one.
     *
     * @param key key produced by {@link #generateKey(String)}
     */
    RateLimitResult checkRateLimit(String key);
    
    /**
     * Record the outcome of a handled request.
     * Failures build up consecutive-failure backoff, a success clears it.
     *
     * @param key key produced by {@link #generateKey(String)}
     * @param success whether the request succeeded
     */
    void recordRequest(String key, boolean success);
    
    /**
     * Forget all state for a key.
     * Use carefully - mainly for testing or admin overrides.
     */
    void reset(String key);
    
    RateLimitConfig getConfig();
}
