package com.ttlcache.core;

import lombok.Getter;

/**
 * A stored value plus its expiry and bookkeeping.
 * Access statistics are mutated by the owning store while it holds its lock.
 */
@Getter
public class CacheEntry<V> {
    
    private final V value;
    
    /** Absolute epoch millis after which the entry is expired */
    private final long expiresAt;
    
    /** Epoch millis of insertion, bumped where needed so stamps strictly increase */
    private final long createdAt;
    
    private long accessCount;
    private long lastAccessed;
    
    public CacheEntry(V value, long expiresAt, long createdAt, long now) {
        this.value = value;
        this.expiresAt = expiresAt;
        this.createdAt = createdAt;
        this.lastAccessed = now;
    }
    
    public boolean isExpired(long now) {
        return now > expiresAt;
    }
    
    public void recordAccess(long now) {
        accessCount++;
        lastAccessed = now;
    }
}
