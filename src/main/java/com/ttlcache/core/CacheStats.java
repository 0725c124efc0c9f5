package com.ttlcache.core;

import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time snapshot of a cache.
 * {@code expiredCount} and {@code totalSize} are computed by scanning every entry.
 */
@Value
@Builder
public class CacheStats {
    int size;
    int maxSize;
    int expiredCount;
    
    /**
     * Sum of the serialized length of every measurable value, capped at Long.MAX_VALUE
     */
    long totalSize;
    
    /**
     * Percentage of reads that were hits, 0 when nothing was read yet
     */
    double hitRate;
    
    double memoryUsageMb;
    int cleanupErrors;
    long lastCleanupTime;
}
