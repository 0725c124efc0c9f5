package com.ttlcache.core;

import lombok.Value;

import java.util.List;

/**
 * Health of every registered cache.
 * Any critical alert makes the whole report CRITICAL; otherwise any warning makes it WARNING.
 */
@Value
public class CacheHealthReport {
    
    List<CacheReport> caches;
    HealthStatus overallHealth;
    
    /**
     * Process-wide heap reading, reported once rather than per cache
     */
    double memoryUsageMb;
    
    @Value
    public static class CacheReport {
        String name;
        CacheStats stats;
        List<MemoryAlert> alerts;
    }
}
