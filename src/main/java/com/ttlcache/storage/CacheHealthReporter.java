package com.ttlcache.storage;

import com.ttlcache.core.AlertType;
import com.ttlcache.core.CacheHealthReport;
import com.ttlcache.core.CacheStore;
import com.ttlcache.core.HealthStatus;
import com.ttlcache.core.MemoryAlert;
import com.ttlcache.core.MemoryProbe;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Aggregates stats and alerts of a fixed set of named caches
 */
@Slf4j
public class CacheHealthReporter {
    
    private final Map<String, CacheStore<?>> caches;
    private final MemoryProbe memoryProbe;
    
    public CacheHealthReporter(Map<String, ? extends CacheStore<?>> caches, MemoryProbe memoryProbe) {
        this.caches = Collections.unmodifiableMap(new LinkedHashMap<>(caches));
        this.memoryProbe = memoryProbe;
    }
    
    public CacheHealthReport report() {
        List<CacheHealthReport.CacheReport> reports = new ArrayList<>(caches.size());
        boolean critical = false;
        boolean warning = false;
        
        for (Map.Entry<String, CacheStore<?>> e : caches.entrySet()) {
            CacheStore<?> cache = e.getValue();
            List<MemoryAlert> alerts = cache.getAlerts();
            for (MemoryAlert alert : alerts) {
                if (alert.getType() == AlertType.CRITICAL) {
                    critical = true;
                } else {
                    warning = true;
                }
            }
            reports.add(new CacheHealthReport.CacheReport(e.getKey(), cache.stats(), alerts));
        }
        
        HealthStatus overall = critical ? HealthStatus.CRITICAL
                : warning ? HealthStatus.WARNING
                : HealthStatus.HEALTHY;
        
        return new CacheHealthReport(reports, overall, readMemory());
    }
    
    public Optional<CacheStore<?>> find(String name) {
        return Optional.ofNullable(caches.get(name));
    }
    
    /**
     * Clear the alert logs of every cache
     */
    public void clearAlerts() {
        caches.values().forEach(CacheStore::clearAlerts);
    }
    
    private double readMemory() {
        try {
            return memoryProbe.usedMemoryMb();
        } catch (RuntimeException e) {
            log.debug("Memory probe failed while building health report", e);
            return 0;
        }
    }
}
