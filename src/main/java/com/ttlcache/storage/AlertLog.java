package com.ttlcache.storage;

import com.ttlcache.core.AlertType;
import com.ttlcache.core.MemoryAlert;
import com.ttlcache.core.MemoryProbe;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded ring buffer of alerts. When full, the oldest alert is dropped
 * to make room for the new one.
 */
@Slf4j
public class AlertLog {
    
    private final String name;
    private final int maxAlerts;
    private final Clock clock;
    private final MemoryProbe memoryProbe;
    private final Deque<MemoryAlert> alerts;
    
    public AlertLog(String name, int maxAlerts, Clock clock, MemoryProbe memoryProbe) {
        if (maxAlerts <= 0) {
            throw new IllegalArgumentException("maxAlerts must be positive");
        }
        this.name = name;
        this.maxAlerts = maxAlerts;
        this.clock = clock;
        this.memoryProbe = memoryProbe;
        this.alerts = new ArrayDeque<>(maxAlerts);
    }
    
    /**
     * Record an alert stamped with the current memory reading
     */
    public void record(AlertType type, String message) {
        record(type, message, readMemory());
    }
    
    public void record(AlertType type, String message, double memoryUsageMb) {
        MemoryAlert alert = new MemoryAlert(type, message, clock.millis(), memoryUsageMb);
        synchronized (alerts) {
            alerts.addLast(alert);
            while (alerts.size() > maxAlerts) {
                alerts.removeFirst();
            }
        }
        
        if (type == AlertType.CRITICAL) {
            log.error("Cache alert [{}]: {}", name, message);
        } else {
            log.warn("Cache alert [{}]: {}", name, message);
        }
    }
    
    /**
     * Snapshot copy, oldest first
     */
    public List<MemoryAlert> getAlerts() {
        synchronized (alerts) {
            return new ArrayList<>(alerts);
        }
    }
    
    public void clear() {
        synchronized (alerts) {
            alerts.clear();
        }
    }
    
    private double readMemory() {
        try {
            return memoryProbe.usedMemoryMb();
        } catch (RuntimeException e) {
            log.debug("Memory probe failed while recording alert for {}", name, e);
            return 0;
        }
    }
}
