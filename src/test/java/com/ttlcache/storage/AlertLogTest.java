package com.ttlcache.storage;

import com.ttlcache.MutableClock;
import com.ttlcache.core.AlertType;
import com.ttlcache.core.MemoryAlert;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AlertLogTest {
    
    private final MutableClock clock = new MutableClock(5_000L);
    
    @Test
    @DisplayName("Should drop the oldest alerts once full")
    void shouldRotate() {
        AlertLog log = new AlertLog("test", 3, clock, () -> 1.0);
        
        for (int i = 0; i < 5; i++) {
            log.record(AlertType.WARNING, "alert-" + i);
        }
        
        List<MemoryAlert> alerts = log.getAlerts();
        assertEquals(3, alerts.size());
        assertEquals("alert-2", alerts.get(0).getMessage());
        assertEquals("alert-4", alerts.get(2).getMessage());
    }
    
    @Test
    @DisplayName("Should return a snapshot copy")
    void shouldReturnSnapshot() {
        AlertLog log = new AlertLog("test", 3, clock, () -> 1.0);
        log.record(AlertType.CRITICAL, "first", 99.0);
        
        List<MemoryAlert> snapshot = log.getAlerts();
        log.record(AlertType.WARNING, "second");
        
        assertEquals(1, snapshot.size());
        assertEquals(new MemoryAlert(AlertType.CRITICAL, "first", 5_000L, 99.0), snapshot.get(0));
        assertEquals(2, log.getAlerts().size());
    }
    
    @Test
    @DisplayName("Should stamp zero memory when the probe fails")
    void shouldTolerateProbeFailure() {
        AlertLog log = new AlertLog("test", 3, clock, () -> {
            throw new IllegalStateException("no probe");
        });
        
        log.record(AlertType.CRITICAL, "cleanup failed");
        
        assertEquals(0.0, log.getAlerts().get(0).getMemoryUsageMb());
    }
    
    @Test
    @DisplayName("Should clear all alerts")
    void shouldClear() {
        AlertLog log = new AlertLog("test", 3, clock, () -> 1.0);
        log.record(AlertType.WARNING, "a");
        
        log.clear();
        
        assertTrue(log.getAlerts().isEmpty());
    }
}
