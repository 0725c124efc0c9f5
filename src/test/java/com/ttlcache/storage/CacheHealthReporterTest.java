package com.ttlcache.storage;

import com.ttlcache.core.AlertType;
import com.ttlcache.core.CacheHealthReport;
import com.ttlcache.core.CacheStats;
import com.ttlcache.core.CacheStore;
import com.ttlcache.core.HealthStatus;
import com.ttlcache.core.MemoryAlert;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for CacheHealthReporter
 */
class CacheHealthReporterTest {
    
    @Mock
    private CacheStore<Object> userCache;
    
    @Mock
    private CacheStore<Object> proposalCache;
    
    private CacheHealthReporter reporter;
    
    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        
        when(userCache.stats()).thenReturn(CacheStats.builder().size(3).maxSize(200).build());
        when(proposalCache.stats()).thenReturn(CacheStats.builder().size(7).maxSize(500).build());
        when(userCache.getAlerts()).thenReturn(List.of());
        when(proposalCache.getAlerts()).thenReturn(List.of());
        
        Map<String, CacheStore<Object>> caches = new LinkedHashMap<>();
        caches.put("userCache", userCache);
        caches.put("proposalCache", proposalCache);
        reporter = new CacheHealthReporter(caches, () -> 64.0);
    }
    
    @Test
    @DisplayName("Should report healthy without alerts")
    void shouldReportHealthy() {
        CacheHealthReport report = reporter.report();
        
        assertEquals(HealthStatus.HEALTHY, report.getOverallHealth());
        assertEquals(64.0, report.getMemoryUsageMb());
        assertEquals(2, report.getCaches().size());
        assertEquals("userCache", report.getCaches().get(0).getName());
        assertEquals(7, report.getCaches().get(1).getStats().getSize());
    }
    
    @Test
    @DisplayName("Should report warning when any cache has a warning")
    void shouldReportWarning() {
        when(userCache.getAlerts()).thenReturn(List.of(
                new MemoryAlert(AlertType.WARNING, "Memory usage high: 120.00MB", 1L, 120.0)));
        
        assertEquals(HealthStatus.WARNING, reporter.report().getOverallHealth());
    }
    
    @Test
    @DisplayName("Should let a critical alert win over warnings")
    void shouldReportCritical() {
        when(userCache.getAlerts()).thenReturn(List.of(
                new MemoryAlert(AlertType.WARNING, "high", 1L, 120.0)));
        when(proposalCache.getAlerts()).thenReturn(List.of(
                new MemoryAlert(AlertType.CRITICAL, "Cleanup failed after 3 attempts", 2L, 0.0)));
        
        assertEquals(HealthStatus.CRITICAL, reporter.report().getOverallHealth());
    }
    
    @Test
    @DisplayName("Should find caches by name and clear all alerts")
    void shouldFindAndClear() {
        assertTrue(reporter.find("userCache").isPresent());
        assertTrue(reporter.find("missing").isEmpty());
        
        reporter.clearAlerts();
        
        verify(userCache).clearAlerts();
        verify(proposalCache).clearAlerts();
    }
}
