package com.ttlcache.storage;

import com.ttlcache.core.MemoryProbe;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;

/**
 * Reads used heap from the JVM memory MX bean
 */
public class HeapMemoryProbe implements MemoryProbe {
    
    private static final double BYTES_PER_MB = 1024.0 * 1024.0;
    
    private final MemoryMXBean memoryBean;
    
    public HeapMemoryProbe() {
        this(ManagementFactory.getMemoryMXBean());
    }
    
    HeapMemoryProbe(MemoryMXBean memoryBean) {
        this.memoryBean = memoryBean;
    }
    
    @Override
    public double usedMemoryMb() {
        return memoryBean.getHeapMemoryUsage().getUsed() / BYTES_PER_MB;
    }
}
