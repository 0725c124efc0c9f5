package com.ttlcache.core;

/**
 * Reports the memory currently used by the process.
 * Production code reads the JVM heap; tests substitute a fixed value.
 */
@FunctionalInterface
public interface MemoryProbe {
    
    /**
     * @return used memory in megabytes
     */
    double usedMemoryMb();
}
