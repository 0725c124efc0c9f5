package com.ttlcache.core;

import lombok.Value;

/**
 * Memory or operational alert raised by the cleanup scheduler
 */
@Value
public class MemoryAlert {
    AlertType type;
    String message;
    long timestamp;
    double memoryUsageMb;
}
