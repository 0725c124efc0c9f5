package com.ttlcache.core;

public enum HealthStatus {
    HEALTHY,
    WARNING,
    CRITICAL
}
