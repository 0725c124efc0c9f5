package com.ttlcache.core;

import lombok.Value;

import java.time.Duration;

/**
 * One item of a batch write. A null ttl falls back to the cache default.
 */
@Value
public class CacheWrite<V> {
    String key;
    V value;
    Duration ttl;
    
    public static <V> CacheWrite<V> of(String key, V value) {
        return new CacheWrite<>(key, value, null);
    }
    
    public static <V> CacheWrite<V> of(String key, V value, Duration ttl) {
        return new CacheWrite<>(key, value, ttl);
    }
}
