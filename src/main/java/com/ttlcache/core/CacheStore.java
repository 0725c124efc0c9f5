package com.ttlcache.core;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * In-process key/value store with per-entry expiry and a size bound.
 * 
 * Read operations never throw: a destroyed or failing store simply reports misses.
 * Writes throw {@link StoreDestroyedException} once the store has been destroyed.
 */
public interface CacheStore<V> {
    
    /**
     * Store a value using the default TTL.
     * Evicts the oldest inserted entry first if the store is full.
     *
     * @throws StoreDestroyedException if the store was destroyed
     */
    void set(String key, V value);
    
    /**
     * Store a value with an explicit TTL (null means the default TTL)
     *
     * @throws StoreDestroyedException if the store was destroyed
     */
    void set(String key, V value, Duration ttl);
    
    /**
     * Look up a value. Expired entries are removed and reported as a miss.
     */
    Optional<V> get(String key);
    
    boolean delete(String key);
    
    void clear();
    
    default boolean has(String key) {
        return get(key).isPresent();
    }
    
    /**
     * Keys starting with the given prefix (no glob support)
     */
    List<String> keys(String prefix);
    
    /**
     * Delete every key starting with the given prefix
     *
     * @return number of keys removed
     */
    int deletePattern(String prefix);
    
    List<Optional<V>> mget(List<String> keys);
    
    /**
     * @throws StoreDestroyedException if the store was destroyed
     */
    void mset(Collection<CacheWrite<V>> items);
    
    /**
     * Return the cached value or compute, store and return it.
     * If the value cannot be cached the computed value is still returned.
     */
    V getOrCompute(String key, Supplier<? extends V> loader, Duration ttl);
    
    default V getOrCompute(String key, Supplier<? extends V> loader) {
        return getOrCompute(key, loader, null);
    }
    
    CacheStats stats();
    
    List<MemoryAlert> getAlerts();
    
    void clearAlerts();
    
    /**
     * Stop background maintenance and release all entries. Idempotent.
     */
    void destroy();
    
    boolean isDestroyed();
    
    String getName();
}
