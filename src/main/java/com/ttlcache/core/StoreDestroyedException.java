package com.ttlcache.core;

/**
 * Thrown by writes issued after the cache was destroyed
 */
public class StoreDestroyedException extends CacheException {
    
    public StoreDestroyedException(String cacheName) {
        super("Cache has been destroyed: " + cacheName);
    }
}
