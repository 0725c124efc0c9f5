package com.ttlcache.core;

/**
 * Base class for errors surfaced by the cache to its callers
 */
public class CacheException extends RuntimeException {
    
    public CacheException(String message) {
        super(message);
    }
    
    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
