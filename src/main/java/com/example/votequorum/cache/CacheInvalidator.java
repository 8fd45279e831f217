package com.example.votequorum.cache;

/**
 * Hook called synchronously whenever consensus state behind a cached view changes.
 */
public interface CacheInvalidator {
    
    void invalidate(String key);
}
