package com.example.assoc.core;

/**
 * Raised when a cache, an indexing policy or a replacement policy is built
 * with parameters that cannot describe a valid structure.
 */
public class CacheConfigurationException extends IllegalArgumentException {

    public CacheConfigurationException(String message) {
        super(message);
    }
}
