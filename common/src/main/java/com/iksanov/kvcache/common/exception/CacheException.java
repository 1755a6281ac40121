package com.iksanov.kvcache.common.exception;

/**
 * Base type of every failure raised by the cache stores themselves.
 * Ambient I/O and remote client failures are not wrapped into it.
 */
public class CacheException extends RuntimeException {
    public CacheException(String message) {
        super(message);
    }
    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
