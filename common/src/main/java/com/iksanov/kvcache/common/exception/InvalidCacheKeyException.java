package com.iksanov.kvcache.common.exception;

public class InvalidCacheKeyException extends InvalidCacheRequestException {
    public InvalidCacheKeyException(String message) {
        super(message);
    }
    public InvalidCacheKeyException(String message, Throwable cause) {
        super(message, cause);
    }
}
