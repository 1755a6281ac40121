package com.iksanov.kvcache.common.exception;

public class InvalidCacheArgumentException extends InvalidCacheRequestException {
    public InvalidCacheArgumentException(String message) {
        super(message);
    }
    public InvalidCacheArgumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
