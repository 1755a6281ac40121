package com.iksanov.kvcache.common.exception;

public class CorruptRecordException extends SerializationException {
    public CorruptRecordException(String message) {
        super(message);
    }
    public CorruptRecordException(String message, Throwable cause) {
        super(message, cause);
    }
}
