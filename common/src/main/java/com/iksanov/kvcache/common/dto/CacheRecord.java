package com.iksanov.kvcache.common.dto;

import java.io.Serializable;

/**
 * What a file store persists for one key.
 *
 * @param value     stored payload, may be null
 * @param expiresAt absolute expiry in epoch seconds, null when the record never expires
 */
public record CacheRecord(Object value, Long expiresAt) implements Serializable {

    public static CacheRecord permanent(Object value) {
        return new CacheRecord(value, null);
    }
}
