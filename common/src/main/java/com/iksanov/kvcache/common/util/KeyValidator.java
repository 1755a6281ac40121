package com.iksanov.kvcache.common.util;

import com.iksanov.kvcache.common.exception.InvalidCacheArgumentException;
import com.iksanov.kvcache.common.exception.InvalidCacheKeyException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Key checks shared by every store. Runs before any hashing, I/O or remote call.
 */
public final class KeyValidator {

    private KeyValidator() {}

    public static String validate(Object key) {
        if (!(key instanceof String s)) throw new InvalidCacheKeyException("Key must be a string");
        if (s.isEmpty()) throw new InvalidCacheKeyException("Key cannot be empty");
        return s;
    }

    /**
     * Validates every key and returns them in iteration order. Callers iterate the returned list,
     * so a single-pass {@link Iterable} is only traversed once.
     */
    public static List<String> validateAll(Iterable<?> keys) {
        if (keys == null) throw new InvalidCacheArgumentException("Keys must not be null");
        List<String> validated = new ArrayList<>();
        for (Object key : keys) {
            validated.add(validate(key));
        }
        return validated;
    }

    public static void validateAll(Map<?, ?> values) {
        if (values == null) throw new InvalidCacheArgumentException("Values must not be null");
        validateAll(values.keySet());
    }
}
