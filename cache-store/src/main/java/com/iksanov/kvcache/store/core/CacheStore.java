package com.iksanov.kvcache.store.core;

import java.time.Duration;
import java.util.Map;

/**
 * The capability contract implemented by every backend.
 * <p>
 * Every keyed operation rejects a null or empty key with
 * {@link com.iksanov.kvcache.common.exception.InvalidCacheKeyException} before touching storage.
 * Batch operations reject a null batch with
 * {@link com.iksanov.kvcache.common.exception.InvalidCacheArgumentException} and validate all of
 * their keys before the first write.
 * <p>
 * Batch semantics deliberately differ per backend:
 * <ul>
 *   <li>file stores run each entry independently and report {@code true} from
 *       {@link #setMultiple} and {@link #deleteMultiple} once the iteration completes;</li>
 *   <li>the in-memory store reports {@code false} from {@link #deleteMultiple} when any key was absent;</li>
 *   <li>the remote store sends one pipelined round trip and reports {@code false} from
 *       {@link #setMultiple} when any acknowledgement is not a success.</li>
 * </ul>
 * TTL handling also differs: file stores accept zero or negative TTLs as already (or about to be)
 * expired, the remote store clamps any TTL up to one second.
 */
public interface CacheStore {

    default Object get(String key) {
        return get(key, null);
    }

    /**
     * @return the live value stored under {@code key}, or {@code defaultValue} when absent or expired
     */
    Object get(String key, Object defaultValue);

    default boolean set(String key, Object value) {
        return set(key, value, null);
    }

    /**
     * @param ttl time to live, {@code null} for an entry that never expires
     * @return whether the value was stored
     */
    boolean set(String key, Object value, Duration ttl);

    /**
     * @return {@code true} only if an entry existed and was removed
     */
    boolean delete(String key);

    boolean clear();

    /**
     * Existence check. File and in-memory semantics differ on a stored {@code null},
     * see the implementations.
     */
    boolean has(String key);

    default Map<String, Object> getMultiple(Iterable<String> keys) {
        return getMultiple(keys, null);
    }

    /**
     * @return values keyed in input order, {@code defaultValue} for every missing key
     */
    Map<String, Object> getMultiple(Iterable<String> keys, Object defaultValue);

    default boolean setMultiple(Map<String, ?> values) {
        return setMultiple(values, null);
    }

    boolean setMultiple(Map<String, ?> values, Duration ttl);

    boolean deleteMultiple(Iterable<String> keys);
}
