package com.iksanov.kvcache.store.core;

import com.iksanov.kvcache.common.util.KeyValidator;
import com.iksanov.kvcache.store.metrics.CacheMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Process-local store backed by a plain map. TTLs are accepted and ignored.
 * Not thread-safe: use from one thread or synchronize externally.
 */
public class InMemoryCacheStore implements CacheStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCacheStore.class);
    private final Map<String, Object> store = new LinkedHashMap<>();
    private final CacheMetrics metrics;

    public InMemoryCacheStore() {
        this(new CacheMetrics());
    }

    public InMemoryCacheStore(CacheMetrics metrics) {
        this.metrics = metrics;
        log.info("InMemoryCacheStore initialized");
    }

    @Override
    public Object get(String key, Object defaultValue) {
        KeyValidator.validate(key);
        if (!store.containsKey(key)) {
            metrics.recordMiss();
            return defaultValue;
        }
        metrics.recordHit();
        return store.get(key);
    }

    @Override
    public boolean set(String key, Object value, Duration ttl) {
        KeyValidator.validate(key);
        store.put(key, value);
        return true;
    }

    @Override
    public boolean delete(String key) {
        KeyValidator.validate(key);
        if (!store.containsKey(key)) return false;
        store.remove(key);
        return true;
    }

    @Override
    public boolean clear() {
        store.clear();
        log.info("Cache cleared");
        return true;
    }

    /**
     * A key mapped to {@code null} counts as present here, unlike the file stores.
     */
    @Override
    public boolean has(String key) {
        KeyValidator.validate(key);
        return store.containsKey(key);
    }

    @Override
    public Map<String, Object> getMultiple(Iterable<String> keys, Object defaultValue) {
        List<String> keyList = KeyValidator.validateAll(keys);
        Map<String, Object> result = new LinkedHashMap<>();
        for (String key : keyList) {
            result.put(key, get(key, defaultValue));
        }
        return result;
    }

    @Override
    public boolean setMultiple(Map<String, ?> values, Duration ttl) {
        KeyValidator.validateAll(values);
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            set(entry.getKey(), entry.getValue(), ttl);
        }
        return true;
    }

    /**
     * @return {@code false} if any of the keys was not present
     */
    @Override
    public boolean deleteMultiple(Iterable<String> keys) {
        List<String> keyList = KeyValidator.validateAll(keys);
        boolean success = true;
        for (String key : keyList) {
            if (!delete(key)) success = false;
        }
        return success;
    }

    public int size() {
        return store.size();
    }
}
