package com.iksanov.kvcache.store.remote;

import com.iksanov.kvcache.common.util.KeyValidator;
import com.iksanov.kvcache.store.core.CacheStore;
import com.iksanov.kvcache.store.metrics.CacheMetrics;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cache store over a Redis-compatible server reached through {@link RemoteStore}.
 * <p>
 * A provided TTL is clamped to at least one second, so it never means "already expired".
 * {@link #setMultiple} is checked per acknowledgement and fails when any SET in the pipeline
 * did not reply OK. Client failures propagate unchanged.
 * <p>
 * The store owns its {@link RemoteStore}: {@link #close()} releases the underlying connection.
 */
public class RedisCacheStore implements CacheStore, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RedisCacheStore.class);
    private final RemoteStore remote;
    private final CacheMetrics metrics;

    public RedisCacheStore(RemoteStore remote) {
        this(remote, new CacheMetrics());
    }

    public RedisCacheStore(RemoteStore remote, CacheMetrics metrics) {
        this.remote = remote;
        this.metrics = metrics;
    }

    @Override
    public Object get(String key, Object defaultValue) {
        KeyValidator.validate(key);
        Timer.Sample sample = metrics.startGetTimer();

        try {
            Object value = remote.get(key);
            if (value == null) {
                metrics.recordMiss();
                return defaultValue;
            }
            metrics.recordHit();
            return value;
        } finally {
            metrics.stopGetTimer(sample);
        }
    }

    @Override
    public boolean set(String key, Object value, Duration ttl) {
        KeyValidator.validate(key);
        Timer.Sample sample = metrics.startSetTimer();

        try {
            return RemoteStore.OK.equals(remote.set(key, value, ttlSeconds(ttl)));
        } finally {
            metrics.stopSetTimer(sample);
        }
    }

    @Override
    public boolean delete(String key) {
        KeyValidator.validate(key);
        return remote.del(List.of(key)) > 0;
    }

    @Override
    public boolean clear() {
        boolean flushed = RemoteStore.OK.equals(remote.flushAll());
        log.info("Remote cache flushed: {}", flushed);
        return flushed;
    }

    /**
     * Asks the server directly, so a stored value is never confused with absence.
     */
    @Override
    public boolean has(String key) {
        KeyValidator.validate(key);
        return remote.exists(key);
    }

    @Override
    public Map<String, Object> getMultiple(Iterable<String> keys, Object defaultValue) {
        List<String> keyList = KeyValidator.validateAll(keys);

        Map<String, Object> result = new LinkedHashMap<>();
        if (keyList.isEmpty()) return result;

        List<Object> values = remote.mget(keyList);
        for (int i = 0; i < keyList.size(); i++) {
            Object value = i < values.size() ? values.get(i) : null;
            result.put(keyList.get(i), value != null ? value : defaultValue);
        }
        return result;
    }

    @Override
    public boolean setMultiple(Map<String, ?> values, Duration ttl) {
        KeyValidator.validateAll(values);
        if (values.isEmpty()) return true;

        Long ttlSeconds = ttlSeconds(ttl);
        List<PipelinedSet> commands = new ArrayList<>(values.size());
        values.forEach((key, value) -> commands.add(new PipelinedSet(key, value, ttlSeconds)));

        List<String> acks = remote.pipelineSet(commands);
        if (acks.size() != commands.size()) {
            log.warn("Pipeline returned {} replies for {} commands", acks.size(), commands.size());
            return false;
        }
        for (String ack : acks) {
            if (!RemoteStore.OK.equals(ack)) {
                log.debug("Pipelined SET rejected: {}", ack);
                return false;
            }
        }
        return true;
    }

    /**
     * @return {@code true} if at least one of the keys was removed
     */
    @Override
    public boolean deleteMultiple(Iterable<String> keys) {
        List<String> keyList = KeyValidator.validateAll(keys);
        if (keyList.isEmpty()) return false;
        return remote.del(keyList) > 0;
    }

    @Override
    public void close() {
        remote.close();
        log.info("RedisCacheStore closed");
    }

    static Long ttlSeconds(Duration ttl) {
        if (ttl == null) return null;
        return Math.max(1L, ttl.getSeconds());
    }
}
