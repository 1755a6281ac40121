package com.iksanov.kvcache.store.config;

import com.iksanov.kvcache.common.exception.ConfigurationException;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Which backend to build and where its storage lives.
 * Simple and immutable, loaded from the environment like the node configuration.
 */
public record CacheStoreConfig(Backend backend, Path directory, String redisAddress) {

    public enum Backend {
        MEMORY,
        FILE,
        JSON,
        REDIS
    }

    public CacheStoreConfig {
        if (backend == null) throw new ConfigurationException("backend must be set");
        if ((backend == Backend.FILE || backend == Backend.JSON) && directory == null) {
            throw new ConfigurationException("directory is required for the " + backend + " backend");
        }
        if (backend == Backend.REDIS && (redisAddress == null || redisAddress.isBlank())) {
            throw new ConfigurationException("redisAddress is required for the REDIS backend");
        }
    }

    public static CacheStoreConfig fromEnv() {
        return fromMap(System.getenv());
    }

    public static CacheStoreConfig fromMap(Map<String, String> env) {
        return new CacheStoreConfig(
                parseBackend(getEnv(env, "CACHE_BACKEND", "MEMORY")),
                Path.of(getEnv(env, "CACHE_DIRECTORY", defaults().directory().toString())),
                getEnv(env, "CACHE_REDIS_ADDRESS", defaults().redisAddress())
        );
    }

    public static CacheStoreConfig defaults() {
        return new CacheStoreConfig(
                Backend.MEMORY,
                Path.of(System.getProperty("java.io.tmpdir"), "kv-cache"),
                "redis://127.0.0.1:6379"
        );
    }

    private static String getEnv(Map<String, String> env, String key, String defaultValue) {
        String value = env.get(key);
        return value != null && !value.isBlank() ? value : defaultValue;
    }

    private static Backend parseBackend(String value) {
        try {
            return Backend.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown CACHE_BACKEND: " + value, e);
        }
    }
}
