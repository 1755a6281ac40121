package com.iksanov.kvcache.store.config;

import com.iksanov.kvcache.store.core.CacheStore;
import com.iksanov.kvcache.store.core.FileCacheStore;
import com.iksanov.kvcache.store.core.InMemoryCacheStore;
import com.iksanov.kvcache.store.core.JsonFileCacheStore;
import com.iksanov.kvcache.common.expiration.ExpirationPolicy;
import com.iksanov.kvcache.store.metrics.CacheMetrics;
import com.iksanov.kvcache.store.remote.RedisCacheStore;
import com.iksanov.kvcache.store.remote.RedissonRemoteStore;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Builds the {@link CacheStore} selected by a {@link CacheStoreConfig}.
 * <p>
 * A {@code REDIS} store holds an open client connection; the caller closes the returned
 * {@link RedisCacheStore} when done with it.
 */
public final class CacheStoreFactory {

    private static final Logger log = LoggerFactory.getLogger(CacheStoreFactory.class);

    private CacheStoreFactory() {}

    public static CacheStore create(CacheStoreConfig config) throws IOException {
        return create(config, new CacheMetrics());
    }

    public static CacheStore create(CacheStoreConfig config, CacheMetrics metrics) throws IOException {
        log.info("Creating {} cache store", config.backend());
        return switch (config.backend()) {
            case MEMORY -> new InMemoryCacheStore(metrics);
            case FILE -> new FileCacheStore(config.directory(), new ExpirationPolicy(), metrics);
            case JSON -> new JsonFileCacheStore(config.directory(), new ExpirationPolicy(), metrics);
            case REDIS -> new RedisCacheStore(new RedissonRemoteStore(connect(config.redisAddress())), metrics);
        };
    }

    private static RedissonClient connect(String address) {
        Config redisConfig = new Config();
        redisConfig.useSingleServer().setAddress(address);
        log.info("Connecting to Redis at {}", address);
        return Redisson.create(redisConfig);
    }
}
