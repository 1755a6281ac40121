package com.iksanov.kvcache.store.remote;

import org.redisson.api.BatchOptions;
import org.redisson.api.BatchResult;
import org.redisson.api.RBatch;
import org.redisson.api.RBucket;
import org.redisson.api.RBucketAsync;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.Codec;
import org.redisson.client.codec.StringCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * {@link RemoteStore} backed by a Redisson client. Values go through the given codec,
 * {@link StringCodec} by default. Redisson exceptions are not caught.
 * <p>
 * Redisson reports a failed command by throwing rather than by a status reply, so the
 * acknowledgements returned here are synthesized: {@link #OK} for every command that got a
 * reply, {@code "NO_REPLY"} for the rest. A rejected pipeline surfaces as the exception thrown by
 * {@link RBatch#execute()}.
 * <p>
 * The adapter owns the client; {@link #close()} shuts it down.
 */
public class RedissonRemoteStore implements RemoteStore {

    private static final Logger log = LoggerFactory.getLogger(RedissonRemoteStore.class);
    private final RedissonClient client;
    private final Codec codec;

    public RedissonRemoteStore(RedissonClient client) {
        this(client, StringCodec.INSTANCE);
    }

    public RedissonRemoteStore(RedissonClient client, Codec codec) {
        this.client = client;
        this.codec = codec;
    }

    @Override
    public Object get(String key) {
        RBucket<Object> bucket = client.getBucket(key, codec);
        return bucket.get();
    }

    @Override
    public String set(String key, Object value, Long ttlSeconds) {
        RBucket<Object> bucket = client.getBucket(key, codec);
        if (ttlSeconds == null) {
            bucket.set(value);
        } else {
            bucket.set(value, ttlSeconds, TimeUnit.SECONDS);
        }
        return OK;
    }

    @Override
    public long del(Collection<String> keys) {
        return client.getKeys().delete(keys.toArray(new String[0]));
    }

    @Override
    public List<Object> mget(List<String> keys) {
        Map<String, Object> found = client.getBuckets(codec).get(keys.toArray(new String[0]));
        List<Object> values = new ArrayList<>(keys.size());
        for (String key : keys) {
            values.add(found.get(key));
        }
        return values;
    }

    @Override
    public boolean exists(String key) {
        return client.getKeys().countExists(key) > 0;
    }

    @Override
    public String flushAll() {
        client.getKeys().flushall();
        return OK;
    }

    @Override
    public List<String> pipelineSet(List<PipelinedSet> commands) {
        RBatch batch = client.createBatch(BatchOptions.defaults());
        for (PipelinedSet command : commands) {
            RBucketAsync<Object> bucket = batch.getBucket(command.key(), codec);
            if (command.ttlSeconds() == null) {
                bucket.setAsync(command.value());
            } else {
                bucket.setAsync(command.value(), command.ttlSeconds(), TimeUnit.SECONDS);
            }
        }

        BatchResult<?> result = batch.execute();
        int replies = result.getResponses().size();
        List<String> acks = new ArrayList<>(commands.size());
        for (int i = 0; i < commands.size(); i++) {
            acks.add(i < replies ? OK : "NO_REPLY");
        }
        log.debug("Pipelined {} SET commands, {} replies", commands.size(), replies);
        return acks;
    }

    @Override
    public void close() {
        client.shutdown();
        log.info("Redisson client shut down");
    }
}
