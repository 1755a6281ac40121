package com.iksanov.kvcache.store.remote;

import java.util.Collection;
import java.util.List;

/**
 * The slice of a Redis-compatible client the remote cache store relies on.
 * Connection handling, timeouts and the wire protocol belong to the implementation.
 * Closing releases the connection; no other call is valid afterwards.
 */
public interface RemoteStore extends AutoCloseable {

    String OK = "OK";

    Object get(String key);

    /**
     * SET, or SET EX when {@code ttlSeconds} is not null.
     *
     * @return the server status reply, {@link #OK} on success
     */
    String set(String key, Object value, Long ttlSeconds);

    /**
     * @return number of keys actually removed
     */
    long del(Collection<String> keys);

    /**
     * @return one value per requested key, in request order, null for missing keys
     */
    List<Object> mget(List<String> keys);

    boolean exists(String key);

    String flushAll();

    /**
     * Sends all SETs in a single round trip.
     *
     * @return one status reply per command, in command order
     */
    List<String> pipelineSet(List<PipelinedSet> commands);

    @Override
    void close();
}
