package com.iksanov.kvcache.store.remote;

public record PipelinedSet(String key, Object value, Long ttlSeconds) {
}
