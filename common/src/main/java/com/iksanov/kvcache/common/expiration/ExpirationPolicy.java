package com.iksanov.kvcache.common.expiration;

import com.iksanov.kvcache.common.dto.CacheRecord;

import java.time.Clock;
import java.time.Duration;

/**
 * Turns a TTL into an absolute expiry and tells whether a record is still live.
 * <p>
 * Time is tracked in whole epoch seconds. Zero and negative TTLs are accepted as they are:
 * they yield an expiry at or before the current second, so a negative TTL is already
 * expired on the next read. The boundary is inclusive, a record whose expiry equals
 * the current second is still live.
 */
public class ExpirationPolicy {

    private final Clock clock;

    public ExpirationPolicy() {
        this(Clock.systemUTC());
    }

    public ExpirationPolicy(Clock clock) {
        this.clock = clock;
    }

    /**
     * Saturates at the {@code long} range instead of wrapping when the TTL is too large to add.
     */
    public Long absoluteExpiry(Duration ttl) {
        if (ttl == null) return null;
        try {
            return Math.addExact(nowSeconds(), ttl.getSeconds());
        } catch (ArithmeticException e) {
            return ttl.isNegative() ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
    }

    public boolean isLive(CacheRecord record) {
        return record.expiresAt() == null || record.expiresAt() >= nowSeconds();
    }

    public long nowSeconds() {
        return clock.instant().getEpochSecond();
    }
}
