package com.iksanov.kvcache.common.util;

import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;

public final class HashUtils {

    public static final int DIGEST_LENGTH = 32;

    private HashUtils() {}

    /**
     * Fixed-length lowercase hex digest of the raw key, used as a filesystem-safe locator.
     * MD5 is used as a locator only, never for integrity. Collisions are accepted rather than detected.
     */
    public static String digest(String key) {
        if (key == null) throw new IllegalArgumentException("key is null");

        return Hashing.md5()
                .hashString(key, StandardCharsets.UTF_8)
                .toString();
    }
}
