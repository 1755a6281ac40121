package com.iksanov.kvcache.store.core;

import com.iksanov.kvcache.common.codec.JsonEntryCodec;
import com.iksanov.kvcache.common.expiration.ExpirationPolicy;
import com.iksanov.kvcache.store.metrics.CacheMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * File store writing readable {@code <digest>.json} files.
 * Only JSON-representable values survive a round trip; see {@link JsonEntryCodec}.
 * {@link #clear()} removes the {@code *.json} files of the root and leaves anything else alone.
 */
public class JsonFileCacheStore extends FileBackedCacheStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileCacheStore.class);

    public JsonFileCacheStore(Path directory) throws IOException {
        this(directory, new ExpirationPolicy(), new CacheMetrics());
    }

    public JsonFileCacheStore(Path directory, ExpirationPolicy expirationPolicy, CacheMetrics metrics) throws IOException {
        super(directory, new JsonEntryCodec(), expirationPolicy, metrics);
    }

    @Override
    protected void purge(Path root) {
        if (!Files.isDirectory(root)) return;

        int removed = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(root, "*.json")) {
            for (Path file : files) {
                deleteQuietly(file);
                removed++;
            }
        } catch (IOException e) {
            log.warn("Failed to list cache directory {}: {}", root, e.getMessage());
        }
        log.debug("Purged {} json files under {}", removed, root);
    }
}
