package com.iksanov.kvcache.store.core;

import com.iksanov.kvcache.common.codec.BinaryEntryCodec;
import com.iksanov.kvcache.common.expiration.ExpirationPolicy;
import com.iksanov.kvcache.store.metrics.CacheMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * File store using Java serialization, so values keep their exact type.
 * Files carry no extension. {@link #clear()} empties the whole storage root.
 */
public class FileCacheStore extends FileBackedCacheStore {

    private static final Logger log = LoggerFactory.getLogger(FileCacheStore.class);

    public FileCacheStore(Path directory) throws IOException {
        this(directory, new ExpirationPolicy(), new CacheMetrics());
    }

    public FileCacheStore(Path directory, ExpirationPolicy expirationPolicy, CacheMetrics metrics) throws IOException {
        super(directory, new BinaryEntryCodec(), expirationPolicy, metrics);
    }

    @Override
    protected void purge(Path root) {
        if (!Files.isDirectory(root)) return;

        List<Path> entries;
        try (Stream<Path> walk = Files.walk(root)) {
            // deepest first, so directories are empty when their turn comes
            entries = walk.filter(p -> !p.equals(root))
                    .sorted(Comparator.reverseOrder())
                    .collect(Collectors.toList());
        } catch (IOException e) {
            log.warn("Failed to list cache directory {}: {}", root, e.getMessage());
            return;
        }
        entries.forEach(FileBackedCacheStore::deleteQuietly);
        log.debug("Purged {} entries under {}", entries.size(), root);
    }
}
