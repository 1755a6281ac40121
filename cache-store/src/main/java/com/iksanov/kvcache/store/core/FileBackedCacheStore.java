package com.iksanov.kvcache.store.core;

import com.iksanov.kvcache.common.codec.FileEntryCodec;
import com.iksanov.kvcache.common.dto.CacheRecord;
import com.iksanov.kvcache.common.exception.SerializationException;
import com.iksanov.kvcache.common.expiration.ExpirationPolicy;
import com.iksanov.kvcache.common.util.HashUtils;
import com.iksanov.kvcache.common.util.KeyValidator;
import com.iksanov.kvcache.store.metrics.CacheMetrics;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One file per key under a storage root, named by the key digest plus the codec extension.
 * <p>
 * Each file holds a whole encoded {@link CacheRecord}. Reads are lazy about expiry: an expired
 * record is deleted by the read that finds it. Writes hold an exclusive {@link FileLock} for the
 * whole write; nothing else guards against other processes.
 * <p>
 * Failure policy:
 * <ul>
 *   <li>an undecodable file surfaces from {@link #get} as
 *       {@link com.iksanov.kvcache.common.exception.CorruptRecordException}, it is not treated as a miss;</li>
 *   <li>a failed read surfaces as {@link UncheckedIOException};</li>
 *   <li>failed writes and unlinks are logged and reported through the boolean result.</li>
 * </ul>
 */
public abstract class FileBackedCacheStore implements CacheStore {

    private static final Logger log = LoggerFactory.getLogger(FileBackedCacheStore.class);
    private final Path directory;
    private final FileEntryCodec codec;
    private final ExpirationPolicy expirationPolicy;
    private final CacheMetrics metrics;

    protected FileBackedCacheStore(Path directory, FileEntryCodec codec, ExpirationPolicy expirationPolicy,
                                   CacheMetrics metrics) throws IOException {
        this.directory = directory;
        this.codec = codec;
        this.expirationPolicy = expirationPolicy;
        this.metrics = metrics;
        Files.createDirectories(directory);
        log.info("{} initialized at {}", getClass().getSimpleName(), directory);
    }

    @Override
    public Object get(String key, Object defaultValue) {
        KeyValidator.validate(key);
        Timer.Sample sample = metrics.startGetTimer();

        try {
            Path file = pathFor(key);
            byte[] bytes = readIfPresent(file);
            if (bytes == null) {
                metrics.recordMiss();
                return defaultValue;
            }

            CacheRecord record = codec.decode(bytes);
            if (expirationPolicy.isLive(record)) {
                metrics.recordHit();
                return record.value();
            }

            log.debug("Entry for key '{}' expired at {}, removing {}", key, record.expiresAt(), file.getFileName());
            metrics.recordExpiration();
            metrics.recordMiss();
            delete(key);
            return defaultValue;
        } finally {
            metrics.stopGetTimer(sample);
        }
    }

    @Override
    public boolean set(String key, Object value, Duration ttl) {
        KeyValidator.validate(key);
        Timer.Sample sample = metrics.startSetTimer();

        try {
            CacheRecord record = new CacheRecord(value, expirationPolicy.absoluteExpiry(ttl));
            return writeExclusively(pathFor(key), codec.encode(record));
        } finally {
            metrics.stopSetTimer(sample);
        }
    }

    @Override
    public boolean delete(String key) {
        KeyValidator.validate(key);
        Path file = pathFor(key);
        if (!Files.exists(file)) return false;

        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed to delete cache file {}: {}", file, e.getMessage());
            return false;
        }
    }

    /**
     * Always {@code true}; individual unlink failures are only logged.
     */
    @Override
    public boolean clear() {
        purge(directory);
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            log.warn("Failed to recreate cache directory {}: {}", directory, e.getMessage());
        }
        log.info("Cache cleared at {}", directory);
        return true;
    }

    /**
     * A stored {@code null} is reported as absent.
     */
    @Override
    public boolean has(String key) {
        KeyValidator.validate(key);
        return get(key) != null;
    }

    @Override
    public Map<String, Object> getMultiple(Iterable<String> keys, Object defaultValue) {
        List<String> keyList = KeyValidator.validateAll(keys);
        Map<String, Object> result = new LinkedHashMap<>();
        for (String key : keyList) {
            result.put(key, get(key, defaultValue));
        }
        return result;
    }

    /**
     * Best effort: every entry is written independently and the result does not reflect
     * individual failures. A value the codec cannot encode is logged and skipped.
     */
    @Override
    public boolean setMultiple(Map<String, ?> values, Duration ttl) {
        KeyValidator.validateAll(values);
        int failed = 0;
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            try {
                if (!set(entry.getKey(), entry.getValue(), ttl)) failed++;
            } catch (SerializationException e) {
                log.warn("setMultiple: skipping key '{}': {}", entry.getKey(), e.getMessage());
                failed++;
            }
        }
        if (failed > 0) log.debug("setMultiple: {} of {} entries were not written", failed, values.size());
        return true;
    }

    /**
     * Best effort, same as {@link #setMultiple}.
     */
    @Override
    public boolean deleteMultiple(Iterable<String> keys) {
        List<String> keyList = KeyValidator.validateAll(keys);
        for (String key : keyList) {
            delete(key);
        }
        return true;
    }

    public Path getDirectory() {
        return directory;
    }

    Path pathFor(String key) {
        return directory.resolve(HashUtils.digest(key) + codec.fileExtension());
    }

    /**
     * Removes the stored entries under {@code root}. The root itself is recreated afterwards.
     */
    protected abstract void purge(Path root);

    protected static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to delete {}: {}", path, e.getMessage());
        }
    }

    private static byte[] readIfPresent(Path file) {
        if (!Files.exists(file)) return null;
        try {
            return Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read cache file " + file, e);
        }
    }

    private static boolean writeExclusively(Path file, byte[] bytes) {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
             FileLock lock = channel.lock()) {
            channel.truncate(0);
            ByteBuffer buffer = ByteBuffer.wrap(bytes);
            int written = 0;
            while (buffer.hasRemaining()) {
                written += channel.write(buffer);
            }
            channel.force(true);
            return written == bytes.length;
        } catch (IOException e) {
            log.warn("Failed to write cache file {}: {}", file, e.getMessage());
            return false;
        }
    }
}
