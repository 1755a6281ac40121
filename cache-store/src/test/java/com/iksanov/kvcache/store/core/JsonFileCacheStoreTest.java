package com.iksanov.kvcache.store.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.iksanov.kvcache.common.exception.CorruptRecordException;
import com.iksanov.kvcache.common.exception.InvalidCacheKeyException;
import com.iksanov.kvcache.common.exception.SerializationException;
import com.iksanov.kvcache.common.expiration.ExpirationPolicy;
import com.iksanov.kvcache.common.util.HashUtils;
import com.iksanov.kvcache.store.metrics.CacheMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link JsonFileCacheStore}: readable {@code <digest>.json} files.
 */
@DisplayName("JsonFileCacheStore - JSON file store tests")
class JsonFileCacheStoreTest {

    private static final long START = 1_700_000_000L;

    @TempDir
    Path root;

    private MutableClock clock;
    private JsonFileCacheStore cache;

    @BeforeEach
    void setUp() throws IOException {
        clock = new MutableClock(Instant.ofEpochSecond(START));
        cache = new JsonFileCacheStore(root, new ExpirationPolicy(clock), new CacheMetrics());
    }

    private long jsonFiles() throws IOException {
        try (Stream<Path> files = Files.list(root)) {
            return files.filter(p -> p.toString().endsWith(".json")).count();
        }
    }

    @Test
    @DisplayName("Files should be named <digest>.json and hold value and expiration")
    void shouldWriteReadableFile() throws IOException {
        cache.set("user:1", Map.of("name", "Alice"), Duration.ofSeconds(60));

        Path file = root.resolve(HashUtils.digest("user:1") + ".json");
        assertThat(cache.pathFor("user:1")).isEqualTo(file);

        JsonNode json = new ObjectMapper().readTree(file.toFile());
        assertThat(json.get("value").get("name").asText()).isEqualTo("Alice");
        assertThat(json.get("expiration").longValue()).isEqualTo(START + 60);
    }

    @Test
    @DisplayName("Permanent entries should be written with a null expiration")
    void shouldWriteNullExpiration() throws IOException {
        cache.set("forever", "x");

        JsonNode json = new ObjectMapper().readTree(cache.pathFor("forever").toFile());
        assertThat(json.get("expiration").isNull()).isTrue();
    }

    @Test
    @DisplayName("set() then get() should round-trip JSON-representable values")
    void shouldRoundTripJsonValues() {
        Map<String, Object> profile = Map.of("name", "Alice", "roles", List.of("admin", "dev"), "active", true);

        cache.set("profile", profile);
        cache.set("count", 7);
        cache.set("text", "hello");

        assertThat(cache.get("profile")).isEqualTo(profile);
        assertThat(cache.get("count")).isEqualTo(7);
        assertThat(cache.get("text")).isEqualTo("hello");
    }

    @Test
    @DisplayName("Values JSON cannot represent should be refused")
    void shouldRefuseUnrepresentableValues() {
        assertThatThrownBy(() -> cache.set("odd", new Object())).isInstanceOf(SerializationException.class);
        assertThat(cache.has("odd")).isFalse();
    }

    @Test
    @DisplayName("Expired entries should return the default and lose their file")
    void shouldExpireAfterTtl() {
        cache.set("temp", "data", Duration.ofSeconds(1));
        assertThat(cache.get("temp")).isEqualTo("data");

        clock.advance(Duration.ofSeconds(2));

        assertThat(cache.get("temp", "default")).isEqualTo("default");
        assertThat(cache.pathFor("temp")).doesNotExist();
    }

    @Test
    @DisplayName("A tampered file should surface CorruptRecordException instead of the default")
    void shouldSurfaceTamperedFile() throws IOException {
        cache.set("key", "value");
        Files.writeString(cache.pathFor("key"), "{\"value\": \"value\", \"expir");

        assertThatThrownBy(() -> cache.get("key", "default")).isInstanceOf(CorruptRecordException.class);
        assertThatThrownBy(() -> cache.has("key")).isInstanceOf(CorruptRecordException.class);
    }

    @Test
    @DisplayName("A hand-edited but well-formed file should be honoured")
    void shouldReadHandEditedFile() throws IOException {
        Files.writeString(cache.pathFor("edited"), "{\"value\": [1, 2, 3], \"expiration\": " + (START - 1) + "}");
        assertThat(cache.get("edited", "expired")).isEqualTo("expired");

        Files.writeString(cache.pathFor("edited"), "{\"value\": [1, 2, 3], \"expiration\": null}");
        assertThat(cache.get("edited")).isEqualTo(List.of(1, 2, 3));
    }

    @Test
    @DisplayName("clear() should remove only json files and be idempotent")
    void shouldClearOnlyJsonFiles() throws IOException {
        cache.set("a", 1);
        cache.set("b", 2);
        Path foreign = Files.writeString(root.resolve("notes.txt"), "keep me");

        assertThat(cache.clear()).isTrue();
        assertThat(cache.clear()).isTrue();

        assertThat(jsonFiles()).isZero();
        assertThat(foreign).exists();
    }

    @Test
    @DisplayName("getMultiple() should fill defaults and preserve input order")
    void shouldGetMultipleInOrder() {
        cache.set("b", "bee");

        assertThat(cache.getMultiple(List.of("a", "b", "c"), 0))
                .containsExactly(entry("a", 0), entry("b", "bee"), entry("c", 0));
    }

    @Test
    @DisplayName("Batch writes and deletes should report true")
    void shouldRunBatches() {
        assertThat(cache.setMultiple(Map.of("x", 1, "y", 2), Duration.ofSeconds(30))).isTrue();
        assertThat(cache.getMultiple(List.of("x", "y"))).containsEntry("x", 1).containsEntry("y", 2);

        assertThat(cache.deleteMultiple(List.of("x", "y", "z"))).isTrue();
        assertThat(cache.has("x")).isFalse();
    }

    @Test
    @DisplayName("Empty key should be rejected without creating a file")
    void shouldRejectEmptyKey() throws IOException {
        assertThatThrownBy(() -> cache.set("", "value")).isInstanceOf(InvalidCacheKeyException.class);
        assertThatThrownBy(() -> cache.get("")).isInstanceOf(InvalidCacheKeyException.class);

        assertThat(jsonFiles()).isZero();
    }

    @Test
    @DisplayName("Batch operations should accept a single-pass iterable")
    void shouldAcceptSinglePassIterable() {
        cache.set("b", "bee");

        Iterable<String> lookup = Stream.of("a", "b", "c")::iterator;
        assertThat(cache.getMultiple(lookup, 0)).containsExactly(
                entry("a", 0), entry("b", "bee"), entry("c", 0));

        Iterable<String> removal = Stream.of("b")::iterator;
        assertThat(cache.deleteMultiple(removal)).isTrue();
        assertThat(cache.has("b")).isFalse();
    }

    @Test
    @DisplayName("setMultiple() should skip an unencodable value and still write the others")
    void shouldSkipUnencodableValueInBatch() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("x", 1);
        values.put("bad", new Object());
        values.put("z", 3);

        assertThat(cache.setMultiple(values)).isTrue();

        assertThat(cache.get("x")).isEqualTo(1);
        assertThat(cache.has("bad")).isFalse();
        assertThat(cache.get("z")).isEqualTo(3);
    }
}
