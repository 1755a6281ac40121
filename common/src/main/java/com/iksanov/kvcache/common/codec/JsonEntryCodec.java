package com.iksanov.kvcache.common.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.iksanov.kvcache.common.dto.CacheRecord;
import com.iksanov.kvcache.common.exception.CorruptRecordException;
import com.iksanov.kvcache.common.exception.SerializationException;

import java.io.IOException;

/**
 * Human-readable encoding: a JSON object with exactly two fields.
 * <pre>
 * {"value": &lt;any JSON value&gt;, "expiration": &lt;epoch seconds&gt; | null}
 * </pre>
 * Values are limited to what JSON can carry. They come back as JSON types
 * (String, Integer/Long/Double, Boolean, List, Map or null), so a value of any other
 * Java type does not survive the round trip with its original type.
 */
public final class JsonEntryCodec implements FileEntryCodec {

    static final String VALUE_FIELD = "value";
    static final String EXPIRATION_FIELD = "expiration";

    private final ObjectMapper mapper;

    public JsonEntryCodec() {
        this(new ObjectMapper());
    }

    public JsonEntryCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public byte[] encode(CacheRecord record) {
        try {
            ObjectNode root = mapper.createObjectNode();
            root.set(VALUE_FIELD, mapper.valueToTree(record.value()));
            if (record.expiresAt() == null) {
                root.putNull(EXPIRATION_FIELD);
            } else {
                root.put(EXPIRATION_FIELD, record.expiresAt());
            }
            return mapper.writeValueAsBytes(root);
        } catch (IllegalArgumentException | JsonProcessingException e) {
            throw new SerializationException("Value is not JSON-representable: " + e.getMessage(), e);
        }
    }

    @Override
    public CacheRecord decode(byte[] bytes) {
        JsonNode root;
        try {
            root = mapper.readTree(bytes);
        } catch (IOException e) {
            throw new CorruptRecordException("Malformed JSON cache record", e);
        }
        if (root == null || !root.isObject()) throw new CorruptRecordException("JSON cache record must be an object");
        if (root.size() != 2 || !root.has(VALUE_FIELD) || !root.has(EXPIRATION_FIELD)) {
            throw new CorruptRecordException("JSON cache record must hold exactly 'value' and 'expiration'");
        }

        JsonNode expiration = root.get(EXPIRATION_FIELD);
        Long expiresAt;
        if (expiration.isNull()) {
            expiresAt = null;
        } else if (expiration.isIntegralNumber() && expiration.canConvertToLong()) {
            expiresAt = expiration.longValue();
        } else {
            throw new CorruptRecordException("Invalid expiration: " + expiration);
        }

        try {
            return new CacheRecord(mapper.treeToValue(root.get(VALUE_FIELD), Object.class), expiresAt);
        } catch (JsonProcessingException e) {
            throw new CorruptRecordException("Cannot read cached value", e);
        }
    }

    @Override
    public String fileExtension() {
        return ".json";
    }
}
