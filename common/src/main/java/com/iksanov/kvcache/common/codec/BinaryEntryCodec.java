package com.iksanov.kvcache.common.codec;

import com.iksanov.kvcache.common.dto.CacheRecord;
import com.iksanov.kvcache.common.exception.CorruptRecordException;
import com.iksanov.kvcache.common.exception.SerializationException;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;

/**
 * Java object serialization of the whole record. Keeps the exact runtime type of the value,
 * byte arrays included, but only accepts {@link java.io.Serializable} payloads.
 */
public final class BinaryEntryCodec implements FileEntryCodec {

    @Override
    public byte[] encode(CacheRecord record) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
            out.writeObject(record);
        } catch (IOException e) {
            throw new SerializationException("Value is not serializable: " + typeOf(record.value()), e);
        }
        return bytes.toByteArray();
    }

    @Override
    public CacheRecord decode(byte[] bytes) {
        Object decoded;
        try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(bytes))) {
            decoded = in.readObject();
        } catch (IOException | ClassNotFoundException e) {
            throw new CorruptRecordException("Cannot decode cache record (" + bytes.length + " bytes)", e);
        }
        if (decoded instanceof CacheRecord record) return record;
        throw new CorruptRecordException("Unexpected record type: " + typeOf(decoded));
    }

    @Override
    public String fileExtension() {
        return "";
    }

    private static String typeOf(Object value) {
        return value == null ? "null" : value.getClass().getName();
    }
}
