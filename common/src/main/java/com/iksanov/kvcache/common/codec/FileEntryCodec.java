package com.iksanov.kvcache.common.codec;

import com.iksanov.kvcache.common.dto.CacheRecord;

/**
 * Encoding of a {@link CacheRecord} into the bytes of one cache file.
 */
public interface FileEntryCodec {

    /**
     * @throws com.iksanov.kvcache.common.exception.SerializationException if the value cannot be represented
     */
    byte[] encode(CacheRecord record);

    /**
     * @throws com.iksanov.kvcache.common.exception.CorruptRecordException if the bytes are not a record
     */
    CacheRecord decode(byte[] bytes);

    /** Suffix appended to the key digest, empty when files carry no extension. */
    String fileExtension();
}
