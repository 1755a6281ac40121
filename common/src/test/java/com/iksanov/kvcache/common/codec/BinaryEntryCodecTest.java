package com.iksanov.kvcache.common.codec;

import com.iksanov.kvcache.common.dto.CacheRecord;
import com.iksanov.kvcache.common.exception.CorruptRecordException;
import com.iksanov.kvcache.common.exception.SerializationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class BinaryEntryCodecTest {

    private final BinaryEntryCodec codec = new BinaryEntryCodec();

    @Test
    @DisplayName("Should keep the exact value type, including non-text payloads")
    void shouldPreserveValueTypes() {
        byte[] raw = {0, 1, 2, (byte) 0xFF};
        CacheRecord bytes = codec.decode(codec.encode(new CacheRecord(raw, 1234L)));
        assertThat(bytes.value()).isInstanceOf(byte[].class);
        assertThat((byte[]) bytes.value()).containsExactly(raw);
        assertThat(bytes.expiresAt()).isEqualTo(1234L);

        List<Object> list = new ArrayList<>(List.of(1L, "two", 3.0));
        CacheRecord decoded = codec.decode(codec.encode(CacheRecord.permanent(list)));
        assertThat(decoded.value()).isInstanceOf(ArrayList.class).isEqualTo(list);
        assertThat(decoded.expiresAt()).isNull();

        LocalDate date = LocalDate.of(2024, 2, 29);
        assertThat(codec.decode(codec.encode(CacheRecord.permanent(date))).value()).isEqualTo(date);
    }

    @Test
    @DisplayName("Should carry a null value")
    void shouldCarryNullValue() {
        assertThat(codec.decode(codec.encode(CacheRecord.permanent(null))).value()).isNull();
    }

    @Test
    @DisplayName("Should refuse values that are not Serializable")
    void shouldRejectNonSerializableValue() {
        assertThatThrownBy(() -> codec.encode(CacheRecord.permanent(new Object())))
                .isInstanceOf(SerializationException.class)
                .isNotInstanceOf(CorruptRecordException.class);
    }

    @Test
    @DisplayName("Should report garbage and foreign objects as corrupt records")
    void shouldDetectCorruption() throws IOException {
        assertThatThrownBy(() -> codec.decode("not a record".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(CorruptRecordException.class);
        assertThatThrownBy(() -> codec.decode(new byte[0]))
                .isInstanceOf(CorruptRecordException.class);

        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
            out.writeObject("just a string");
        }
        assertThatThrownBy(() -> codec.decode(bytes.toByteArray()))
                .isInstanceOf(CorruptRecordException.class)
                .hasMessageContaining("java.lang.String");
    }

    @Test
    @DisplayName("Binary files carry no extension")
    void shouldUseNoExtension() {
        assertThat(codec.fileExtension()).isEmpty();
    }
}
