package com.coursepath.common.codec;

import com.coursepath.common.errorsor.ErrorsOr;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;

import java.util.Objects;

/**
 * JSON codec for one target type, generic types included (e.g. {@code Map<String, Map<String, Course>>}).
 * Reader and writer are bound once; both are immutable and thread safe.
 */
public final class JacksonTypedJsonCodec<T> implements Codec<T, String> {
    private final ObjectReader reader;
    private final ObjectWriter writer;

    public JacksonTypedJsonCodec(ObjectMapper mapper, TypeReference<T> type) {
        Objects.requireNonNull(type, "type");
        this.reader = Objects.requireNonNull(mapper, "mapper").readerFor(type);
        this.writer = mapper.writerFor(type);
    }

    @Override
    public ErrorsOr<String> encode(T value) {
        try {
            return ErrorsOr.lift(writer.writeValueAsString(value));
        } catch (Exception e) {
            return ErrorsOr.error("Failed to encode to JSON: " + e.getMessage());
        }
    }

    @Override
    public ErrorsOr<T> decode(String json) {
        try {
            return ErrorsOr.lift(reader.readValue(json));
        } catch (Exception e) {
            return ErrorsOr.error("Failed to decode from JSON: " + e.getMessage());
        }
    }
}
