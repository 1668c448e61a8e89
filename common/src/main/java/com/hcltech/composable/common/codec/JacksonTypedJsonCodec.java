package com.hcltech.composable.common.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hcltech.composable.common.errorsor.ErrorsOr;

import java.util.Objects;

public final class JacksonTypedJsonCodec<T> implements Codec<T, String> {
    private final ObjectMapper mapper;
    private final Class<T> klass;

    public JacksonTypedJsonCodec(Class<T> klass) {
        this.mapper = new ObjectMapper();
        this.mapper.findAndRegisterModules();
        this.klass = Objects.requireNonNull(klass);
    }

    @Override
    public ErrorsOr<String> encode(T value) {
        try {
            return ErrorsOr.lift(mapper.writeValueAsString(value));
        } catch (Exception e) {
            return ErrorsOr.error("Failed to encode " + klass.getSimpleName() + " to JSON: " + e.getMessage());
        }
    }

    @Override
    public ErrorsOr<T> decode(String json) {
        try {
            return ErrorsOr.lift(mapper.readValue(json, klass));
        } catch (Exception e) {
            return ErrorsOr.error("Failed to decode " + klass.getSimpleName() + " from JSON: " + e.getMessage());
        }
    }
}
