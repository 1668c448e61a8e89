package com.hcltech.composable.common.codec;

import com.hcltech.composable.common.errorsor.ErrorsOr;

public interface Codec<From, To> {

    ErrorsOr<To> encode(From from);

    ErrorsOr<From> decode(To to);

    static <T> Codec<T, String> clazzCodec(Class<T> klass) {
        return new JacksonTypedJsonCodec<>(klass);
    }
}
