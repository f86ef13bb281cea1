package com.coursepath.common.codec;

import com.coursepath.common.errorsor.ErrorsOr;

import java.util.List;

public interface Codec<From, To> {

    ErrorsOr<To> encode(From from);

    ErrorsOr<From> decode(To to);

    /** One item per line; blank lines are skipped when decoding. */
    static <T> Codec<List<T>, String> lines(Codec<T, String> itemCodec) {
        return new LineSeparatedListCodec<>(itemCodec);
    }
}
