package com.bgmarchive.schema.decode;

import java.util.Objects;

/**
 * Outcome of decoding one line: a typed record or a categorized failure.
 */
public sealed interface DecodeResult<T> {

    record Decoded<T>(T record) implements DecodeResult<T> {
        public Decoded {
            Objects.requireNonNull(record, "record cannot be null");
        }
    }

    record Failed<T>(DecodeFailure failure) implements DecodeResult<T> {
        public Failed {
            Objects.requireNonNull(failure, "failure cannot be null");
        }
    }

    static <T> DecodeResult<T> decoded(T record) {
        return new Decoded<>(record);
    }

    static <T> DecodeResult<T> failed(DecodeFailure failure) {
        return new Failed<>(failure);
    }

    default boolean isDecoded() {
        return this instanceof Decoded;
    }
}
