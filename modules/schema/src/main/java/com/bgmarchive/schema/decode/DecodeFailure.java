package com.bgmarchive.schema.decode;

import java.util.Objects;

/**
 * Why one line failed to decode.
 *
 * @param kind           failure category
 * @param field          dotted path of the offending field ({@code favorite.wish}, {@code tags[1].count}),
 *                       {@code $} for the root value, or null when the failure is not tied to a field
 * @param offendingValue raw JSON text of the offending value, or null when the field is missing
 * @param message        human readable detail
 */
public record DecodeFailure(
        FailureKind kind,
        String field,
        String offendingValue,
        String message
) {
    public DecodeFailure {
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(message, "message cannot be null");
    }

    static DecodeFailure of(FailureKind kind, String field, String offendingValue, String message) {
        return new DecodeFailure(kind, field, offendingValue, message);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(kind.name());
        if (field != null) sb.append(" at '").append(field).append('\'');
        if (offendingValue != null) sb.append(" value=").append(offendingValue);
        return sb.append(": ").append(message).toString();
    }
}
