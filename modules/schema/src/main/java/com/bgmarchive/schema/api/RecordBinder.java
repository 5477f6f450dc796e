package com.bgmarchive.schema.api;

/**
 * Turns validated field values into the typed record of a schema.
 *
 * <p>Runs only after every field passed its kind, domain and unknown-field checks.
 * May throw {@link IllegalArgumentException} for cross-field constraints the
 * record type enforces itself.
 */
@FunctionalInterface
public interface RecordBinder<T> {

    T bind(FieldValues values);
}
