package com.bgmarchive.schema.decode;

/**
 * Categories of per-line decode failures, in the order the decoder checks for them.
 */
public enum FailureKind {
    /** Line is not valid UTF-8. */
    ENCODING,
    /** Line is not a single well-formed JSON value. */
    SYNTAX,
    /** Required field missing, or a value of the wrong kind. */
    SCHEMA_VIOLATION,
    /** Enumerated field carries a code outside its domain. */
    UNKNOWN_ENUM_VALUE,
    /** Strict schema met a field it does not declare. */
    UNEXPECTED_FIELD
}
