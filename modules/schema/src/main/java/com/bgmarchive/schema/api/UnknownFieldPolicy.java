package com.bgmarchive.schema.api;

/**
 * What the decoder does with JSON members a schema does not declare.
 */
public enum UnknownFieldPolicy {
    /** Undeclared members are ignored. */
    PERMISSIVE,
    /** Any undeclared member fails the line. */
    STRICT
}
