package com.bgmarchive.schema.api;

/**
 * Value kinds a schema field can declare.
 */
public enum FieldKind {
    /** JSON integral number within 32-bit range. */
    INTEGER,
    /** Any JSON number, bound as a double. */
    NUMBER,
    STRING,
    BOOLEAN,
    /** Integer code that must belong to the field's {@link EnumDomain}. */
    ENUM,
    STRING_LIST,
    /** Nested JSON object validated against the field's nested schema. */
    OBJECT,
    OBJECT_LIST;

    public boolean isList() {
        return this == STRING_LIST || this == OBJECT_LIST;
    }

    public boolean isObject() {
        return this == OBJECT || this == OBJECT_LIST;
    }
}
