package com.bgmarchive.schema.api;

import java.util.Objects;

/**
 * Declared shape of one field of a {@link Schema}.
 *
 * @param name         JSON member name
 * @param required     whether the member must be present and non-null
 * @param kind         value kind
 * @param domain       enumeration domain, only for {@link FieldKind#ENUM}
 * @param nested       nested schema, only for {@link FieldKind#OBJECT} and {@link FieldKind#OBJECT_LIST}
 * @param coerceDigits whether an {@link FieldKind#INTEGER} field also accepts a digit string such as {@code "12"}
 */
public record FieldSpec(
        String name,
        boolean required,
        FieldKind kind,
        EnumDomain<?> domain,
        Schema<?> nested,
        boolean coerceDigits
) {
    public FieldSpec {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(kind, "kind cannot be null");
        if ((kind == FieldKind.ENUM) != (domain != null)) {
            throw new IllegalArgumentException("Field '" + name + "': a domain is required for ENUM fields and only for them");
        }
        if (kind.isObject() != (nested != null)) {
            throw new IllegalArgumentException("Field '" + name + "': a nested schema is required for object fields and only for them");
        }
        if (coerceDigits && kind != FieldKind.INTEGER) {
            throw new IllegalArgumentException("Field '" + name + "': digit coercion only applies to INTEGER fields");
        }
    }

    public static FieldSpec required(String name, FieldKind kind) {
        return new FieldSpec(name, true, kind, null, null, false);
    }

    public static FieldSpec optional(String name, FieldKind kind) {
        return new FieldSpec(name, false, kind, null, null, false);
    }

    public static FieldSpec enumerated(String name, EnumDomain<?> domain) {
        return new FieldSpec(name, true, FieldKind.ENUM, domain, null, false);
    }

    public static FieldSpec object(String name, Schema<?> nested, boolean required) {
        return new FieldSpec(name, required, FieldKind.OBJECT, null, nested, false);
    }

    public static FieldSpec objectList(String name, Schema<?> nested, boolean required) {
        return new FieldSpec(name, required, FieldKind.OBJECT_LIST, null, nested, false);
    }

    /**
     * Optional integer that also accepts a digit string, defaulting to absent.
     */
    public static FieldSpec digitKeyedCount(String name) {
        return new FieldSpec(name, false, FieldKind.INTEGER, null, null, true);
    }
}
