package com.bgmarchive.schema.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Declared shape of a record kind: ordered fields, unknown-field policy and the binder
 * producing the typed record.
 *
 * <p>Schemas are plain data; one generic decoder interprets all of them. Top-level
 * schemas name the archive member they describe and carry a revision number so that
 * several revisions of the same entity can coexist. Nested schemas (objects embedded in
 * a record) have no member name.
 */
public final class Schema<T> {

    private final String entityName;
    private final String memberName;
    private final int revision;
    private final Class<T> recordType;
    private final List<FieldSpec> fields;
    private final Map<String, FieldSpec> byName;
    private final UnknownFieldPolicy unknownFieldPolicy;
    private final RecordBinder<T> binder;

    private Schema(Builder<T> builder) {
        this.entityName = builder.entityName;
        this.memberName = builder.memberName;
        this.revision = builder.revision;
        this.recordType = builder.recordType;
        this.fields = List.copyOf(builder.fields);
        this.byName = Collections.unmodifiableMap(new LinkedHashMap<>(builder.byName));
        this.unknownFieldPolicy = builder.unknownFieldPolicy;
        this.binder = builder.binder;
    }

    public static <T> Builder<T> builder(String entityName, Class<T> recordType) {
        return new Builder<>(entityName, recordType);
    }

    public String entityName() {
        return entityName;
    }

    /**
     * Archive member this schema describes; empty for nested schemas.
     */
    public Optional<String> memberName() {
        return Optional.ofNullable(memberName);
    }

    public int revision() {
        return revision;
    }

    public Class<T> recordType() {
        return recordType;
    }

    public List<FieldSpec> fields() {
        return fields;
    }

    public Optional<FieldSpec> field(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public boolean declares(String name) {
        return byName.containsKey(name);
    }

    public UnknownFieldPolicy unknownFieldPolicy() {
        return unknownFieldPolicy;
    }

    public boolean isStrict() {
        return unknownFieldPolicy == UnknownFieldPolicy.STRICT;
    }

    public T bind(FieldValues values) {
        return binder.bind(values);
    }

    @Override
    public String toString() {
        return memberName != null
                ? entityName + "@r" + revision + " (" + memberName + ", " + unknownFieldPolicy + ")"
                : entityName;
    }

    public static final class Builder<T> {
        private final String entityName;
        private final Class<T> recordType;
        private String memberName;
        private int revision = 1;
        private final List<FieldSpec> fields = new ArrayList<>();
        private final Map<String, FieldSpec> byName = new LinkedHashMap<>();
        private UnknownFieldPolicy unknownFieldPolicy = UnknownFieldPolicy.PERMISSIVE;
        private RecordBinder<T> binder;

        private Builder(String entityName, Class<T> recordType) {
            this.entityName = Objects.requireNonNull(entityName, "entityName cannot be null");
            this.recordType = Objects.requireNonNull(recordType, "recordType cannot be null");
        }

        public Builder<T> member(String memberName) {
            this.memberName = memberName;
            return this;
        }

        public Builder<T> revision(int revision) {
            if (revision < 1) {
                throw new IllegalArgumentException("revision must be >= 1, got: " + revision);
            }
            this.revision = revision;
            return this;
        }

        public Builder<T> strict() {
            this.unknownFieldPolicy = UnknownFieldPolicy.STRICT;
            return this;
        }

        public Builder<T> field(FieldSpec spec) {
            if (byName.putIfAbsent(spec.name(), spec) != null) {
                throw new IllegalStateException("Duplicate field '" + spec.name() + "' in " + entityName);
            }
            fields.add(spec);
            return this;
        }

        public Builder<T> required(String name, FieldKind kind) {
            return field(FieldSpec.required(name, kind));
        }

        public Builder<T> optional(String name, FieldKind kind) {
            return field(FieldSpec.optional(name, kind));
        }

        public Builder<T> enumerated(String name, EnumDomain<?> domain) {
            return field(FieldSpec.enumerated(name, domain));
        }

        public Schema<T> bind(RecordBinder<T> binder) {
            this.binder = Objects.requireNonNull(binder, "binder cannot be null");
            return new Schema<>(this);
        }
    }
}
