package com.bgmarchive.schema.registry;

import com.bgmarchive.schema.api.Schema;
import org.jboss.logging.Logger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable lookup from member file name to the schema that decodes it.
 *
 * <p>Every registered revision is kept; exactly one per member is active and served by
 * {@link #schemaFor(String)}. Unless a builder says otherwise, the highest revision is active.
 */
public final class SchemaRegistry {

    private static final Logger log = Logger.getLogger(SchemaRegistry.class);

    private final Map<String, List<Schema<?>>> revisions;
    private final Map<String, Schema<?>> active;

    private SchemaRegistry(Map<String, List<Schema<?>>> revisions, Map<String, Schema<?>> active) {
        this.revisions = revisions;
        this.active = active;
    }

    /**
     * The registry holding every archive schema, built once per process.
     */
    public static SchemaRegistry defaultRegistry() {
        return DefaultHolder.INSTANCE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Schema<?>> schemaFor(String memberName) {
        return Optional.ofNullable(active.get(memberName));
    }

    public Optional<Schema<?>> schemaFor(EntityType entityType) {
        return schemaFor(entityType.memberName());
    }

    /**
     * Typed lookup of the active schema for an entity.
     *
     * @throws IllegalArgumentException if {@code recordType} does not match the schema's record type
     * @throws IllegalStateException    if no schema is registered for the entity
     */
    @SuppressWarnings("unchecked")
    public <T> Schema<T> schemaFor(EntityType entityType, Class<T> recordType) {
        Schema<?> schema = schemaFor(entityType).orElseThrow(() ->
                new IllegalStateException("No schema registered for " + entityType.memberName()));
        if (!recordType.equals(schema.recordType())) {
            throw new IllegalArgumentException("Schema " + schema + " decodes "
                    + schema.recordType().getSimpleName() + ", not " + recordType.getSimpleName());
        }
        return (Schema<T>) schema;
    }

    /**
     * All revisions registered for a member, oldest first. Empty for unknown members.
     */
    public List<Schema<?>> revisions(String memberName) {
        return revisions.getOrDefault(memberName, List.of());
    }

    public Set<String> memberNames() {
        return active.keySet();
    }

    public static final class Builder {

        private final Map<String, TreeMap<Integer, Schema<?>>> byMember = new LinkedHashMap<>();
        private final Map<String, Integer> pinned = new LinkedHashMap<>();

        private Builder() {}

        public Builder register(Schema<?> schema) {
            Objects.requireNonNull(schema, "schema cannot be null");
            String member = schema.memberName().orElseThrow(() ->
                    new IllegalArgumentException("Schema " + schema + " has no member name"));
            Schema<?> existing = byMember.computeIfAbsent(member, k -> new TreeMap<>())
                    .putIfAbsent(schema.revision(), schema);
            if (existing != null) {
                throw new IllegalStateException("Duplicate revision " + schema.revision() + " for " + member);
            }
            return this;
        }

        public Builder registerAll(Iterable<? extends Schema<?>> schemas) {
            for (Schema<?> schema : schemas) {
                register(schema);
            }
            return this;
        }

        /**
         * Serves {@code revision} for the member instead of the highest one.
         */
        public Builder activate(String memberName, int revision) {
            pinned.put(memberName, revision);
            return this;
        }

        public SchemaRegistry build() {
            Map<String, List<Schema<?>>> revisions = new LinkedHashMap<>();
            Map<String, Schema<?>> active = new LinkedHashMap<>();

            for (var entry : byMember.entrySet()) {
                String member = entry.getKey();
                List<Schema<?>> all = List.copyOf(entry.getValue().values());
                revisions.put(member, all);

                Schema<?> chosen;
                Integer revision = pinned.get(member);
                if (revision != null) {
                    chosen = entry.getValue().get(revision);
                    if (chosen == null) {
                        throw new IllegalStateException("Cannot activate revision " + revision
                                + " of " + member + ": not registered");
                    }
                } else {
                    chosen = entry.getValue().lastEntry().getValue();
                }
                active.put(member, chosen);
                log.debugf("Active schema for %s: %s (%d revisions)", member, chosen, all.size());
            }

            for (String member : pinned.keySet()) {
                if (!byMember.containsKey(member)) {
                    throw new IllegalStateException("Cannot activate unknown member " + member);
                }
            }

            return new SchemaRegistry(Collections.unmodifiableMap(revisions),
                    Collections.unmodifiableMap(active));
        }
    }

    private static final class DefaultHolder {
        static final SchemaRegistry INSTANCE = builder()
                .registerAll(ArchiveSchemas.all())
                .build();
    }
}
