package com.bgmarchive.reader;

import com.bgmarchive.reader.stream.RecordFailure;
import com.bgmarchive.schema.registry.EntityType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable snapshot of the failures collected per entity type.
 */
public final class FailureReport {

    private static final FailureReport EMPTY = new FailureReport(Map.of());

    private final Map<EntityType, List<RecordFailure>> failures;

    private FailureReport(Map<EntityType, List<RecordFailure>> failures) {
        this.failures = failures;
    }

    public static FailureReport empty() {
        return EMPTY;
    }

    /**
     * Copies {@code failures}, dropping entity types with none.
     */
    public static FailureReport of(Map<EntityType, ? extends Iterable<RecordFailure>> failures) {
        Map<EntityType, List<RecordFailure>> copy = new EnumMap<>(EntityType.class);
        for (var entry : failures.entrySet()) {
            List<RecordFailure> list = new ArrayList<>();
            entry.getValue().forEach(list::add);
            if (!list.isEmpty()) {
                copy.put(entry.getKey(), List.copyOf(list));
            }
        }
        return copy.isEmpty() ? EMPTY : new FailureReport(Collections.unmodifiableMap(copy));
    }

    /**
     * Failures of one entity type in encounter order; empty if there were none.
     */
    public List<RecordFailure> failures(EntityType entityType) {
        return failures.getOrDefault(entityType, List.of());
    }

    public List<RecordFailure> first(EntityType entityType, int n) {
        if (n < 0) {
            throw new IllegalArgumentException("n must be >= 0, got: " + n);
        }
        List<RecordFailure> all = failures(entityType);
        return all.size() <= n ? all : all.subList(0, n);
    }

    /**
     * Distinct raw offending values in first-seen order. Missing fields contribute nothing.
     */
    public Set<String> distinctOffendingValues(EntityType entityType) {
        Set<String> values = new LinkedHashSet<>();
        for (RecordFailure f : failures(entityType)) {
            if (f.offendingValue() != null) {
                values.add(f.offendingValue());
            }
        }
        return Collections.unmodifiableSet(values);
    }

    public int totalFailures() {
        int total = 0;
        for (List<RecordFailure> list : failures.values()) {
            total += list.size();
        }
        return total;
    }

    public boolean isEmpty() {
        return failures.isEmpty();
    }

    /**
     * Entity types with at least one failure, in declaration order.
     */
    public Map<EntityType, List<RecordFailure>> asMap() {
        return failures;
    }

    @Override
    public String toString() {
        return "FailureReport[" + totalFailures() + " failures across " + failures.size() + " entity types]";
    }
}
