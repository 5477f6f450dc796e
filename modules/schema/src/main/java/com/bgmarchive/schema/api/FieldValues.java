package com.bgmarchive.schema.api;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Validated, converted values of one decoded JSON object, keyed by field name.
 *
 * <p>Values are already in their Java form: {@code Integer}, {@code Double}, {@code String},
 * {@code Boolean}, an enum constant, a {@code List<String>}, or the bound record of a nested
 * schema (and lists of those). Absent optional fields map to null, or to an empty list
 * for list kinds.
 */
public final class FieldValues {

    private final Map<String, Object> values;

    public FieldValues(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public boolean isPresent(String name) {
        return values.get(name) != null;
    }

    public Object get(String name) {
        if (!values.containsKey(name)) {
            throw new IllegalArgumentException("No such field: " + name);
        }
        return values.get(name);
    }

    public int getInt(String name) {
        return (Integer) get(name);
    }

    public int getInt(String name, int defaultValue) {
        Object v = get(name);
        return v == null ? defaultValue : (Integer) v;
    }

    public double getDouble(String name) {
        return (Double) get(name);
    }

    public String getString(String name) {
        return (String) get(name);
    }

    public boolean getBoolean(String name) {
        return (Boolean) get(name);
    }

    public <E extends Enum<E>> E getEnum(String name, Class<E> type) {
        return type.cast(get(name));
    }

    public <N> N getObject(String name, Class<N> type) {
        return type.cast(get(name));
    }

    @SuppressWarnings("unchecked")
    public List<String> getStringList(String name) {
        return (List<String>) get(name);
    }

    @SuppressWarnings("unchecked")
    public <N> List<N> getList(String name, Class<N> elementType) {
        return (List<N>) get(name);
    }
}
