package com.bgmarchive.schema.api;

import com.bgmarchive.types.CodedEnum;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Closed set of integer codes an {@link FieldKind#ENUM} field may take.
 *
 * <p>Membership is global: for namespaced enumerations every member of every
 * namespace is accepted.
 */
public final class EnumDomain<E extends Enum<E> & CodedEnum> {

    private final String name;
    private final Class<E> type;
    private final Map<Integer, E> byCode;

    private EnumDomain(String name, Class<E> type) {
        this.name = name;
        this.type = type;
        Map<Integer, E> codes = new LinkedHashMap<>();
        for (E member : EnumSet.allOf(type)) {
            E existing = codes.put(member.code(), member);
            if (existing != null) {
                throw new IllegalStateException(
                        "Duplicate code " + member.code() + " in " + name + ": " + existing + " and " + member);
            }
        }
        this.byCode = Collections.unmodifiableMap(codes);
    }

    public static <E extends Enum<E> & CodedEnum> EnumDomain<E> of(Class<E> type) {
        Objects.requireNonNull(type, "type cannot be null");
        return new EnumDomain<>(type.getSimpleName(), type);
    }

    public String name() {
        return name;
    }

    public Class<E> type() {
        return type;
    }

    public Optional<E> lookup(int code) {
        return Optional.ofNullable(byCode.get(code));
    }

    public boolean contains(int code) {
        return byCode.containsKey(code);
    }

    public Set<Integer> codes() {
        return byCode.keySet();
    }

    @Override
    public String toString() {
        return "EnumDomain[" + name + ", " + byCode.size() + " codes]";
    }
}
