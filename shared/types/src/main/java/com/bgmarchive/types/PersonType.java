package com.bgmarchive.types;

import java.util.Optional;

/**
 * Kind of a person entry: a single individual, a company or a group.
 */
public enum PersonType implements CodedEnum {
    OTHER(0, "other"),
    INDIVIDUAL(1, "individual"),
    COMPANY(2, "company"),
    ASSOCIATION(3, "association");

    private final int code;
    private final String label;

    PersonType(int code, String label) {
        this.code = code;
        this.label = label;
    }

    @Override
    public int code() {
        return code;
    }

    @Override
    public String label() {
        return label;
    }

    public static Optional<PersonType> lookup(int code) {
        for (PersonType t : values()) {
            if (t.code == code) return Optional.of(t);
        }
        return Optional.empty();
    }

    public static PersonType fromCode(int code) {
        return lookup(code).orElseThrow(
                () -> new IllegalArgumentException("Unknown PersonType code: " + code));
    }
}
