package com.bgmarchive.types;

import java.util.Optional;

/**
 * Top level subject categories. Code 5 is unused upstream.
 */
public enum SubjectType implements CodedEnum {
    BOOK(1, "book"),
    ANIME(2, "anime"),
    MUSIC(3, "music"),
    GAME(4, "game"),
    REAL(6, "real");

    private final int code;
    private final String label;

    SubjectType(int code, String label) {
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

    public static Optional<SubjectType> lookup(int code) {
        for (SubjectType t : values()) {
            if (t.code == code) return Optional.of(t);
        }
        return Optional.empty();
    }

    public static SubjectType fromCode(int code) {
        return lookup(code).orElseThrow(
                () -> new IllegalArgumentException("Unknown SubjectType code: " + code));
    }
}
