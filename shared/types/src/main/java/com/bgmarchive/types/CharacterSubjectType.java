package com.bgmarchive.types;

import java.util.Optional;

/**
 * How prominently a character appears in a subject.
 */
public enum CharacterSubjectType implements CodedEnum {
    MAIN(1, "main"),
    SUPPORTING(2, "supporting"),
    GUEST(3, "guest");

    private final int code;
    private final String label;

    CharacterSubjectType(int code, String label) {
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

    public static Optional<CharacterSubjectType> lookup(int code) {
        for (CharacterSubjectType t : values()) {
            if (t.code == code) return Optional.of(t);
        }
        return Optional.empty();
    }

    public static CharacterSubjectType fromCode(int code) {
        return lookup(code).orElseThrow(
                () -> new IllegalArgumentException("Unknown CharacterSubjectType code: " + code));
    }
}
