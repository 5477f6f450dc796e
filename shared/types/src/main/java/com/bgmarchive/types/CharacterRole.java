package com.bgmarchive.types;

import java.util.Optional;

/**
 * Role of a character entry.
 */
public enum CharacterRole implements CodedEnum {
    MAIN(1, "main"),
    SUPPORTING(2, "supporting"),
    GUEST(3, "guest"),
    OTHER(4, "other");

    private final int code;
    private final String label;

    CharacterRole(int code, String label) {
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

    public static Optional<CharacterRole> lookup(int code) {
        for (CharacterRole t : values()) {
            if (t.code == code) return Optional.of(t);
        }
        return Optional.empty();
    }

    public static CharacterRole fromCode(int code) {
        return lookup(code).orElseThrow(
                () -> new IllegalArgumentException("Unknown CharacterRole code: " + code));
    }
}
