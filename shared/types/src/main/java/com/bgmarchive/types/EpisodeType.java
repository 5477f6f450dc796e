package com.bgmarchive.types;

import java.util.Optional;

/**
 * Episode categories. Codes start at zero.
 */
public enum EpisodeType implements CodedEnum {
    MAIN(0, "main"),
    SPECIAL(1, "special"),
    OPENING(2, "opening"),
    ENDING(3, "ending"),
    TRAILER(4, "trailer"),
    FAN_WORK(5, "fan-work"),
    OTHER(6, "other");

    private final int code;
    private final String label;

    EpisodeType(int code, String label) {
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

    public static Optional<EpisodeType> lookup(int code) {
        for (EpisodeType t : values()) {
            if (t.code == code) return Optional.of(t);
        }
        return Optional.empty();
    }

    public static EpisodeType fromCode(int code) {
        return lookup(code).orElseThrow(
                () -> new IllegalArgumentException("Unknown EpisodeType code: " + code));
    }
}
