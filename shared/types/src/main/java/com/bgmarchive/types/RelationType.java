package com.bgmarchive.types;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Relation between two subjects.
 *
 * <p>The code space is namespaced by the type of the parent subject. Codes 1-99 form the
 * generic table shared by anime, real, book and game subjects; 1000-1099 redefine
 * relations for books, 3000-3099 for music and 4000-4099 for games. A relation record is
 * only meaningful for the namespace of its parent subject, but that pairing is a property
 * of two records and is not checked when a single line is decoded.
 */
public enum RelationType implements CodedEnum {
    ADAPTATION(1, null, "adaptation"),
    PREQUEL(2, null, "prequel"),
    SEQUEL(3, null, "sequel"),
    SUMMARY(4, null, "summary"),
    FULL_STORY(5, null, "full story"),
    SIDE_STORY(6, null, "side story"),
    CHARACTER(7, null, "character"),
    SAME_SETTING(8, null, "same setting"),
    ALTERNATIVE_SETTING(9, null, "alternative setting"),
    ALTERNATIVE_VERSION(10, null, "alternative version"),
    SPIN_OFF(11, null, "spin-off"),
    PARENT_STORY(12, null, "parent story"),
    COLLABORATION(14, null, "collaboration"),
    OTHER(99, null, "other"),

    BOOK_SERIES(1002, SubjectType.BOOK, "series"),
    BOOK_OFFPRINT(1003, SubjectType.BOOK, "offprint"),
    BOOK_ALBUM(1004, SubjectType.BOOK, "album"),
    BOOK_PREQUEL(1005, SubjectType.BOOK, "prequel"),
    BOOK_SEQUEL(1006, SubjectType.BOOK, "sequel"),
    BOOK_SIDE_STORY(1007, SubjectType.BOOK, "side story"),
    BOOK_PARENT_STORY(1008, SubjectType.BOOK, "parent story"),
    BOOK_ALTERNATIVE_VERSION(1010, SubjectType.BOOK, "alternative version"),
    BOOK_CHARACTER(1011, SubjectType.BOOK, "character"),
    BOOK_SAME_SETTING(1012, SubjectType.BOOK, "same setting"),
    BOOK_ALTERNATIVE_SETTING(1013, SubjectType.BOOK, "alternative setting"),
    BOOK_COLLABORATION(1014, SubjectType.BOOK, "collaboration"),
    BOOK_ALTERNATIVE_RENDITION(1015, SubjectType.BOOK, "alternative rendition"),
    BOOK_OTHER(1099, SubjectType.BOOK, "other"),

    MUSIC_SOUNDTRACK(3001, SubjectType.MUSIC, "original soundtrack"),
    MUSIC_CHARACTER_SONG(3002, SubjectType.MUSIC, "character song"),
    MUSIC_OPENING_SONG(3003, SubjectType.MUSIC, "opening song"),
    MUSIC_ENDING_SONG(3004, SubjectType.MUSIC, "ending song"),
    MUSIC_INSERT_SONG(3005, SubjectType.MUSIC, "insert song"),
    MUSIC_IMAGE_SONG(3006, SubjectType.MUSIC, "image song"),
    MUSIC_DRAMA(3007, SubjectType.MUSIC, "drama"),
    MUSIC_OTHER(3099, SubjectType.MUSIC, "other"),

    GAME_PREQUEL(4002, SubjectType.GAME, "prequel"),
    GAME_SEQUEL(4003, SubjectType.GAME, "sequel"),
    GAME_SIDE_STORY(4006, SubjectType.GAME, "side story"),
    GAME_CHARACTER(4007, SubjectType.GAME, "character"),
    GAME_SAME_SETTING(4008, SubjectType.GAME, "same setting"),
    GAME_ALTERNATIVE_SETTING(4009, SubjectType.GAME, "alternative setting"),
    GAME_ALTERNATIVE_VERSION(4010, SubjectType.GAME, "alternative version"),
    GAME_PARENT_STORY(4012, SubjectType.GAME, "parent story"),
    GAME_COLLABORATION(4014, SubjectType.GAME, "collaboration"),
    GAME_EXPANSION(4015, SubjectType.GAME, "expansion"),
    GAME_VERSION(4016, SubjectType.GAME, "version"),
    GAME_MAIN_GAME(4017, SubjectType.GAME, "main game"),
    GAME_COLLECTION(4018, SubjectType.GAME, "collection"),
    GAME_IN_COLLECTION(4019, SubjectType.GAME, "in collection"),
    GAME_OTHER(4099, SubjectType.GAME, "other");

    /** Subject types that use the generic 1-99 table. */
    private static final Set<SubjectType> GENERIC_OWNERS =
            EnumSet.of(SubjectType.ANIME, SubjectType.REAL, SubjectType.BOOK, SubjectType.GAME);

    private final int code;
    private final SubjectType namespace;
    private final String label;

    RelationType(int code, SubjectType namespace, String label) {
        this.code = code;
        this.namespace = namespace;
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

    /**
     * Subject type owning this member's code range; empty for the generic table.
     */
    public Optional<SubjectType> namespace() {
        return Optional.ofNullable(namespace);
    }

    /**
     * Whether this relation is meaningful for a parent subject of the given type.
     */
    public boolean appliesTo(SubjectType subjectType) {
        if (namespace == null) {
            return GENERIC_OWNERS.contains(subjectType);
        }
        return namespace == subjectType;
    }

    public static Optional<RelationType> lookup(int code) {
        for (RelationType t : values()) {
            if (t.code == code) return Optional.of(t);
        }
        return Optional.empty();
    }

    public static RelationType fromCode(int code) {
        return lookup(code).orElseThrow(
                () -> new IllegalArgumentException("Unknown RelationType code: " + code));
    }
}
