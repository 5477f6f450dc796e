package com.bgmarchive.types;

import java.util.Optional;

/**
 * Staff position of a person credited on a subject.
 *
 * <p>Each subject type owns a disjoint code range: anime 1-999, game 1000-1999,
 * book 2000-2999, music 3000-3999 and real 4000-4999.
 */
public enum StaffPosition implements CodedEnum {
    ORIGINAL_CREATOR(1, SubjectType.ANIME, "original creator"),
    DIRECTOR(2, SubjectType.ANIME, "director"),
    SCRIPT(3, SubjectType.ANIME, "script"),
    STORYBOARD(4, SubjectType.ANIME, "storyboard"),
    EPISODE_DIRECTOR(5, SubjectType.ANIME, "episode director"),
    MUSIC(6, SubjectType.ANIME, "music"),
    ORIGINAL_CHARACTER_DESIGN(7, SubjectType.ANIME, "original character design"),
    CHARACTER_DESIGN(8, SubjectType.ANIME, "character design"),
    LAYOUT(9, SubjectType.ANIME, "layout"),
    SERIES_COMPOSITION(10, SubjectType.ANIME, "series composition"),
    ART_DIRECTION(11, SubjectType.ANIME, "art direction"),
    COLOR_DESIGN(13, SubjectType.ANIME, "color design"),
    CHIEF_ANIMATION_DIRECTOR(14, SubjectType.ANIME, "chief animation director"),
    ANIMATION_DIRECTOR(15, SubjectType.ANIME, "animation director"),
    MECHANICAL_DESIGN(16, SubjectType.ANIME, "mechanical design"),
    DIRECTOR_OF_PHOTOGRAPHY(17, SubjectType.ANIME, "director of photography"),
    SUPERVISION(18, SubjectType.ANIME, "supervision"),
    PROP_DESIGN(19, SubjectType.ANIME, "prop design"),
    KEY_ANIMATION(20, SubjectType.ANIME, "key animation"),
    SECOND_KEY_ANIMATION(21, SubjectType.ANIME, "second key animation"),
    ANIMATION_CHECK(22, SubjectType.ANIME, "animation check"),
    ASSISTANT_PRODUCER(23, SubjectType.ANIME, "assistant producer"),
    ASSOCIATE_PRODUCER(24, SubjectType.ANIME, "associate producer"),
    BACKGROUND_ART(25, SubjectType.ANIME, "background art"),
    COLOR_SETTING(26, SubjectType.ANIME, "color setting"),
    DIGITAL_PAINT(27, SubjectType.ANIME, "digital paint"),
    EDITING(28, SubjectType.ANIME, "editing"),
    ORIGINAL_PLAN(29, SubjectType.ANIME, "original plan"),
    THEME_SONG_ARRANGEMENT(30, SubjectType.ANIME, "theme song arrangement"),
    THEME_SONG_COMPOSITION(31, SubjectType.ANIME, "theme song composition"),
    THEME_SONG_LYRICS(32, SubjectType.ANIME, "theme song lyrics"),
    THEME_SONG_PERFORMANCE(33, SubjectType.ANIME, "theme song performance"),
    INSERTED_SONG_PERFORMANCE(34, SubjectType.ANIME, "inserted song performance"),
    PLANNING(35, SubjectType.ANIME, "planning"),
    PLANNING_PRODUCER(36, SubjectType.ANIME, "planning producer"),
    PRODUCTION_MANAGER(37, SubjectType.ANIME, "production manager"),
    PUBLICITY(38, SubjectType.ANIME, "publicity"),
    RECORDING(39, SubjectType.ANIME, "recording"),
    RECORDING_ASSISTANT(40, SubjectType.ANIME, "recording assistant"),
    SERIES_DIRECTOR(41, SubjectType.ANIME, "series director"),
    PRODUCTION(42, SubjectType.ANIME, "production"),
    SETTING(43, SubjectType.ANIME, "setting"),
    SOUND_DIRECTOR(44, SubjectType.ANIME, "sound director"),
    SOUND(45, SubjectType.ANIME, "sound"),
    SOUND_EFFECTS(46, SubjectType.ANIME, "sound effects"),
    SPECIAL_EFFECTS(47, SubjectType.ANIME, "special effects"),
    ADR_DIRECTOR(48, SubjectType.ANIME, "ADR director"),
    CO_DIRECTOR(49, SubjectType.ANIME, "co-director"),
    BACKGROUND_SETTING(50, SubjectType.ANIME, "background setting"),
    IN_BETWEEN_ANIMATION(51, SubjectType.ANIME, "in-between animation"),
    EXECUTIVE_PRODUCER(52, SubjectType.ANIME, "executive producer"),
    PRODUCER(54, SubjectType.ANIME, "producer"),
    MUSIC_ASSISTANT(55, SubjectType.ANIME, "music assistant"),
    PRODUCTION_DESK(56, SubjectType.ANIME, "production desk"),
    CASTING_DIRECTOR(57, SubjectType.ANIME, "casting director"),
    CHIEF_PRODUCER(58, SubjectType.ANIME, "chief producer"),
    CO_PRODUCER(59, SubjectType.ANIME, "co-producer"),
    DIALOGUE_EDITING(60, SubjectType.ANIME, "dialogue editing"),
    POST_PRODUCTION_ASSISTANT(61, SubjectType.ANIME, "post-production assistant"),
    PRODUCTION_ASSISTANT(62, SubjectType.ANIME, "production assistant"),
    ANIME_PRODUCTION(63, SubjectType.ANIME, "production"),
    PRODUCTION_COORDINATION(64, SubjectType.ANIME, "production coordination"),
    MUSIC_WORK(65, SubjectType.ANIME, "music work"),
    SPECIAL_THANKS(66, SubjectType.ANIME, "special thanks"),
    ANIMATION_WORK(67, SubjectType.ANIME, "animation work"),
    CG_DIRECTOR(69, SubjectType.ANIME, "CG director"),
    MECHANICAL_ANIMATION_DIRECTOR(70, SubjectType.ANIME, "mechanical animation director"),
    ART_DESIGN(71, SubjectType.ANIME, "art design"),
    ASSISTANT_DIRECTOR(72, SubjectType.ANIME, "assistant director"),
    OP_ED_STORYBOARD(73, SubjectType.ANIME, "OP/ED storyboard"),
    CHIEF_DIRECTOR(74, SubjectType.ANIME, "chief director"),
    THREE_D_CG(75, SubjectType.ANIME, "3DCG"),
    WORK_ASSISTANCE(76, SubjectType.ANIME, "work assistance"),
    ACTION_ANIMATION_DIRECTOR(77, SubjectType.ANIME, "action animation director"),
    SUPERVISING_PRODUCER(80, SubjectType.ANIME, "supervising producer"),
    ASSISTANCE(81, SubjectType.ANIME, "assistance"),
    PHOTOGRAPHY(82, SubjectType.ANIME, "photography"),
    PRODUCTION_DESK_ASSISTANCE(83, SubjectType.ANIME, "production desk assistance"),
    DESIGN_MANAGER(84, SubjectType.ANIME, "design manager"),
    MUSIC_PRODUCER(85, SubjectType.ANIME, "music producer"),
    THREE_D_CG_DIRECTOR(86, SubjectType.ANIME, "3DCG director"),
    ANIMATION_PRODUCER(87, SubjectType.ANIME, "animation producer"),
    SPECIAL_EFFECTS_ANIMATION_DIRECTOR(88, SubjectType.ANIME, "special effects animation director"),
    MAIN_EPISODE_DIRECTOR(89, SubjectType.ANIME, "main episode director"),
    ASSISTANT_ANIMATION_DIRECTOR(90, SubjectType.ANIME, "assistant animation director"),
    EPISODE_DIRECTOR_ASSISTANT(91, SubjectType.ANIME, "episode director assistant"),
    MAIN_ANIMATOR(92, SubjectType.ANIME, "main animator"),

    GAME_DEVELOPER(1001, SubjectType.GAME, "developer"),
    GAME_PUBLISHER(1002, SubjectType.GAME, "publisher"),
    GAME_DESIGNER(1003, SubjectType.GAME, "game designer"),
    GAME_SCENARIO(1004, SubjectType.GAME, "scenario"),
    GAME_ART(1005, SubjectType.GAME, "art"),
    GAME_MUSIC(1006, SubjectType.GAME, "music"),
    GAME_LEVEL_DESIGN(1007, SubjectType.GAME, "level design"),
    GAME_CHARACTER_DESIGN(1008, SubjectType.GAME, "character design"),
    GAME_THEME_SONG_COMPOSITION(1009, SubjectType.GAME, "theme song composition"),
    GAME_THEME_SONG_LYRICS(1010, SubjectType.GAME, "theme song lyrics"),
    GAME_THEME_SONG_PERFORMANCE(1011, SubjectType.GAME, "theme song performance"),
    GAME_INSERTED_SONG_PERFORMANCE(1012, SubjectType.GAME, "inserted song performance"),
    GAME_ORIGINAL_ILLUSTRATION(1013, SubjectType.GAME, "original illustration"),
    GAME_ANIMATION_PRODUCTION(1014, SubjectType.GAME, "animation production"),
    GAME_ORIGINAL_CREATOR(1015, SubjectType.GAME, "original creator"),
    GAME_DIRECTOR(1016, SubjectType.GAME, "director"),
    GAME_ANIMATION_DIRECTOR(1017, SubjectType.GAME, "animation director"),
    GAME_EXECUTIVE_PRODUCER(1018, SubjectType.GAME, "executive producer"),
    GAME_QUALITY_ASSURANCE(1019, SubjectType.GAME, "quality assurance"),
    GAME_ANIMATION_SCRIPT(1020, SubjectType.GAME, "animation script"),
    GAME_PROGRAMMER(1021, SubjectType.GAME, "programmer"),
    GAME_ASSISTANCE(1022, SubjectType.GAME, "assistance"),
    GAME_CG_SUPERVISION(1023, SubjectType.GAME, "CG supervision"),
    GAME_SD_ILLUSTRATION(1024, SubjectType.GAME, "SD illustration"),
    GAME_BACKGROUND(1025, SubjectType.GAME, "background"),
    GAME_SUPERVISION(1026, SubjectType.GAME, "supervision"),
    GAME_SERIES_COMPOSITION(1027, SubjectType.GAME, "series composition"),
    GAME_PLANNING(1028, SubjectType.GAME, "planning"),
    GAME_MECHANICAL_DESIGN(1029, SubjectType.GAME, "mechanical design"),
    GAME_SOUND_DIRECTOR(1030, SubjectType.GAME, "sound director"),
    GAME_ART_DIRECTOR(1031, SubjectType.GAME, "art director"),
    GAME_PRODUCER(1032, SubjectType.GAME, "producer"),

    BOOK_AUTHOR(2001, SubjectType.BOOK, "author"),
    BOOK_ARTIST(2002, SubjectType.BOOK, "artist"),
    BOOK_ILLUSTRATOR(2003, SubjectType.BOOK, "illustrator"),
    BOOK_PUBLISHER(2004, SubjectType.BOOK, "publisher"),
    BOOK_MAGAZINE(2005, SubjectType.BOOK, "magazine"),
    BOOK_TRANSLATOR(2006, SubjectType.BOOK, "translator"),
    BOOK_ORIGINAL_CREATOR(2007, SubjectType.BOOK, "original creator"),
    BOOK_GUEST(2008, SubjectType.BOOK, "guest"),
    BOOK_ORIGINAL_CHARACTER_DESIGN(2009, SubjectType.BOOK, "original character design"),
    BOOK_SCRIPT(2010, SubjectType.BOOK, "script"),
    BOOK_LABEL(2011, SubjectType.BOOK, "label"),
    BOOK_PRESENTER(2012, SubjectType.BOOK, "presenter"),
    BOOK_IMPRINT(2013, SubjectType.BOOK, "imprint"),

    MUSIC_ARTIST(3001, SubjectType.MUSIC, "artist"),
    MUSIC_PRODUCER_CREDIT(3002, SubjectType.MUSIC, "producer"),
    MUSIC_COMPOSER(3003, SubjectType.MUSIC, "composer"),
    MUSIC_LABEL(3004, SubjectType.MUSIC, "label"),
    MUSIC_ORIGINAL_CREATOR(3005, SubjectType.MUSIC, "original creator"),
    MUSIC_LYRICIST(3006, SubjectType.MUSIC, "lyricist"),
    MUSIC_RECORDING(3007, SubjectType.MUSIC, "recording"),
    MUSIC_ARRANGER(3008, SubjectType.MUSIC, "arranger"),
    MUSIC_ILLUSTRATION(3009, SubjectType.MUSIC, "illustration"),
    MUSIC_SCRIPT(3010, SubjectType.MUSIC, "script"),
    MUSIC_PUBLISHER(3011, SubjectType.MUSIC, "publisher"),
    MUSIC_MASTERING(3012, SubjectType.MUSIC, "mastering"),
    MUSIC_MIXING(3013, SubjectType.MUSIC, "mixing"),
    MUSIC_INSTRUMENT(3014, SubjectType.MUSIC, "instrument"),
    MUSIC_VOCAL(3015, SubjectType.MUSIC, "vocal"),

    REAL_ORIGINAL_CREATOR(4001, SubjectType.REAL, "original creator"),
    REAL_DIRECTOR(4002, SubjectType.REAL, "director"),
    REAL_WRITER(4003, SubjectType.REAL, "writer"),
    REAL_MUSIC(4004, SubjectType.REAL, "music"),
    REAL_EXECUTIVE_PRODUCER(4005, SubjectType.REAL, "executive producer"),
    REAL_CO_EXECUTIVE_PRODUCER(4006, SubjectType.REAL, "co-executive producer"),
    REAL_PRODUCER(4007, SubjectType.REAL, "producer"),
    REAL_SUPERVISING_PRODUCER(4008, SubjectType.REAL, "supervising producer"),
    REAL_CO_PRODUCER(4009, SubjectType.REAL, "co-producer"),
    REAL_STORY(4010, SubjectType.REAL, "story"),
    REAL_STORY_EDITOR(4011, SubjectType.REAL, "story editor"),
    REAL_EDITOR(4012, SubjectType.REAL, "editor"),
    REAL_CREATIVE_DIRECTOR(4013, SubjectType.REAL, "creative director"),
    REAL_CINEMATOGRAPHY(4014, SubjectType.REAL, "cinematography"),
    REAL_THEME_SONG_PERFORMANCE(4015, SubjectType.REAL, "theme song performance"),
    REAL_STARRING(4016, SubjectType.REAL, "starring"),
    REAL_SUPPORTING_CAST(4017, SubjectType.REAL, "supporting cast"),
    REAL_PRODUCTION(4018, SubjectType.REAL, "production"),
    REAL_PRESENTER(4019, SubjectType.REAL, "presenter");

    private final int code;
    private final SubjectType subjectType;
    private final String label;

    StaffPosition(int code, SubjectType subjectType, String label) {
        this.code = code;
        this.subjectType = subjectType;
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

    public SubjectType subjectType() {
        return subjectType;
    }

    public boolean appliesTo(SubjectType type) {
        return subjectType == type;
    }

    public static Optional<StaffPosition> lookup(int code) {
        for (StaffPosition p : values()) {
            if (p.code == code) return Optional.of(p);
        }
        return Optional.empty();
    }

    public static StaffPosition fromCode(int code) {
        return lookup(code).orElseThrow(
                () -> new IllegalArgumentException("Unknown StaffPosition code: " + code));
    }
}
