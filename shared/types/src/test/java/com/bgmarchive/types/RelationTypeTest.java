package com.bgmarchive.types;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class RelationTypeTest {

    @Test
    void shouldLookUpCodesAcrossAllNamespaces() {
        assertThat(RelationType.fromCode(3)).isEqualTo(RelationType.SEQUEL);
        assertThat(RelationType.fromCode(1003)).isEqualTo(RelationType.BOOK_OFFPRINT);
        assertThat(RelationType.fromCode(3001)).isEqualTo(RelationType.MUSIC_SOUNDTRACK);
        assertThat(RelationType.fromCode(4002)).isEqualTo(RelationType.GAME_PREQUEL);
    }

    @Test
    void shouldRejectUnknownCode() {
        assertThat(RelationType.lookup(2000)).isEmpty();
        assertThatIllegalArgumentException()
                .isThrownBy(() -> RelationType.fromCode(2000))
                .withMessageContaining("2000");
    }

    @Test
    void codesShouldBeUnique() {
        Set<Integer> seen = new HashSet<>();
        for (RelationType t : RelationType.values()) {
            assertThat(seen.add(t.code())).as("duplicate code %d", t.code()).isTrue();
        }
    }

    @Test
    void namespacedCodesShouldStayInTheirRange() {
        for (RelationType t : RelationType.values()) {
            int code = t.code();
            if (t.namespace().isEmpty()) {
                assertThat(code).isBetween(1, 99);
                continue;
            }
            switch (t.namespace().get()) {
                case BOOK -> assertThat(code).isBetween(1000, 1099);
                case MUSIC -> assertThat(code).isBetween(3000, 3099);
                case GAME -> assertThat(code).isBetween(4000, 4099);
                default -> fail("unexpected namespace for " + t);
            }
        }
    }

    @Test
    void genericMembersApplyToEveryTypeButMusic() {
        assertThat(RelationType.SEQUEL.appliesTo(SubjectType.ANIME)).isTrue();
        assertThat(RelationType.SEQUEL.appliesTo(SubjectType.BOOK)).isTrue();
        assertThat(RelationType.SEQUEL.appliesTo(SubjectType.GAME)).isTrue();
        assertThat(RelationType.SEQUEL.appliesTo(SubjectType.REAL)).isTrue();
        assertThat(RelationType.SEQUEL.appliesTo(SubjectType.MUSIC)).isFalse();
    }

    @Test
    void namespacedMembersApplyOnlyToTheirOwner() {
        assertThat(RelationType.MUSIC_OPENING_SONG.appliesTo(SubjectType.MUSIC)).isTrue();
        assertThat(RelationType.MUSIC_OPENING_SONG.appliesTo(SubjectType.ANIME)).isFalse();
        assertThat(RelationType.GAME_EXPANSION.namespace()).contains(SubjectType.GAME);
    }
}
