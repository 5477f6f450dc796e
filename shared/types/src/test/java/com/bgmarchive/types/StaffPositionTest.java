package com.bgmarchive.types;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class StaffPositionTest {

    @Test
    void eachSubjectTypeOwnsADisjointRange() {
        for (StaffPosition p : StaffPosition.values()) {
            int thousands = p.code() / 1000;
            SubjectType expected = switch (thousands) {
                case 0 -> SubjectType.ANIME;
                case 1 -> SubjectType.GAME;
                case 2 -> SubjectType.BOOK;
                case 3 -> SubjectType.MUSIC;
                case 4 -> SubjectType.REAL;
                default -> null;
            };
            assertThat(p.subjectType()).as(p.name()).isEqualTo(expected);
        }
    }

    @Test
    void codesShouldBeUnique() {
        Set<Integer> seen = new HashSet<>();
        for (StaffPosition p : StaffPosition.values()) {
            assertThat(seen.add(p.code())).as("duplicate code %d", p.code()).isTrue();
        }
    }

    @Test
    void shouldLookUpByCode() {
        assertThat(StaffPosition.fromCode(2)).isEqualTo(StaffPosition.DIRECTOR);
        assertThat(StaffPosition.fromCode(2001)).isEqualTo(StaffPosition.BOOK_AUTHOR);
        assertThat(StaffPosition.DIRECTOR.appliesTo(SubjectType.ANIME)).isTrue();
        assertThat(StaffPosition.DIRECTOR.appliesTo(SubjectType.REAL)).isFalse();
        assertThat(StaffPosition.lookup(999)).isEmpty();
    }
}
