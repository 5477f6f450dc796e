package com.bgmarchive.types;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class CodedEnumTest {

    @Test
    void episodeTypesStartAtZero() {
        assertThat(EpisodeType.fromCode(0)).isEqualTo(EpisodeType.MAIN);
        assertThat(EpisodeType.fromCode(5)).isEqualTo(EpisodeType.FAN_WORK);
        assertThat(EpisodeType.FAN_WORK.label()).isEqualTo("fan-work");
    }

    @Test
    void subjectTypeSkipsCodeFive() {
        assertThat(SubjectType.lookup(5)).isEmpty();
        assertThat(SubjectType.fromCode(6)).isEqualTo(SubjectType.REAL);
    }

    @Test
    void personTypeAcceptsZero() {
        assertThat(PersonType.fromCode(0)).isEqualTo(PersonType.OTHER);
    }

    @Test
    void unknownCodesAreRejected() {
        assertThatIllegalArgumentException().isThrownBy(() -> CharacterRole.fromCode(0));
        assertThatIllegalArgumentException().isThrownBy(() -> CharacterSubjectType.fromCode(4));
        assertThatIllegalArgumentException()
                .isThrownBy(() -> EpisodeType.fromCode(999))
                .withMessageContaining("Unknown EpisodeType code: 999");
    }
}
