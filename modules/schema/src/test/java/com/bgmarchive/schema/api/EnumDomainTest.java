package com.bgmarchive.schema.api;

import com.bgmarchive.types.RelationType;
import com.bgmarchive.types.SubjectType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class EnumDomainTest {

    @Test
    void shouldLookUpByCode() {
        EnumDomain<SubjectType> domain = EnumDomain.of(SubjectType.class);

        assertThat(domain.name()).isEqualTo("SubjectType");
        assertThat(domain.lookup(6)).contains(SubjectType.REAL);
        assertThat(domain.lookup(5)).isEmpty();
        assertThat(domain.contains(1)).isTrue();
        assertThat(domain.codes()).containsExactlyInAnyOrder(1, 2, 3, 4, 6);
    }

    @Test
    void shouldCoverEveryNamespace() {
        EnumDomain<RelationType> domain = EnumDomain.of(RelationType.class);

        assertThat(domain.codes()).hasSize(RelationType.values().length);
        assertThat(domain.lookup(4015)).contains(RelationType.GAME_EXPANSION);
        assertThat(domain.contains(2000)).isFalse();
    }
}
