package com.bgmarchive.schema.registry;

import com.bgmarchive.schema.api.FieldKind;
import com.bgmarchive.schema.api.Schema;
import com.bgmarchive.schema.api.UnknownFieldPolicy;
import com.bgmarchive.types.entity.Episode;
import com.bgmarchive.types.entity.Person;
import com.bgmarchive.types.entity.SubjectPerson;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class SchemaRegistryTest {

    private final SchemaRegistry registry = SchemaRegistry.defaultRegistry();

    @Test
    void shouldServeEveryMember() {
        for (EntityType type : EntityType.values()) {
            assertThat(registry.schemaFor(type.memberName()))
                    .as(type.memberName())
                    .hasValueSatisfying(s -> assertThat(s.recordType()).isEqualTo(type.recordType()));
        }
        assertThat(registry.memberNames()).hasSize(EntityType.values().length);
    }

    @Test
    void shouldReturnEmptyForUnknownMember() {
        assertThat(registry.schemaFor("staff.jsonlines")).isEmpty();
        assertThat(registry.revisions("staff.jsonlines")).isEmpty();
    }

    @Test
    void shouldServeNewestRevisionByDefault() {
        Schema<Person> person = registry.schemaFor(EntityType.PERSON, Person.class);
        assertThat(person.revision()).isEqualTo(2);
        assertThat(person.unknownFieldPolicy()).isEqualTo(UnknownFieldPolicy.STRICT);

        Schema<SubjectPerson> subjectPerson = registry.schemaFor(EntityType.SUBJECT_PERSON, SubjectPerson.class);
        assertThat(subjectPerson.field("position"))
                .hasValueSatisfying(f -> assertThat(f.kind()).isEqualTo(FieldKind.ENUM));
    }

    @Test
    void shouldKeepAllRevisionsOldestFirst() {
        assertThat(registry.revisions("person.jsonlines"))
                .extracting(Schema::revision)
                .containsExactly(1, 2);
        assertThat(registry.revisions("episode.jsonlines")).hasSize(1);
    }

    @Test
    void shouldRejectMismatchedRecordType() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> registry.schemaFor(EntityType.EPISODE, Person.class))
                .withMessageContaining("Episode");
    }

    @Test
    void shouldActivatePinnedRevision() {
        SchemaRegistry custom = SchemaRegistry.builder()
                .registerAll(ArchiveSchemas.all())
                .activate("subject-persons.jsonlines", 1)
                .build();

        Schema<SubjectPerson> schema = custom.schemaFor(EntityType.SUBJECT_PERSON, SubjectPerson.class);
        assertThat(schema.revision()).isEqualTo(1);
        assertThat(schema.isStrict()).isFalse();
    }

    @Test
    void shouldRejectDuplicateRevision() {
        assertThatIllegalStateException()
                .isThrownBy(() -> SchemaRegistry.builder()
                        .register(ArchiveSchemas.EPISODE)
                        .register(ArchiveSchemas.EPISODE))
                .withMessageContaining("episode.jsonlines");
    }

    @Test
    void shouldRejectActivationOfMissingRevision() {
        SchemaRegistry.Builder builder = SchemaRegistry.builder()
                .register(ArchiveSchemas.EPISODE)
                .activate("episode.jsonlines", 3);

        assertThatIllegalStateException().isThrownBy(builder::build);
    }

    @Test
    void shouldRejectSchemaWithoutMember() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> SchemaRegistry.builder().register(ArchiveSchemas.TAG));
    }

    @Test
    void customRegistryShouldOnlyServeRegisteredMembers() {
        SchemaRegistry custom = SchemaRegistry.builder().register(ArchiveSchemas.EPISODE).build();

        assertThat(custom.memberNames()).containsExactly("episode.jsonlines");
        assertThat(custom.schemaFor(EntityType.EPISODE, Episode.class)).isSameAs(ArchiveSchemas.EPISODE);
        assertThatIllegalStateException()
                .isThrownBy(() -> custom.schemaFor(EntityType.PERSON, Person.class));
    }

    @Test
    void entityTypeShouldResolveByMemberName() {
        assertThat(EntityType.fromMemberName("subject-relations.jsonlines")).contains(EntityType.SUBJECT_RELATION);
        assertThat(EntityType.fromMemberName("nope.jsonlines")).isEmpty();
        assertThat(EntityType.PERSON_CHARACTER.reportKey()).isEqualTo("person_characters");
    }
}
