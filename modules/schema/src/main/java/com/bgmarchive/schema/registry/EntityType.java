package com.bgmarchive.schema.registry;

import com.bgmarchive.types.entity.Character;
import com.bgmarchive.types.entity.Episode;
import com.bgmarchive.types.entity.Person;
import com.bgmarchive.types.entity.PersonCharacter;
import com.bgmarchive.types.entity.Subject;
import com.bgmarchive.types.entity.SubjectCharacter;
import com.bgmarchive.types.entity.SubjectPerson;
import com.bgmarchive.types.entity.SubjectRelation;
import com.bgmarchive.types.entity.WikiRecord;

import java.util.Optional;

/**
 * Record kinds stored in an archive, one member file each.
 */
public enum EntityType {
    SUBJECT("subject.jsonlines", "subjects", Subject.class),
    PERSON("person.jsonlines", "persons", Person.class),
    CHARACTER("character.jsonlines", "characters", Character.class),
    EPISODE("episode.jsonlines", "episodes", Episode.class),
    SUBJECT_RELATION("subject-relations.jsonlines", "subject_relations", SubjectRelation.class),
    SUBJECT_PERSON("subject-persons.jsonlines", "subject_persons", SubjectPerson.class),
    SUBJECT_CHARACTER("subject-characters.jsonlines", "subject_characters", SubjectCharacter.class),
    PERSON_CHARACTER("person-characters.jsonlines", "person_characters", PersonCharacter.class);

    private final String memberName;
    private final String reportKey;
    private final Class<? extends WikiRecord> recordType;

    EntityType(String memberName, String reportKey, Class<? extends WikiRecord> recordType) {
        this.memberName = memberName;
        this.reportKey = reportKey;
        this.recordType = recordType;
    }

    public String memberName() {
        return memberName;
    }

    /**
     * Plural key used in tallies and reports, e.g. {@code subject_relations}.
     */
    public String reportKey() {
        return reportKey;
    }

    public Class<? extends WikiRecord> recordType() {
        return recordType;
    }

    public static Optional<EntityType> fromMemberName(String memberName) {
        for (EntityType t : values()) {
            if (t.memberName.equals(memberName)) return Optional.of(t);
        }
        return Optional.empty();
    }
}
