package com.bgmarchive.schema.registry;

import com.bgmarchive.schema.api.EnumDomain;
import com.bgmarchive.schema.api.FieldSpec;
import com.bgmarchive.schema.api.FieldValues;
import com.bgmarchive.schema.api.Schema;
import com.bgmarchive.types.CharacterRole;
import com.bgmarchive.types.CharacterSubjectType;
import com.bgmarchive.types.EpisodeType;
import com.bgmarchive.types.PersonType;
import com.bgmarchive.types.RelationType;
import com.bgmarchive.types.StaffPosition;
import com.bgmarchive.types.SubjectType;
import com.bgmarchive.types.entity.Character;
import com.bgmarchive.types.entity.Episode;
import com.bgmarchive.types.entity.Favorite;
import com.bgmarchive.types.entity.Person;
import com.bgmarchive.types.entity.PersonCharacter;
import com.bgmarchive.types.entity.ScoreDetails;
import com.bgmarchive.types.entity.Subject;
import com.bgmarchive.types.entity.SubjectCharacter;
import com.bgmarchive.types.entity.SubjectPerson;
import com.bgmarchive.types.entity.SubjectRelation;
import com.bgmarchive.types.entity.Tag;

import java.util.ArrayList;
import java.util.List;

import static com.bgmarchive.schema.api.FieldKind.BOOLEAN;
import static com.bgmarchive.schema.api.FieldKind.INTEGER;
import static com.bgmarchive.schema.api.FieldKind.NUMBER;
import static com.bgmarchive.schema.api.FieldKind.STRING;
import static com.bgmarchive.schema.api.FieldKind.STRING_LIST;

/**
 * The schema table for every member of the wiki archive, all known revisions included.
 *
 * <p>Where an entity has several revisions the newest one is active in
 * {@link SchemaRegistry#defaultRegistry()}.
 */
public final class ArchiveSchemas {

    private ArchiveSchemas() {}

    public static final EnumDomain<SubjectType> SUBJECT_TYPES = EnumDomain.of(SubjectType.class);
    public static final EnumDomain<PersonType> PERSON_TYPES = EnumDomain.of(PersonType.class);
    public static final EnumDomain<CharacterRole> CHARACTER_ROLES = EnumDomain.of(CharacterRole.class);
    public static final EnumDomain<EpisodeType> EPISODE_TYPES = EnumDomain.of(EpisodeType.class);
    public static final EnumDomain<RelationType> RELATION_TYPES = EnumDomain.of(RelationType.class);
    public static final EnumDomain<CharacterSubjectType> CHARACTER_SUBJECT_TYPES = EnumDomain.of(CharacterSubjectType.class);
    public static final EnumDomain<StaffPosition> STAFF_POSITIONS = EnumDomain.of(StaffPosition.class);

    // --- embedded value objects ---

    public static final Schema<Tag> TAG = Schema.builder("Tag", Tag.class)
            .required("name", STRING)
            .required("count", INTEGER)
            .bind(v -> new Tag(v.getString("name"), v.getInt("count")));

    public static final Schema<Favorite> FAVORITE = Schema.builder("Favorite", Favorite.class)
            .required("wish", INTEGER)
            .required("done", INTEGER)
            .required("doing", INTEGER)
            .required("on_hold", INTEGER)
            .required("dropped", INTEGER)
            .bind(v -> new Favorite(
                    v.getInt("wish"),
                    v.getInt("done"),
                    v.getInt("doing"),
                    v.getInt("on_hold"),
                    v.getInt("dropped")));

    /** Buckets are keyed "1".."10"; missing buckets count as zero. */
    public static final Schema<ScoreDetails> SCORE_DETAILS = scoreDetails();

    private static Schema<ScoreDetails> scoreDetails() {
        Schema.Builder<ScoreDetails> builder = Schema.builder("ScoreDetails", ScoreDetails.class);
        for (int score = 1; score <= ScoreDetails.BUCKETS; score++) {
            builder.field(FieldSpec.digitKeyedCount(String.valueOf(score)));
        }
        return builder.bind(v -> {
            List<Integer> buckets = new ArrayList<>(ScoreDetails.BUCKETS);
            for (int score = 1; score <= ScoreDetails.BUCKETS; score++) {
                buckets.add(v.getInt(String.valueOf(score), 0));
            }
            return new ScoreDetails(buckets);
        });
    }

    // --- primary entities ---

    public static final Schema<Subject> SUBJECT = Schema.builder("Subject", Subject.class)
            .member(EntityType.SUBJECT.memberName())
            .revision(1)
            .required("id", INTEGER)
            .enumerated("type", SUBJECT_TYPES)
            .required("name", STRING)
            .required("name_cn", STRING)
            .required("infobox", STRING)
            .required("platform", INTEGER)
            .required("summary", STRING)
            .required("nsfw", BOOLEAN)
            .field(FieldSpec.objectList("tags", TAG, false))
            .required("score", NUMBER)
            .field(FieldSpec.object("score_details", SCORE_DETAILS, false))
            .required("rank", INTEGER)
            .required("date", STRING)
            .field(FieldSpec.object("favorite", FAVORITE, true))
            .required("series", BOOLEAN)
            .optional("meta_tags", STRING)
            .bind(v -> new Subject(
                    v.getInt("id"),
                    v.getEnum("type", SubjectType.class),
                    v.getString("name"),
                    v.getString("name_cn"),
                    v.getString("infobox"),
                    v.getInt("platform"),
                    v.getString("summary"),
                    v.getBoolean("nsfw"),
                    v.getList("tags", Tag.class),
                    v.getDouble("score"),
                    v.getObject("score_details", ScoreDetails.class),
                    v.getInt("rank"),
                    v.getString("date"),
                    v.getObject("favorite", Favorite.class),
                    v.getBoolean("series"),
                    v.getString("meta_tags")));

    public static final Schema<Person> PERSON_R1 = person(1).bind(ArchiveSchemas::bindPerson);

    /** Current person revision: same fields, undeclared fields rejected. */
    public static final Schema<Person> PERSON_R2 = person(2).strict().bind(ArchiveSchemas::bindPerson);

    private static Schema.Builder<Person> person(int revision) {
        return Schema.builder("Person", Person.class)
                .member(EntityType.PERSON.memberName())
                .revision(revision)
                .required("id", INTEGER)
                .required("name", STRING)
                .enumerated("type", PERSON_TYPES)
                .optional("career", STRING_LIST)
                .required("infobox", STRING)
                .required("summary", STRING)
                .required("comments", INTEGER)
                .required("collects", INTEGER);
    }

    private static Person bindPerson(FieldValues v) {
        return new Person(
                v.getInt("id"),
                v.getString("name"),
                v.getEnum("type", PersonType.class),
                v.getStringList("career"),
                v.getString("infobox"),
                v.getString("summary"),
                v.getInt("comments"),
                v.getInt("collects"));
    }

    public static final Schema<Character> CHARACTER = Schema.builder("Character", Character.class)
            .member(EntityType.CHARACTER.memberName())
            .required("id", INTEGER)
            .enumerated("role", CHARACTER_ROLES)
            .required("name", STRING)
            .required("infobox", STRING)
            .required("summary", STRING)
            .required("comments", INTEGER)
            .required("collects", INTEGER)
            .bind(v -> new Character(
                    v.getInt("id"),
                    v.getEnum("role", CharacterRole.class),
                    v.getString("name"),
                    v.getString("infobox"),
                    v.getString("summary"),
                    v.getInt("comments"),
                    v.getInt("collects")));

    public static final Schema<Episode> EPISODE = Schema.builder("Episode", Episode.class)
            .member(EntityType.EPISODE.memberName())
            .required("id", INTEGER)
            .required("name", STRING)
            .required("name_cn", STRING)
            .required("description", STRING)
            .required("airdate", STRING)
            .required("disc", INTEGER)
            .required("duration", STRING)
            .required("subject_id", INTEGER)
            .required("sort", NUMBER)
            .enumerated("type", EPISODE_TYPES)
            .bind(v -> new Episode(
                    v.getInt("id"),
                    v.getString("name"),
                    v.getString("name_cn"),
                    v.getString("description"),
                    v.getString("airdate"),
                    v.getInt("disc"),
                    v.getString("duration"),
                    v.getInt("subject_id"),
                    v.getDouble("sort"),
                    v.getEnum("type", EpisodeType.class)));

    // --- relationships ---

    public static final Schema<SubjectRelation> SUBJECT_RELATION = Schema.builder("SubjectRelation", SubjectRelation.class)
            .member(EntityType.SUBJECT_RELATION.memberName())
            .required("subject_id", INTEGER)
            .enumerated("relation_type", RELATION_TYPES)
            .required("related_subject_id", INTEGER)
            .required("order", INTEGER)
            .bind(v -> new SubjectRelation(
                    v.getInt("subject_id"),
                    v.getEnum("relation_type", RelationType.class),
                    v.getInt("related_subject_id"),
                    v.getInt("order")));

    /** First revision: position is free text. */
    public static final Schema<SubjectPerson> SUBJECT_PERSON_R1 = Schema.builder("SubjectPerson", SubjectPerson.class)
            .member(EntityType.SUBJECT_PERSON.memberName())
            .revision(1)
            .required("person_id", INTEGER)
            .required("subject_id", INTEGER)
            .required("position", STRING)
            .bind(v -> SubjectPerson.freeText(
                    v.getInt("person_id"),
                    v.getInt("subject_id"),
                    v.getString("position")));

    /** Current revision: position is a staff position code, undeclared fields rejected. */
    public static final Schema<SubjectPerson> SUBJECT_PERSON_R2 = Schema.builder("SubjectPerson", SubjectPerson.class)
            .member(EntityType.SUBJECT_PERSON.memberName())
            .revision(2)
            .strict()
            .required("person_id", INTEGER)
            .required("subject_id", INTEGER)
            .enumerated("position", STAFF_POSITIONS)
            .bind(v -> SubjectPerson.coded(
                    v.getInt("person_id"),
                    v.getInt("subject_id"),
                    v.getEnum("position", StaffPosition.class)));

    public static final Schema<SubjectCharacter> SUBJECT_CHARACTER = Schema.builder("SubjectCharacter", SubjectCharacter.class)
            .member(EntityType.SUBJECT_CHARACTER.memberName())
            .required("character_id", INTEGER)
            .required("subject_id", INTEGER)
            .enumerated("type", CHARACTER_SUBJECT_TYPES)
            .required("order", INTEGER)
            .bind(v -> new SubjectCharacter(
                    v.getInt("character_id"),
                    v.getInt("subject_id"),
                    v.getEnum("type", CharacterSubjectType.class),
                    v.getInt("order")));

    public static final Schema<PersonCharacter> PERSON_CHARACTER = Schema.builder("PersonCharacter", PersonCharacter.class)
            .member(EntityType.PERSON_CHARACTER.memberName())
            .required("person_id", INTEGER)
            .required("subject_id", INTEGER)
            .required("character_id", INTEGER)
            .required("summary", STRING)
            .bind(v -> new PersonCharacter(
                    v.getInt("person_id"),
                    v.getInt("subject_id"),
                    v.getInt("character_id"),
                    v.getString("summary")));

    /**
     * Every top-level schema revision, in registration order.
     */
    public static List<Schema<?>> all() {
        return List.of(
                SUBJECT,
                PERSON_R1, PERSON_R2,
                CHARACTER,
                EPISODE,
                SUBJECT_RELATION,
                SUBJECT_PERSON_R1, SUBJECT_PERSON_R2,
                SUBJECT_CHARACTER,
                PERSON_CHARACTER);
    }
}
