package com.bgmarchive.reader;

import com.bgmarchive.reader.archive.ArchiveHandle;
import com.bgmarchive.reader.stream.ErrorPolicy;
import com.bgmarchive.reader.stream.RecordFailure;
import com.bgmarchive.reader.stream.StreamingSourceReader;
import com.bgmarchive.schema.api.Schema;
import com.bgmarchive.schema.registry.EntityType;
import com.bgmarchive.schema.registry.SchemaRegistry;
import com.bgmarchive.types.entity.Character;
import com.bgmarchive.types.entity.Episode;
import com.bgmarchive.types.entity.Person;
import com.bgmarchive.types.entity.PersonCharacter;
import com.bgmarchive.types.entity.Subject;
import com.bgmarchive.types.entity.SubjectCharacter;
import com.bgmarchive.types.entity.SubjectPerson;
import com.bgmarchive.types.entity.SubjectRelation;
import com.bgmarchive.types.entity.WikiRecord;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Entry point for reading a wiki archive: one lazy record stream per entity type.
 *
 * <p>The archive is opened once on construction to fail early on a missing or corrupt
 * file, then closed again. Every accessor call opens its own handle, so streams are
 * independent of each other and may be re-opened at will. Streams must be drained or
 * closed to release their handle.
 *
 * <p>Under {@link ErrorPolicy#COLLECT} the failures of the most recent stream of each
 * entity type are available from {@link #failureReport()}.
 */
public class WikiArchive {

    private static final Logger log = Logger.getLogger(WikiArchive.class);

    private final Path archivePath;
    private final ErrorPolicy errorPolicy;
    private final SchemaRegistry registry;
    private final StreamingSourceReader reader;
    private final Map<EntityType, Queue<RecordFailure>> collected = new ConcurrentHashMap<>();

    public WikiArchive(WikiArchiveConfig config) {
        this(config.archivePath(), config.errorPolicy());
    }

    public WikiArchive(Path archivePath, ErrorPolicy errorPolicy) {
        this(archivePath, errorPolicy, SchemaRegistry.defaultRegistry());
    }

    /**
     * @throws com.bgmarchive.reader.archive.ArchiveNotFoundException if the archive does not exist
     * @throws com.bgmarchive.reader.archive.ArchiveCorruptException  if it is not a zip container
     */
    public WikiArchive(Path archivePath, ErrorPolicy errorPolicy, SchemaRegistry registry) {
        this.archivePath = Objects.requireNonNull(archivePath, "archivePath cannot be null");
        this.errorPolicy = Objects.requireNonNull(errorPolicy, "errorPolicy cannot be null");
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.reader = new StreamingSourceReader();
        verifyReadable();
    }

    private void verifyReadable() {
        try (ArchiveHandle handle = ArchiveHandle.open(archivePath)) {
            List<String> members = handle.memberNames();
            log.infof("Opened archive %s (%d members, error policy %s)",
                    archivePath, members.size(), errorPolicy.label());
            for (EntityType type : EntityType.values()) {
                if (!members.contains(type.memberName())) {
                    log.debugf("Archive %s has no %s", archivePath, type.memberName());
                }
            }
        } catch (IOException e) {
            log.warnf(e, "Failed to close archive %s after opening it", archivePath);
        }
    }

    public Path archivePath() {
        return archivePath;
    }

    public ErrorPolicy errorPolicy() {
        return errorPolicy;
    }

    public SchemaRegistry registry() {
        return registry;
    }

    public Stream<Subject> subjects() {
        return records(EntityType.SUBJECT, Subject.class);
    }

    public Stream<Person> persons() {
        return records(EntityType.PERSON, Person.class);
    }

    public Stream<Character> characters() {
        return records(EntityType.CHARACTER, Character.class);
    }

    public Stream<Episode> episodes() {
        return records(EntityType.EPISODE, Episode.class);
    }

    public Stream<SubjectRelation> subjectRelations() {
        return records(EntityType.SUBJECT_RELATION, SubjectRelation.class);
    }

    public Stream<SubjectPerson> subjectPersons() {
        return records(EntityType.SUBJECT_PERSON, SubjectPerson.class);
    }

    public Stream<SubjectCharacter> subjectCharacters() {
        return records(EntityType.SUBJECT_CHARACTER, SubjectCharacter.class);
    }

    public Stream<PersonCharacter> personCharacters() {
        return records(EntityType.PERSON_CHARACTER, PersonCharacter.class);
    }

    /**
     * Opens a fresh stream of one entity type's records.
     *
     * <p>Under {@link ErrorPolicy#COLLECT} this discards the failures previously collected
     * for {@code entityType}.
     *
     * @throws IllegalArgumentException if {@code recordType} is not the entity's record type
     */
    public <T extends WikiRecord> Stream<T> records(EntityType entityType, Class<T> recordType) {
        Schema<T> schema = registry.schemaFor(entityType, recordType);
        ArchiveHandle handle = ArchiveHandle.open(archivePath);

        Consumer<RecordFailure> collector = null;
        if (errorPolicy == ErrorPolicy.COLLECT) {
            Queue<RecordFailure> failures = new ConcurrentLinkedQueue<>();
            collected.put(entityType, failures);
            collector = failures::add;
        }
        log.debugf("Streaming %s with %s", entityType.memberName(), schema);
        return reader.stream(handle, entityType, schema, errorPolicy, collector);
    }

    /**
     * One restartable sequence per entity type, keyed by member name in declaration order.
     * Nothing is opened until a sequence's {@link RecordSequence#stream()} is called.
     */
    public Map<String, RecordSequence<? extends WikiRecord>> sequences() {
        Map<String, RecordSequence<? extends WikiRecord>> sequences = new LinkedHashMap<>();
        for (EntityType type : EntityType.values()) {
            sequences.put(type.memberName(), sequence(type, type.recordType()));
        }
        return Collections.unmodifiableMap(sequences);
    }

    public <T extends WikiRecord> RecordSequence<T> sequence(EntityType entityType, Class<T> recordType) {
        return new RecordSequence<>(entityType, () -> records(entityType, recordType));
    }

    /**
     * Snapshot of the failures collected so far. Always empty unless the policy is
     * {@link ErrorPolicy#COLLECT}.
     */
    public FailureReport failureReport() {
        return FailureReport.of(collected);
    }
}
