package com.bgmarchive.reader;

import com.bgmarchive.schema.registry.EntityType;
import com.bgmarchive.types.entity.WikiRecord;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * A restartable source of one entity's records. Each call to {@link #stream()} reads the
 * member again from the start with its own archive handle.
 */
public final class RecordSequence<T extends WikiRecord> {

    private final EntityType entityType;
    private final Supplier<Stream<T>> opener;

    RecordSequence(EntityType entityType, Supplier<Stream<T>> opener) {
        this.entityType = Objects.requireNonNull(entityType, "entityType cannot be null");
        this.opener = Objects.requireNonNull(opener, "opener cannot be null");
    }

    public EntityType entityType() {
        return entityType;
    }

    public String memberName() {
        return entityType.memberName();
    }

    /**
     * Opens a fresh lazy stream.
     *
     * @throws com.bgmarchive.reader.archive.ArchiveException if the archive can no longer be opened
     */
    public Stream<T> stream() {
        return opener.get();
    }

    /**
     * Drains a fresh stream and returns the number of decoded records.
     */
    public long count() {
        try (Stream<T> records = stream()) {
            return records.count();
        }
    }

    /**
     * Drains a fresh stream, passing each record to {@code action}.
     */
    public void forEach(Consumer<? super T> action) {
        try (Stream<T> records = stream()) {
            records.forEach(action);
        }
    }

    @Override
    public String toString() {
        return "RecordSequence[" + memberName() + "]";
    }
}
