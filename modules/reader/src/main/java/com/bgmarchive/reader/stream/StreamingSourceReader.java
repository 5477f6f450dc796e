package com.bgmarchive.reader.stream;

import com.bgmarchive.reader.archive.ArchiveHandle;
import com.bgmarchive.reader.archive.ArchiveReadException;
import com.bgmarchive.schema.api.Schema;
import com.bgmarchive.schema.decode.DecodeResult;
import com.bgmarchive.schema.decode.RecordDecoder;
import com.bgmarchive.schema.registry.EntityType;
import com.bgmarchive.util.io.LineReader;
import com.bgmarchive.util.io.Utf8;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Turns one archive member into a lazy stream of decoded records.
 *
 * <p>Lines are read and decoded only as the stream is pulled. Blank lines are skipped.
 * The returned stream owns the archive handle it was given: the handle is closed when the
 * stream is exhausted, when an exception propagates out of it, or when the stream is closed.
 * Callers that may stop early should use try-with-resources.
 */
public class StreamingSourceReader {

    private static final Logger log = Logger.getLogger(StreamingSourceReader.class);

    private final RecordDecoder decoder;

    public StreamingSourceReader() {
        this(new RecordDecoder());
    }

    public StreamingSourceReader(RecordDecoder decoder) {
        this.decoder = Objects.requireNonNull(decoder, "decoder cannot be null");
    }

    /**
     * Streams the member of {@code entityType} with no failure collector.
     *
     * @throws IllegalArgumentException if {@code policy} is {@link ErrorPolicy#COLLECT}
     */
    public <T> Stream<T> stream(ArchiveHandle handle, EntityType entityType, Schema<T> schema, ErrorPolicy policy) {
        return stream(handle, entityType, schema, policy, null);
    }

    /**
     * Streams the member of {@code entityType}, decoding each line with {@code schema}.
     *
     * <p>A missing member yields an empty stream. Under {@link ErrorPolicy#COLLECT} every
     * failed line is passed to {@code collector} as it is encountered.
     */
    public <T> Stream<T> stream(ArchiveHandle handle, EntityType entityType, Schema<T> schema,
                                ErrorPolicy policy, Consumer<RecordFailure> collector) {
        Objects.requireNonNull(handle, "handle cannot be null");
        Objects.requireNonNull(entityType, "entityType cannot be null");
        Objects.requireNonNull(schema, "schema cannot be null");
        Objects.requireNonNull(policy, "policy cannot be null");
        if (policy == ErrorPolicy.COLLECT && collector == null) {
            throw new IllegalArgumentException("A failure collector is required for the collect policy");
        }

        String memberName = entityType.memberName();
        Optional<InputStream> member;
        try {
            member = handle.openMember(memberName);
        } catch (RuntimeException e) {
            closeQuietly(handle, memberName);
            throw e;
        }
        if (member.isEmpty()) {
            log.warnf("Member %s not found in archive %s", memberName, handle.path());
            closeQuietly(handle, memberName);
            return Stream.empty();
        }

        RecordSpliterator<T> spliterator = new RecordSpliterator<>(
                handle, new LineReader(member.get()), entityType, schema, policy, collector);
        return StreamSupport.stream(spliterator, false).onClose(spliterator::close);
    }

    private static void closeQuietly(ArchiveHandle handle, String memberName) {
        try {
            handle.close();
        } catch (IOException e) {
            log.warnf(e, "Failed to close archive after reading %s", memberName);
        }
    }

    private final class RecordSpliterator<T> extends Spliterators.AbstractSpliterator<T> {

        private final ArchiveHandle handle;
        private final LineReader lines;
        private final EntityType entityType;
        private final Schema<T> schema;
        private final ErrorPolicy policy;
        private final Consumer<RecordFailure> collector;
        private boolean closed;

        RecordSpliterator(ArchiveHandle handle, LineReader lines, EntityType entityType, Schema<T> schema,
                          ErrorPolicy policy, Consumer<RecordFailure> collector) {
            super(Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL);
            this.handle = handle;
            this.lines = lines;
            this.entityType = entityType;
            this.schema = schema;
            this.policy = policy;
            this.collector = collector;
        }

        @Override
        public boolean tryAdvance(Consumer<? super T> action) {
            if (closed) return false;
            try {
                while (true) {
                    byte[] line = readLine();
                    if (line == null) {
                        close();
                        return false;
                    }
                    if (Utf8.isBlank(line)) continue;

                    DecodeResult<T> result = decoder.decode(line, schema);
                    if (result instanceof DecodeResult.Decoded<T> decoded) {
                        action.accept(decoded.record());
                        return true;
                    }
                    handleFailure(new RecordFailure(entityType, entityType.memberName(),
                            lines.lineNumber(), ((DecodeResult.Failed<T>) result).failure()));
                }
            } catch (RuntimeException | Error e) {
                close();
                throw e;
            }
        }

        private byte[] readLine() {
            try {
                return lines.next();
            } catch (IOException e) {
                throw new ArchiveReadException(entityType.memberName(), e);
            }
        }

        private void handleFailure(RecordFailure failure) {
            switch (policy) {
                case SILENT:
                    log.debugf("Skipping %s", failure);
                    break;
                case COLLECT:
                    log.debugf("Collected %s", failure);
                    collector.accept(failure);
                    break;
                case FAIL_FAST:
                    log.warnf("Decode failure at %s:%d: %s",
                            failure.memberName(), failure.lineNumber(), failure.failure());
                    throw new RecordDecodeException(failure);
                default:
                    throw new IllegalStateException("Unhandled policy: " + policy);
            }
        }

        void close() {
            if (closed) return;
            closed = true;
            try {
                lines.close();
            } catch (IOException e) {
                log.warnf(e, "Failed to close member %s", entityType.memberName());
            }
            closeQuietly(handle, entityType.memberName());
        }
    }
}
