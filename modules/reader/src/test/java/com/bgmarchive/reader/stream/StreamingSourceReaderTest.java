package com.bgmarchive.reader.stream;

import com.bgmarchive.reader.archive.ArchiveHandle;
import com.bgmarchive.reader.test.TestZipBuilder;
import com.bgmarchive.schema.decode.FailureKind;
import com.bgmarchive.schema.registry.ArchiveSchemas;
import com.bgmarchive.schema.registry.EntityType;
import com.bgmarchive.types.EpisodeType;
import com.bgmarchive.types.entity.Episode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.bgmarchive.reader.test.ArchiveLines.episode;
import static org.assertj.core.api.Assertions.*;

class StreamingSourceReaderTest {

    private final StreamingSourceReader reader = new StreamingSourceReader();

    @TempDir
    Path tempDir;

    @Test
    void shouldDecodeEveryLine() {
        ArchiveHandle handle = open(episode(1), episode(2, 1), episode(3, 6));

        List<Episode> episodes = stream(handle, ErrorPolicy.FAIL_FAST, null).collect(Collectors.toList());

        assertThat(episodes).extracting(Episode::id).containsExactly(1, 2, 3);
        assertThat(episodes).extracting(Episode::type)
                .containsExactly(EpisodeType.MAIN, EpisodeType.SPECIAL, EpisodeType.OTHER);
        assertThat(handle.isClosed()).isTrue();
    }

    @Test
    void shouldSkipBlankLinesWithoutCountingThem() {
        List<RecordFailure> failures = new ArrayList<>();
        ArchiveHandle handle = open("", episode(1), "   ", "\t", episode(2), "{broken", "");

        List<Episode> episodes = stream(handle, ErrorPolicy.COLLECT, failures::add).collect(Collectors.toList());

        assertThat(episodes).hasSize(2);
        assertThat(failures).singleElement()
                .satisfies(f -> assertThat(f.lineNumber()).isEqualTo(5));
    }

    @Test
    void shouldSkipUnicodeWhitespaceLines() {
        List<RecordFailure> failures = new ArrayList<>();
        ArchiveHandle handle = open(episode(1), "\u3000", "\u00A0", " \u3000\t", episode(2));

        List<Episode> episodes = stream(handle, ErrorPolicy.COLLECT, failures::add).collect(Collectors.toList());

        assertThat(episodes).extracting(Episode::id).containsExactly(1, 2);
        assertThat(failures).isEmpty();
    }

    @Test
    void unicodeWhitespaceLinesShouldNotHaltFailFast() {
        ArchiveHandle handle = open("\u3000", episode(1), "\u00A0");

        assertThat(stream(handle, ErrorPolicy.FAIL_FAST, null)).extracting(Episode::id).containsExactly(1);
    }

    @Test
    void silentPolicyShouldDropFailures() {
        ArchiveHandle handle = open(episode(1), "not json", episode(2, 999), episode(3), "[]");

        List<Episode> episodes = stream(handle, ErrorPolicy.SILENT, null).collect(Collectors.toList());

        assertThat(episodes).extracting(Episode::id).containsExactly(1, 3);
    }

    @Test
    void failFastPolicyShouldStopAtFirstFailure() {
        ArchiveHandle handle = open(episode(1), episode(2, 999), episode(3));
        List<Integer> seen = new ArrayList<>();

        assertThatThrownBy(() -> stream(handle, ErrorPolicy.FAIL_FAST, null).forEach(e -> seen.add(e.id())))
                .isInstanceOfSatisfying(RecordDecodeException.class, e -> {
                    assertThat(e.failure().entityType()).isEqualTo(EntityType.EPISODE);
                    assertThat(e.failure().memberName()).isEqualTo("episode.jsonlines");
                    assertThat(e.failure().lineNumber()).isEqualTo(1);
                    assertThat(e.failure().kind()).isEqualTo(FailureKind.UNKNOWN_ENUM_VALUE);
                })
                .hasMessageContaining("episode.jsonlines:1");

        assertThat(seen).containsExactly(1);
        assertThat(handle.isClosed()).isTrue();
    }

    @Test
    void collectPolicyShouldRecordEveryFailure() {
        List<RecordFailure> failures = new ArrayList<>();
        ArchiveHandle handle = open(episode(1), episode(2, 999), episode(3), "{\"id\":4}", episode(5));

        List<Episode> episodes = stream(handle, ErrorPolicy.COLLECT, failures::add).collect(Collectors.toList());

        assertThat(episodes).extracting(Episode::id).containsExactly(1, 3, 5);
        assertThat(failures).extracting(RecordFailure::lineNumber).containsExactly(1L, 3L);
        assertThat(failures.get(0).field()).isEqualTo("type");
        assertThat(failures.get(0).offendingValue()).isEqualTo("999");
        assertThat(failures.get(1).kind()).isEqualTo(FailureKind.SCHEMA_VIOLATION);
    }

    @Test
    void collectPolicyShouldRequireCollector() {
        ArchiveHandle handle = open(episode(1));

        assertThatIllegalArgumentException()
                .isThrownBy(() -> reader.stream(handle, EntityType.EPISODE, ArchiveSchemas.EPISODE, ErrorPolicy.COLLECT));
    }

    @Test
    void shouldYieldEmptyStreamForMissingMember() {
        Path zip = new TestZipBuilder().addLines("subject.jsonlines").writeTo(tempDir, "archive.zip");
        ArchiveHandle handle = ArchiveHandle.open(zip);

        try (Stream<Episode> episodes = stream(handle, ErrorPolicy.FAIL_FAST, null)) {
            assertThat(episodes).isEmpty();
        }
        assertThat(handle.isClosed()).isTrue();
    }

    @Test
    void shouldReadLazily() {
        List<RecordFailure> failures = new ArrayList<>();
        ArchiveHandle handle = open(episode(1), "garbage", episode(2), "garbage");

        try (Stream<Episode> episodes = stream(handle, ErrorPolicy.COLLECT, failures::add)) {
            Iterator<Episode> it = episodes.iterator();
            assertThat(failures).isEmpty();

            assertThat(it.next().id()).isEqualTo(1);
            assertThat(failures).isEmpty();

            assertThat(it.next().id()).isEqualTo(2);
            assertThat(failures).hasSize(1);
        }
        assertThat(failures).hasSize(1);
    }

    @Test
    void closingAnAbandonedStreamShouldReleaseTheArchive() {
        ArchiveHandle handle = open(episode(1), episode(2), episode(3));

        try (Stream<Episode> episodes = stream(handle, ErrorPolicy.FAIL_FAST, null)) {
            assertThat(episodes.findFirst()).isPresent();
            assertThat(handle.isClosed()).isFalse();
        }
        assertThat(handle.isClosed()).isTrue();
    }

    @Test
    void consumerExceptionShouldReleaseTheArchive() {
        ArchiveHandle handle = open(episode(1), episode(2));

        assertThatIllegalStateException().isThrownBy(() -> stream(handle, ErrorPolicy.FAIL_FAST, null)
                .forEach(e -> {
                    throw new IllegalStateException("stop");
                }));
        assertThat(handle.isClosed()).isTrue();
    }

    @Test
    void shouldHandleCrlfAndUnterminatedLastLine() {
        Path zip = new TestZipBuilder()
                .addFile("episode.jsonlines", episode(1) + "\r\n" + episode(2))
                .writeTo(tempDir, "archive.zip");

        List<Episode> episodes = stream(ArchiveHandle.open(zip), ErrorPolicy.FAIL_FAST, null)
                .collect(Collectors.toList());

        assertThat(episodes).extracting(Episode::id).containsExactly(1, 2);
    }

    private Stream<Episode> stream(ArchiveHandle handle, ErrorPolicy policy,
                                   Consumer<RecordFailure> collector) {
        return reader.stream(handle, EntityType.EPISODE, ArchiveSchemas.EPISODE, policy, collector);
    }

    private ArchiveHandle open(String... lines) {
        Path zip = new TestZipBuilder().addLines("episode.jsonlines", lines).writeTo(tempDir, "archive.zip");
        return ArchiveHandle.open(zip);
    }
}
