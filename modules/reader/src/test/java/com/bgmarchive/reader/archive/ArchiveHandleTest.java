package com.bgmarchive.reader.archive;

import com.bgmarchive.reader.test.TestZipBuilder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class ArchiveHandleTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldListFileMembersOnly() throws Exception {
        Path zip = new TestZipBuilder()
                .addDirectory("extra")
                .addFile("subject.jsonlines", "{}\n")
                .addFile("person.jsonlines", "")
                .writeTo(tempDir, "archive.zip");

        try (ArchiveHandle handle = ArchiveHandle.open(zip)) {
            assertThat(handle.memberNames()).containsExactly("subject.jsonlines", "person.jsonlines");
            assertThat(handle.hasMember("subject.jsonlines")).isTrue();
            assertThat(handle.hasMember("extra/")).isFalse();
        }
    }

    @Test
    void shouldOpenMemberContent() throws Exception {
        Path zip = new TestZipBuilder()
                .addFile("episode.jsonlines", "line one\nline two\n")
                .writeTo(tempDir, "archive.zip");

        try (ArchiveHandle handle = ArchiveHandle.open(zip)) {
            Optional<InputStream> member = handle.openMember("episode.jsonlines");
            assertThat(member).isPresent();
            try (InputStream in = member.get()) {
                assertThat(new String(in.readAllBytes(), StandardCharsets.UTF_8))
                        .isEqualTo("line one\nline two\n");
            }
        }
    }

    @Test
    void shouldReturnEmptyForMissingMember() throws Exception {
        Path zip = new TestZipBuilder().addFile("subject.jsonlines", "").writeTo(tempDir, "archive.zip");

        try (ArchiveHandle handle = ArchiveHandle.open(zip)) {
            assertThat(handle.openMember("person.jsonlines")).isEmpty();
        }
    }

    @Test
    void shouldRejectMissingArchive() {
        Path missing = tempDir.resolve("nope.zip");

        assertThatThrownBy(() -> ArchiveHandle.open(missing))
                .isInstanceOf(ArchiveNotFoundException.class)
                .hasMessageContaining("nope.zip");
    }

    @Test
    void shouldRejectDirectoryAsArchive() {
        assertThatThrownBy(() -> ArchiveHandle.open(tempDir))
                .isInstanceOf(ArchiveNotFoundException.class);
    }

    @Test
    void shouldRejectNonZipFile() throws Exception {
        Path bogus = tempDir.resolve("bogus.zip");
        Files.writeString(bogus, "this is not a zip archive");

        assertThatThrownBy(() -> ArchiveHandle.open(bogus))
                .isInstanceOf(ArchiveCorruptException.class)
                .isInstanceOf(ArchiveException.class)
                .hasCauseInstanceOf(java.io.IOException.class);
    }

    @Test
    void shouldRefuseReadsAfterClose() throws Exception {
        Path zip = new TestZipBuilder().addFile("subject.jsonlines", "").writeTo(tempDir, "archive.zip");
        ArchiveHandle handle = ArchiveHandle.open(zip);

        handle.close();
        handle.close();

        assertThat(handle.isClosed()).isTrue();
        assertThatIllegalStateException().isThrownBy(() -> handle.openMember("subject.jsonlines"));
    }
}
