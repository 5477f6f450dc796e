package com.bgmarchive.reader.archive;

import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.jboss.logging.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;
import java.util.Optional;

/**
 * An open zip archive. Member streams obtained from a handle are only valid until it is closed.
 */
public class ArchiveHandle implements Closeable {

    private static final Logger log = Logger.getLogger(ArchiveHandle.class);

    private final Path path;
    private final ZipFile zipFile;
    private boolean closed;

    private ArchiveHandle(Path path, ZipFile zipFile) {
        this.path = path;
        this.zipFile = zipFile;
    }

    /**
     * Opens the archive at {@code path}.
     *
     * @throws ArchiveNotFoundException if the path is missing or not a regular file
     * @throws ArchiveCorruptException  if the file is not a zip container
     */
    public static ArchiveHandle open(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ArchiveNotFoundException(path);
        }
        try {
            ZipFile zipFile = ZipFile.builder().setFile(path.toFile()).get();
            log.debugf("Opened archive %s", path);
            return new ArchiveHandle(path, zipFile);
        } catch (IOException e) {
            throw new ArchiveCorruptException(path, e);
        }
    }

    public Path path() {
        return path;
    }

    /**
     * Names of all file members, in central directory order. Directory entries are skipped.
     */
    public List<String> memberNames() {
        List<String> names = new ArrayList<>();
        Enumeration<ZipArchiveEntry> entries = zipFile.getEntries();
        while (entries.hasMoreElements()) {
            ZipArchiveEntry entry = entries.nextElement();
            if (!entry.isDirectory()) {
                names.add(entry.getName());
            }
        }
        return Collections.unmodifiableList(names);
    }

    public boolean hasMember(String memberName) {
        ZipArchiveEntry entry = zipFile.getEntry(memberName);
        return entry != null && !entry.isDirectory();
    }

    /**
     * Opens a member for reading, or returns empty when the archive has no such member.
     *
     * @throws ArchiveReadException if the member exists but its data cannot be opened
     */
    public Optional<InputStream> openMember(String memberName) {
        ensureOpen();
        ZipArchiveEntry entry = zipFile.getEntry(memberName);
        if (entry == null || entry.isDirectory()) {
            return Optional.empty();
        }
        try {
            return Optional.of(zipFile.getInputStream(entry));
        } catch (IOException e) {
            throw new ArchiveReadException(memberName, e);
        }
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() throws IOException {
        if (closed) return;
        closed = true;
        zipFile.close();
        log.debugf("Closed archive %s", path);
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Archive handle is closed: " + path);
        }
    }
}
