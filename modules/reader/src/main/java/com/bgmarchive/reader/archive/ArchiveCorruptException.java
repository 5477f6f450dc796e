package com.bgmarchive.reader.archive;

import java.nio.file.Path;

/**
 * Thrown when the archive exists but cannot be opened as a zip container.
 */
public class ArchiveCorruptException extends ArchiveException {

    private final Path path;

    public ArchiveCorruptException(Path path, Throwable cause) {
        super("Archive is not a readable zip container: " + path, cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
