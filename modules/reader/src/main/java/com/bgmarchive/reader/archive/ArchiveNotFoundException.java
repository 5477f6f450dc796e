package com.bgmarchive.reader.archive;

import java.nio.file.Path;

/**
 * Thrown when the archive path does not name a readable regular file.
 */
public class ArchiveNotFoundException extends ArchiveException {

    private final Path path;

    public ArchiveNotFoundException(Path path) {
        super("Archive not found: " + path);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
