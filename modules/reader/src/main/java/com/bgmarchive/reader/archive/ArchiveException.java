package com.bgmarchive.reader.archive;

/**
 * Base of all failures raised while opening or reading an archive.
 */
public class ArchiveException extends RuntimeException {

    public ArchiveException(String message, Throwable cause) {
        super(message, cause);
    }

    public ArchiveException(String message) {
        super(message);
    }
}
