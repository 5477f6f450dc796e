package com.bgmarchive.reader.archive;

/**
 * Wraps I/O errors raised while reading a member that was opened successfully.
 */
public class ArchiveReadException extends ArchiveException {

    private final String memberName;

    public ArchiveReadException(String memberName, Throwable cause) {
        super("Failed to read archive member " + memberName, cause);
        this.memberName = memberName;
    }

    public String memberName() {
        return memberName;
    }
}
