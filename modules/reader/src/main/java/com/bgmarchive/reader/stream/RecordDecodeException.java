package com.bgmarchive.reader.stream;

import com.bgmarchive.reader.archive.ArchiveException;

/**
 * Ends a record stream under {@link ErrorPolicy#FAIL_FAST}.
 */
public class RecordDecodeException extends ArchiveException {

    private final RecordFailure failure;

    public RecordDecodeException(RecordFailure failure) {
        super("Decode failure at " + failure);
        this.failure = failure;
    }

    public RecordFailure failure() {
        return failure;
    }
}
