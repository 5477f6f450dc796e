package com.bgmarchive.reader.stream;

import com.bgmarchive.schema.decode.DecodeFailure;
import com.bgmarchive.schema.decode.FailureKind;
import com.bgmarchive.schema.registry.EntityType;

import java.util.Objects;

/**
 * A decode failure located in the archive.
 *
 * @param lineNumber zero-based physical line index within the member, blank lines included
 */
public record RecordFailure(
        EntityType entityType,
        String memberName,
        long lineNumber,
        DecodeFailure failure
) {
    public RecordFailure {
        Objects.requireNonNull(entityType, "entityType cannot be null");
        Objects.requireNonNull(memberName, "memberName cannot be null");
        Objects.requireNonNull(failure, "failure cannot be null");
    }

    public FailureKind kind() {
        return failure.kind();
    }

    public String field() {
        return failure.field();
    }

    public String offendingValue() {
        return failure.offendingValue();
    }

    @Override
    public String toString() {
        return memberName + ":" + lineNumber + " " + failure;
    }
}
