package com.bgmarchive.types.entity;

import com.bgmarchive.types.StaffPosition;

import java.util.Optional;

/**
 * Staff credit of a person on a subject.
 *
 * <p>Older archive revisions carry the position as free text, newer ones as a
 * {@link StaffPosition} code. {@code position} always holds the textual form
 * (the code's digits for coded lines); {@code staffPosition} is null for free-text lines.
 */
public record SubjectPerson(
        int personId,
        int subjectId,
        String position,
        StaffPosition staffPosition
) implements WikiRecord {

    public static SubjectPerson coded(int personId, int subjectId, StaffPosition position) {
        return new SubjectPerson(personId, subjectId, String.valueOf(position.code()), position);
    }

    public static SubjectPerson freeText(int personId, int subjectId, String position) {
        return new SubjectPerson(personId, subjectId, position, null);
    }

    public Optional<StaffPosition> codedPosition() {
        return Optional.ofNullable(staffPosition);
    }
}
