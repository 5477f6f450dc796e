package com.bgmarchive.types.entity;

/**
 * Voice/cast credit: a person playing a character within a subject.
 */
public record PersonCharacter(
        int personId,
        int subjectId,
        int characterId,
        String summary
) implements WikiRecord {
}
