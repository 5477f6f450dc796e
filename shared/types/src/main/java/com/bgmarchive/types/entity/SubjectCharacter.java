package com.bgmarchive.types.entity;

import com.bgmarchive.types.CharacterSubjectType;

public record SubjectCharacter(
        int characterId,
        int subjectId,
        CharacterSubjectType type,
        int order
) implements WikiRecord {
}
