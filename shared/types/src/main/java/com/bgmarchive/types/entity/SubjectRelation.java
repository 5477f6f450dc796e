package com.bgmarchive.types.entity;

import com.bgmarchive.types.RelationType;

public record SubjectRelation(
        int subjectId,
        RelationType relationType,
        int relatedSubjectId,
        int order
) implements WikiRecord {
}
