package com.bgmarchive.types.entity;

import com.bgmarchive.types.EpisodeType;

/**
 * A single episode of a subject.
 *
 * @param sort ordering key; usually integral but fractional values occur for recap episodes
 */
public record Episode(
        int id,
        String name,
        String nameCn,
        String description,
        String airdate,
        int disc,
        String duration,
        int subjectId,
        double sort,
        EpisodeType type
) implements WikiRecord {
}
