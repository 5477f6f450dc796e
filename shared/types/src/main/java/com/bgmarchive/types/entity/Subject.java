package com.bgmarchive.types.entity;

import com.bgmarchive.types.SubjectType;

import java.util.List;

/**
 * A subject entry (anime, book, music, game or real-world production).
 *
 * @param scoreDetails rating distribution, or null when the line carries none
 * @param metaTags     free-form meta tags, or null
 */
public record Subject(
        int id,
        SubjectType type,
        String name,
        String nameCn,
        String infobox,
        int platform,
        String summary,
        boolean nsfw,
        List<Tag> tags,
        double score,
        ScoreDetails scoreDetails,
        int rank,
        String date,
        Favorite favorite,
        boolean series,
        String metaTags
) implements WikiRecord {

    public Subject {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
