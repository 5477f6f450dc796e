package com.bgmarchive.types.entity;

import com.bgmarchive.types.CharacterRole;

public record Character(
        int id,
        CharacterRole role,
        String name,
        String infobox,
        String summary,
        int comments,
        int collects
) implements WikiRecord {
}
