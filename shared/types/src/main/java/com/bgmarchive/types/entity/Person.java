package com.bgmarchive.types.entity;

import com.bgmarchive.types.PersonType;

import java.util.List;

public record Person(
        int id,
        String name,
        PersonType type,
        List<String> career,
        String infobox,
        String summary,
        int comments,
        int collects
) implements WikiRecord {

    public Person {
        career = career == null ? List.of() : List.copyOf(career);
    }
}
