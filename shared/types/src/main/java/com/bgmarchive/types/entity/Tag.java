package com.bgmarchive.types.entity;

import java.util.Objects;

/**
 * User tag on a subject with the number of users who applied it.
 */
public record Tag(String name, int count) {

    public Tag {
        Objects.requireNonNull(name, "name cannot be null");
    }
}
