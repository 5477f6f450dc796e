package com.bgmarchive.types.entity;

/**
 * Marker for every record kind stored as one line of an archive member file.
 */
public interface WikiRecord {
}
