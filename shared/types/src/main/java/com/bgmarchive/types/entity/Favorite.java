package com.bgmarchive.types.entity;

/**
 * Collection counters of a subject, one per collection state.
 */
public record Favorite(int wish, int done, int doing, int onHold, int dropped) {

    public int total() {
        return wish + done + doing + onHold + dropped;
    }
}
