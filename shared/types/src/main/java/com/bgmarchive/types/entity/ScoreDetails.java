package com.bgmarchive.types.entity;

import java.util.List;
import java.util.Objects;

/**
 * Rating distribution of a subject: ten buckets for the scores 1 through 10.
 *
 * <p>On the wire the buckets are keyed by the digit strings {@code "1"} .. {@code "10"}.
 */
public record ScoreDetails(List<Integer> buckets) {

    public static final int BUCKETS = 10;

    public ScoreDetails {
        Objects.requireNonNull(buckets, "buckets cannot be null");
        if (buckets.size() != BUCKETS) {
            throw new IllegalArgumentException("ScoreDetails needs " + BUCKETS + " buckets, got: " + buckets.size());
        }
        buckets = List.copyOf(buckets);
    }

    /**
     * Number of votes for the given score.
     *
     * @param score 1..10
     */
    public int count(int score) {
        if (score < 1 || score > BUCKETS) {
            throw new IllegalArgumentException("score must be in 1.." + BUCKETS + ", got: " + score);
        }
        return buckets.get(score - 1);
    }

    public int totalVotes() {
        int total = 0;
        for (int b : buckets) total += b;
        return total;
    }
}
