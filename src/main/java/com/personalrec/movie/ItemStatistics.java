package com.personalrec.movie;

import java.util.List;

/**
 * Aggregate over every rating of one movie.
 * <p>
 * {@code histogram} has five buckets for 1 to 5 stars (a rating r lands in bucket {@code min(floor(r) - 1, 4)};
 * ratings below 1 are not bucketed). {@code highRatingUsers} and {@code lowRatingUsers} list, in rating order,
 * the users who rated 4 or more and 2 or less.
 */
public record ItemStatistics(
    String movieId,
    List<Double> ratings,
    List<Integer> histogram,
    int ratingCount,
    double avgRating,
    List<String> highRatingUsers,
    List<String> lowRatingUsers,
    List<Long> timestamps
) {
    public long firstTimestamp() {
        return timestamps.stream().mapToLong(Long::longValue).min().orElse(0L);
    }

    public long lastTimestamp() {
        return timestamps.stream().mapToLong(Long::longValue).max().orElse(0L);
    }
}
