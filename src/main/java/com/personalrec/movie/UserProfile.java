package com.personalrec.movie;

import java.util.List;

/**
 * Aggregate over every rating of one user. Variance is the population variance.
 */
public record UserProfile(
    String userId,
    List<RatingRecord> ratings,
    int ratingCount,
    double avgRating,
    double ratingVariance
) {
    public long likedCount() {
        return ratings.stream().filter(RatingRecord::isLiked).count();
    }

    public long dislikedCount() {
        return ratings.stream().filter(RatingRecord::isDisliked).count();
    }
}
