package com.personalrec.movie;

/**
 * Counts describing the loaded rating set, for display and monitoring only. Per-user and per-movie averages
 * are rounded to one decimal and are 0 when there are no users or movies.
 */
public record DatasetSummary(
    int totalRatings,
    int uniqueUsers,
    int uniqueMovies,
    int moviesWithMetadata,
    double avgRatingsPerUser,
    double avgRatingsPerMovie
) {
    static DatasetSummary of(CatalogStatistics stats) {
        int users = stats.userIds().size();
        int movies = stats.ratedMovieIds().size();
        int total = stats.totalRatings();
        return new DatasetSummary(total, users, movies, stats.movieMetadataCount(),
            users == 0 ? 0 : round1((double) total / users),
            movies == 0 ? 0 : round1((double) total / movies));
    }

    static DatasetSummary empty() {
        return new DatasetSummary(0, 0, 0, 0, 0, 0);
    }

    private static double round1(double value) {
        return Math.round(value * 10) / 10.0;
    }
}
