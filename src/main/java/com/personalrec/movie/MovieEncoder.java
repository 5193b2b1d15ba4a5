package com.personalrec.movie;

import com.personalrec.engine.EmbeddingTable;
import com.personalrec.engine.FeatureHasher;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Item tower for the movie pipeline: a {@value #DIMENSION}-dimension vector per rated movie.
 * <p>
 * Feature layout:
 * <pre>
 *   [0-4]   star histogram divided by rating count
 *   [5-9]   mean / 5, min(count / 1000, 1), sqrt(count) / 100, like ratio, 1 - dislike ratio
 *   [10-29] hashed ids of the first 20 users who rated the movie 4 or higher
 *   [30-31] unused
 *   [32-47] genre hash (weight 1.0)
 *   [48-49] activity span in years / 10 (capped at 1), share of ratings in the trailing 365 days
 *   [50-55] unused
 *   [56-63] movie id hash (weight 0.5)
 * </pre>
 * A movie without statistics encodes as the zero vector, which scores 0 against every user.
 */
public final class MovieEncoder {
    public static final int DIMENSION = 64;

    static final int COLLABORATIVE_OFFSET = 10;
    static final int COLLABORATIVE_WIDTH = 20;
    static final int GENRE_OFFSET = 32;
    static final int ID_OFFSET = 56;

    private static final long SECONDS_PER_YEAR = 365L * 24 * 60 * 60;

    private MovieEncoder() {}

    /**
     * @param movieId Movie identifier
     * @param stats Current catalog statistics
     * @param clock Clock anchoring the recent-activity window
     * @return Embedding, all zeros when the movie has no ratings
     */
    public static double[] encode(String movieId, CatalogStatistics stats, Clock clock) {
        double[] vec = new double[DIMENSION];
        Optional<ItemStatistics> found = stats.itemStatistics(movieId);
        if (found.isEmpty()) return vec;
        ItemStatistics stat = found.get();

        int total = stat.ratingCount() == 0 ? 1 : stat.ratingCount();
        List<Integer> histogram = stat.histogram();
        for (int i = 0; i < 5; i++) {
            vec[i] = histogram.get(i) / (double) total;
        }

        vec[5] = stat.avgRating() / 5;
        vec[6] = Math.min(stat.ratingCount() / 1000.0, 1);
        vec[7] = Math.sqrt(stat.ratingCount()) / 100;
        vec[8] = stat.highRatingUsers().size() / (double) total;
        vec[9] = 1 - (stat.lowRatingUsers().size() / (double) total);

        List<String> likers = stat.highRatingUsers();
        for (int i = 0; i < Math.min(likers.size(), COLLABORATIVE_WIDTH); i++) {
            vec[COLLABORATIVE_OFFSET + i] = FeatureHasher.hashUserId(likers.get(i));
        }

        stats.movie(movieId).ifPresent(movie -> {
            if (!movie.genres().isEmpty()) FeatureHasher.hashBand(movie.genres(), vec, GENRE_OFFSET, 1.0);
        });

        List<Long> timestamps = stat.timestamps();
        if (!timestamps.isEmpty()) {
            double spanYears = (stat.lastTimestamp() - stat.firstTimestamp()) / (double) SECONDS_PER_YEAR;
            vec[48] = Math.min(spanYears / 10, 1);
            long oneYearAgo = clock.instant().getEpochSecond() - SECONDS_PER_YEAR;
            long recent = timestamps.stream().filter(t -> t > oneYearAgo).count();
            vec[49] = recent / (double) timestamps.size();
        }

        FeatureHasher.hashBand(movieId, vec, ID_OFFSET, 0.5);
        return vec;
    }

    /**
     * Encodes every rated movie, in order of first rating.
     */
    public static EmbeddingTable encodeAll(CatalogStatistics stats, Clock clock) {
        EmbeddingTable.Builder builder = EmbeddingTable.builder(DIMENSION);
        for (String movieId : stats.ratedMovieIds()) {
            builder.put(movieId, encode(movieId, stats, clock));
        }
        return builder.build();
    }
}
