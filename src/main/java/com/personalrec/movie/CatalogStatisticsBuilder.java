package com.personalrec.movie;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes user and movie aggregates from the complete rating set in a single pass.
 * <p>
 * There is no incremental path: any change to the ratings means calling {@link #build} again and replacing the
 * previous {@link CatalogStatistics} as a whole.
 */
public final class CatalogStatisticsBuilder {
    private static final Logger logger = LoggerFactory.getLogger(CatalogStatisticsBuilder.class);

    public static final double HIGH_RATING = 4;
    public static final double LOW_RATING = 2;

    private CatalogStatisticsBuilder() {}

    /**
     * @param ratings Every rating record (null is treated as empty)
     * @param movies Optional movie metadata; the first entry per id is kept
     * @return New immutable statistics
     */
    public static CatalogStatistics build(List<RatingRecord> ratings, List<Movie> movies) {
        Map<String, List<RatingRecord>> byUser = new LinkedHashMap<>();
        Map<String, List<RatingRecord>> byMovie = new LinkedHashMap<>();
        int total = 0;
        if (ratings != null) {
            for (RatingRecord r : ratings) {
                if (r == null) continue;
                byUser.computeIfAbsent(r.userId(), k -> new ArrayList<>()).add(r);
                byMovie.computeIfAbsent(r.movieId(), k -> new ArrayList<>()).add(r);
                total++;
            }
        }

        Map<String, UserProfile> users = new LinkedHashMap<>();
        for (Map.Entry<String, List<RatingRecord>> e : byUser.entrySet()) {
            users.put(e.getKey(), profileOf(e.getKey(), e.getValue()));
        }
        Map<String, ItemStatistics> items = new LinkedHashMap<>();
        for (Map.Entry<String, List<RatingRecord>> e : byMovie.entrySet()) {
            items.put(e.getKey(), statisticsOf(e.getKey(), e.getValue()));
        }
        Map<String, Movie> metadata = new LinkedHashMap<>();
        if (movies != null) {
            for (Movie m : movies) {
                if (m != null) metadata.putIfAbsent(m.movieId(), m);
            }
        }
        logger.info("Built statistics for {} users and {} movies from {} ratings", users.size(), items.size(), total);
        return new CatalogStatistics(
            Collections.unmodifiableMap(users),
            Collections.unmodifiableMap(items),
            Collections.unmodifiableMap(metadata),
            total);
    }

    static UserProfile profileOf(String userId, List<RatingRecord> ratings) {
        int count = ratings.size();
        double sum = 0;
        for (RatingRecord r : ratings) sum += r.rating();
        double mean = sum / count;
        double sqDiffs = 0;
        for (RatingRecord r : ratings) sqDiffs += (r.rating() - mean) * (r.rating() - mean);
        return new UserProfile(userId, List.copyOf(ratings), count, mean, sqDiffs / count);
    }

    static ItemStatistics statisticsOf(String movieId, List<RatingRecord> ratings) {
        int[] bins = new int[5];
        List<Double> values = new ArrayList<>(ratings.size());
        List<String> high = new ArrayList<>();
        List<String> low = new ArrayList<>();
        List<Long> timestamps = new ArrayList<>(ratings.size());
        double sum = 0;
        for (RatingRecord r : ratings) {
            double rating = r.rating();
            values.add(rating);
            timestamps.add(r.timestamp());
            sum += rating;
            int bin = Math.min((int) Math.floor(rating) - 1, 4);
            if (bin >= 0) bins[bin]++;
            if (r.isLiked()) {
                high.add(r.userId());
            } else if (r.isDisliked()) {
                low.add(r.userId());
            }
        }
        List<Integer> histogram = new ArrayList<>(5);
        for (int b : bins) histogram.add(b);
        return new ItemStatistics(movieId, List.copyOf(values), List.copyOf(histogram), ratings.size(),
            sum / ratings.size(), List.copyOf(high), List.copyOf(low), List.copyOf(timestamps));
    }
}
