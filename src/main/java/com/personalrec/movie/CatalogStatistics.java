package com.personalrec.movie;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable result of one full {@link CatalogStatisticsBuilder} pass: per-user profiles, per-movie statistics
 * and the movie metadata index. Users and movies that never appear in the ratings have no entry and are
 * reported as empty. Lookups normalize the id with {@link RatingRecord#normalizeId(String)}.
 */
public final class CatalogStatistics {
    private final Map<String, UserProfile> users;
    private final Map<String, ItemStatistics> items;
    private final Map<String, Movie> movies;
    private final int totalRatings;

    CatalogStatistics(Map<String, UserProfile> users, Map<String, ItemStatistics> items,
                      Map<String, Movie> movies, int totalRatings) {
        this.users = users;
        this.items = items;
        this.movies = movies;
        this.totalRatings = totalRatings;
    }

    public Optional<UserProfile> userProfile(String userId) {
        return userId == null ? Optional.empty() : Optional.ofNullable(users.get(RatingRecord.normalizeId(userId)));
    }

    public Optional<ItemStatistics> itemStatistics(String movieId) {
        return movieId == null ? Optional.empty() : Optional.ofNullable(items.get(RatingRecord.normalizeId(movieId)));
    }

    public Optional<Movie> movie(String movieId) {
        return movieId == null ? Optional.empty() : Optional.ofNullable(movies.get(RatingRecord.normalizeId(movieId)));
    }

    /**
     * Rated movie ids, in order of first rating.
     */
    public Set<String> ratedMovieIds() {
        return items.keySet();
    }

    /**
     * User ids, in order of first rating.
     */
    public Set<String> userIds() {
        return users.keySet();
    }

    public Collection<UserProfile> userProfiles() {
        return users.values();
    }

    public int totalRatings() {
        return totalRatings;
    }

    public int movieMetadataCount() {
        return movies.size();
    }
}
