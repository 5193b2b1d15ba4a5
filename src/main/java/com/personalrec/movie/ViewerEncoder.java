package com.personalrec.movie;

import com.personalrec.engine.EmbeddingTable;
import com.personalrec.engine.VectorMath;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * User tower for the movie pipeline.
 * <p>
 * Feature layout before the final L2 normalization:
 * <pre>
 *   [0-4]   mean / 5, sqrt(variance) / 2, min(count / 500, 1), like share, dislike share
 *   [5-63]  weighted average of the embeddings of up to 30 top-rated liked movies, weight (rating - 3) / 2
 *   [32-39] minus 0.3 * embedding for each of up to 10 disliked movies
 *   [48-55] mean rating / 5 for the first 8 genres the user rated, in first-seen order
 * </pre>
 * The liked-movie sum is added over every coordinate, including 0-4, but only coordinates 5 onwards are
 * divided by the total weight. Genre preferences overwrite whatever the aggregate left in 48-55.
 */
public final class ViewerEncoder {
    static final int MAX_LIKED = 30;
    static final int MAX_DISLIKED = 10;
    static final int MAX_GENRES = 8;
    static final int AGGREGATE_START = 5;
    static final int ANTI_PATTERN_START = 32;
    static final int ANTI_PATTERN_END = 40;
    static final double ANTI_PATTERN_WEIGHT = 0.3;
    static final int GENRE_START = 48;

    private ViewerEncoder() {}

    /**
     * @param userId User identifier
     * @param stats Current catalog statistics
     * @param movieEmbeddings Movie embeddings built from the same statistics
     * @return Unit-length vector, all zeros for an unknown user
     */
    public static double[] encode(String userId, CatalogStatistics stats, EmbeddingTable movieEmbeddings) {
        int dim = movieEmbeddings.dimension();
        double[] vec = new double[dim];
        Optional<UserProfile> found = stats.userProfile(userId);
        if (found.isEmpty() || found.get().ratings().isEmpty()) return vec;
        UserProfile profile = found.get();

        vec[0] = profile.avgRating() / 5;
        vec[1] = Math.sqrt(profile.ratingVariance()) / 2;
        vec[2] = Math.min(profile.ratingCount() / 500.0, 1);
        vec[3] = profile.likedCount() / (double) profile.ratingCount();
        vec[4] = profile.dislikedCount() / (double) profile.ratingCount();

        List<RatingRecord> liked = new ArrayList<>();
        for (RatingRecord r : profile.ratings()) {
            if (r.isLiked()) liked.add(r);
        }
        // stable: equal ratings keep the user's rating order
        liked.sort(Comparator.comparingDouble(RatingRecord::rating).reversed());
        double totalWeight = 0;
        for (RatingRecord r : liked.subList(0, Math.min(liked.size(), MAX_LIKED))) {
            Optional<double[]> emb = movieEmbeddings.get(r.movieId());
            if (emb.isEmpty()) continue;
            double weight = (r.rating() - 3) / 2;
            double[] e = emb.get();
            for (int i = 0; i < dim; i++) {
                vec[i] += e[i] * weight;
            }
            totalWeight += weight;
        }
        if (totalWeight > 0) {
            for (int i = AGGREGATE_START; i < dim; i++) {
                vec[i] /= totalWeight;
            }
        }

        int disliked = 0;
        for (RatingRecord r : profile.ratings()) {
            if (!r.isDisliked()) continue;
            if (disliked++ >= MAX_DISLIKED) break;
            Optional<double[]> emb = movieEmbeddings.get(r.movieId());
            if (emb.isEmpty()) continue;
            double[] e = emb.get();
            for (int i = ANTI_PATTERN_START; i < ANTI_PATTERN_END && i < dim; i++) {
                vec[i] -= e[i] * ANTI_PATTERN_WEIGHT;
            }
        }

        Map<String, double[]> genreScores = new LinkedHashMap<>();
        for (RatingRecord r : profile.ratings()) {
            Optional<Movie> movie = stats.movie(r.movieId());
            if (movie.isEmpty() || movie.get().genres().isEmpty()) continue;
            for (String genre : movie.get().genreList()) {
                double[] sumAndCount = genreScores.computeIfAbsent(genre, g -> new double[2]);
                sumAndCount[0] += r.rating();
                sumAndCount[1]++;
            }
        }
        int idx = 0;
        for (double[] sumAndCount : genreScores.values()) {
            if (idx >= MAX_GENRES || GENRE_START + idx >= dim) break;
            vec[GENRE_START + idx] = (sumAndCount[0] / sumAndCount[1]) / 5;
            idx++;
        }

        return VectorMath.l2Normalize(vec);
    }
}
