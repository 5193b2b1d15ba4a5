package com.personalrec.movie;

import com.personalrec.engine.EmbeddingTable;

import java.util.List;
import java.util.Map;

/**
 * Movie retrieval from explicit ratings.
 */
public interface MovieRecommendationServiceInterface {
    /**
     * Rebuilds statistics and embeddings from the complete rating set and publishes them as one model.
     * @param ratings Every rating
     * @param movies Optional movie metadata (may be empty)
     * @return Number of movies that received an embedding
     */
    int train(List<RatingRecord> ratings, List<Movie> movies);

    /**
     * Normalizes raw ratings and movie rows, then trains on them.
     * @param ratingRows Raw rating rows, either column naming convention
     * @param movieRows Raw movie rows (may be empty)
     * @return Summary of the newly trained data set
     */
    DatasetSummary ingest(List<Map<String, String>> ratingRows, List<Map<String, String>> movieRows);

    /**
     * Ranks every movie the user has not rated.
     * @param userId User identifier
     * @param limit Maximum number of movies returned
     * @return Movies by descending similarity; empty for a user without ratings
     * @throws com.personalrec.engine.ModelNotTrainedException if no model has been trained yet
     */
    List<MovieRecommendation> recommend(String userId, int limit);

    /**
     * Summary of the current data set; all zeros before training.
     */
    DatasetSummary summary();

    /**
     * User ids ordered by number of ratings, most active first.
     */
    List<String> users();

    /**
     * Current movie embedding table.
     */
    EmbeddingTable embeddings();
}
