package com.personalrec.movie;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/**
 * One row of a movie recommendation list. {@code predictedRating} is a display heuristic and plays no part
 * in the ordering.
 */
public record MovieRecommendation(
    String movieId,
    String title,
    String genres,
    Integer year,
    double avgRating,
    int ratingCount,
    @JsonProperty("similarity_score") double similarityScore,
    @JsonProperty("predicted_rating") double predictedRating
) {
    public static final String[] CSV_HEADER =
        {"MovieId", "Title", "Genres", "Year", "AvgRating", "RatingCount", "SimilarityScore", "PredictedRating"};

    public String[] toCsvRow() {
        return new String[]{
            movieId,
            title,
            genres,
            year == null ? "" : year.toString(),
            String.format(Locale.ROOT, "%.2f", avgRating),
            Integer.toString(ratingCount),
            Double.toString(similarityScore),
            String.format(Locale.ROOT, "%.1f", predictedRating)
        };
    }
}
