package com.personalrec.movie;

import com.personalrec.engine.EmbeddingTable;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * One trained generation of the movie pipeline: statistics and the embeddings derived from them, always built
 * and published together.
 */
public record MovieModel(CatalogStatistics statistics, EmbeddingTable embeddings, Instant trainedAt) {

    /**
     * Runs the statistics pass and the item tower over a complete rating set.
     */
    public static MovieModel train(List<RatingRecord> ratings, List<Movie> movies, Clock clock) {
        CatalogStatistics stats = CatalogStatisticsBuilder.build(ratings, movies);
        EmbeddingTable table = MovieEncoder.encodeAll(stats, clock);
        return new MovieModel(stats, table, clock.instant());
    }
}
