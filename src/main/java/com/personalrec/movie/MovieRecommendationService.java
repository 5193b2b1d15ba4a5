package com.personalrec.movie;

import com.personalrec.engine.EmbeddingTable;
import com.personalrec.engine.ModelNotTrainedException;
import com.personalrec.engine.ScoredItem;
import com.personalrec.engine.SimilarityRanker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Two-tower movie recommender driven by ratings and collaborative signals.
 * <p>
 * Workflow:
 * <ul>
 *   <li>{@link #train} runs {@link CatalogStatisticsBuilder} and {@link MovieEncoder} into a fresh
 *   {@link MovieModel} and publishes it with one reference swap.</li>
 *   <li>{@link #recommend} reads the published model once, builds the user vector with {@link ViewerEncoder},
 *   drops every movie the user already rated and ranks the rest by cosine similarity.</li>
 *   <li>Each result carries a predicted rating, {@code clamp(avg + (similarity - 0.5) * 2, 1, 5)}, rounded
 *   to one decimal.</li>
 * </ul>
 *
 * @author Recommendation Engine Team
 * @since 1.0
 */
public class MovieRecommendationService implements MovieRecommendationServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(MovieRecommendationService.class);

    private final AtomicReference<MovieModel> model = new AtomicReference<>();
    private final Clock clock;

    public MovieRecommendationService(Clock clock) {
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public MovieRecommendationService() {
        this(Clock.systemUTC());
    }

    @Override
    public int train(List<RatingRecord> ratings, List<Movie> movies) {
        return publish(ratings, movies).embeddings().size();
    }

    @Override
    public DatasetSummary ingest(List<Map<String, String>> ratingRows, List<Map<String, String>> movieRows) {
        List<RatingRecord> ratings = new ArrayList<>();
        if (ratingRows != null) {
            for (Map<String, String> row : ratingRows) ratings.add(RatingRecord.fromRow(row, clock));
        }
        List<Movie> movies = new ArrayList<>();
        if (movieRows != null) {
            for (Map<String, String> row : movieRows) movies.add(Movie.fromRow(row));
        }
        logger.info("Processed {} movie ratings and {} movies metadata", ratings.size(), movies.size());
        MovieModel next = publish(ratings, movies);
        return DatasetSummary.of(next.statistics());
    }

    @Override
    public List<MovieRecommendation> recommend(String userId, int limit) {
        MovieModel current = requireModel();
        CatalogStatistics stats = current.statistics();
        Optional<UserProfile> profile = stats.userProfile(userId);
        if (profile.isEmpty()) {
            logger.info("User {} not found in the dataset", userId);
            return List.of();
        }
        Set<String> rated = new HashSet<>();
        for (RatingRecord r : profile.get().ratings()) rated.add(r.movieId());

        double[] userVector = ViewerEncoder.encode(userId, stats, current.embeddings());
        List<ScoredItem> ranked = SimilarityRanker.topK(userVector, current.embeddings(), rated, limit);
        List<MovieRecommendation> results = new ArrayList<>(ranked.size());
        for (ScoredItem item : ranked) {
            results.add(toRecommendation(item, stats));
        }
        return List.copyOf(results);
    }

    @Override
    public DatasetSummary summary() {
        MovieModel current = model.get();
        return current == null ? DatasetSummary.empty() : DatasetSummary.of(current.statistics());
    }

    @Override
    public List<String> users() {
        MovieModel current = model.get();
        if (current == null) return List.of();
        List<UserProfile> profiles = new ArrayList<>(current.statistics().userProfiles());
        profiles.sort(Comparator.comparingInt(UserProfile::ratingCount).reversed());
        List<String> ids = new ArrayList<>(profiles.size());
        for (UserProfile p : profiles) ids.add(p.userId());
        return List.copyOf(ids);
    }

    @Override
    public EmbeddingTable embeddings() {
        return requireModel().embeddings();
    }

    /**
     * Predicted star rating for display: the movie's average (3 when it has none) shifted by how far the
     * similarity sits from 0.5, clamped to [1, 5] and rounded to one decimal.
     */
    static double predictRating(double similarity, double avgRating) {
        double base = avgRating > 0 ? avgRating : 3;
        double predicted = base + (similarity - 0.5) * 2;
        double clamped = Math.max(1, Math.min(5, predicted));
        return Math.round(clamped * 10) / 10.0;
    }

    private MovieRecommendation toRecommendation(ScoredItem item, CatalogStatistics stats) {
        Optional<Movie> movie = stats.movie(item.key());
        Optional<ItemStatistics> stat = stats.itemStatistics(item.key());
        double avg = stat.map(ItemStatistics::avgRating).orElse(0.0);
        return new MovieRecommendation(
            item.key(),
            movie.map(Movie::title).orElse("Movie " + item.key()),
            movie.map(Movie::genres).filter(g -> !g.isEmpty()).orElse("Unknown"),
            movie.map(Movie::year).orElse(null),
            Math.round(avg * 100) / 100.0,
            stat.map(ItemStatistics::ratingCount).orElse(0),
            item.score(),
            predictRating(item.score(), avg));
    }

    private MovieModel publish(List<RatingRecord> ratings, List<Movie> movies) {
        MovieModel next = MovieModel.train(ratings, movies, clock);
        model.set(next);
        logger.info("Trained embeddings for {} movies", next.embeddings().size());
        return next;
    }

    private MovieModel requireModel() {
        MovieModel current = model.get();
        if (current == null || current.embeddings().isEmpty()) {
            throw new ModelNotTrainedException("Model not trained. Load movie ratings first.");
        }
        return current;
    }
}
