package com.personalrec.music;

import com.personalrec.engine.EmbeddingTable;
import com.personalrec.engine.ScoredItem;
import com.personalrec.engine.SimilarityRanker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Two-tower song recommender.
 * <p>
 * Workflow:
 * <ul>
 *   <li>{@link #loadCatalog} builds a complete {@link MusicCatalog} (songs plus embeddings) off to the side and
 *   publishes it with a single reference swap.</li>
 *   <li>Each request reads the published catalog once, so it never mixes two catalog generations.</li>
 *   <li>The user vector comes from {@link ListenerEncoder}; ranking from {@link SimilarityRanker} with no
 *   exclusions, ties in catalog order.</li>
 *   <li>{@link #recommendForUser} bootstraps a catalog from the user's history only while none is loaded, and
 *   never overwrites a catalog published concurrently.</li>
 * </ul>
 * Absent information is not an error: an empty catalog or empty history yields an empty list, and history that
 * matches no song yields every song with score 0.
 *
 * @author Recommendation Engine Team
 * @since 1.0
 */
public class MusicRecommendationService implements MusicRecommendationServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(MusicRecommendationService.class);

    private final AtomicReference<MusicCatalog> catalog = new AtomicReference<>(MusicCatalog.empty());
    private final ListeningHistorySource historySource;

    public MusicRecommendationService(ListeningHistorySource historySource) {
        this.historySource = historySource == null ? new InMemoryListeningHistorySource() : historySource;
    }

    public MusicRecommendationService() {
        this(new InMemoryListeningHistorySource());
    }

    @Override
    public int loadCatalog(List<Song> songs) {
        MusicCatalog next = MusicCatalog.build(songs);
        catalog.set(next);
        logger.info("Trained embeddings for {} songs", next.size());
        return next.size();
    }

    @Override
    public int loadCatalogFromHistory(List<ListeningRecord> records) {
        return loadCatalog(songsOf(records));
    }

    @Override
    public List<SongRecommendation> recommend(List<ListeningRecord> history, int limit) {
        MusicCatalog current = catalog.get();
        if (current.isEmpty()) {
            logger.debug("Catalog is empty, no recommendations");
            return List.of();
        }
        if (history == null || history.isEmpty()) {
            logger.debug("No listening history, no recommendations");
            return List.of();
        }
        double[] userVector = ListenerEncoder.encode(history, current.embeddings());
        List<ScoredItem> ranked = SimilarityRanker.topK(userVector, current.embeddings(), null, limit);
        List<SongRecommendation> results = new ArrayList<>(ranked.size());
        for (ScoredItem item : ranked) {
            Optional<Song> song = current.song(item.key());
            song.ifPresent(s -> results.add(SongRecommendation.of(s, item.score())));
        }
        return List.copyOf(results);
    }

    @Override
    public List<SongRecommendation> recommendForUser(String userId, int limit) {
        List<ListeningRecord> history = historySource.historyFor(userId);
        if (history.isEmpty()) {
            logger.info("User {} has no listening history", userId);
            return List.of();
        }
        MusicCatalog current = catalog.get();
        if (current.isEmpty()) {
            logger.info("Catalog not loaded, bootstrapping from history of user {}", userId);
            MusicCatalog bootstrap = catalogFromHistory(history);
            // only replaces the catalog if nobody published one in the meantime
            if (!catalog.compareAndSet(current, bootstrap)) {
                logger.info("Catalog was loaded concurrently, keeping it over the bootstrap");
            }
        }
        return recommend(history, limit);
    }

    MusicCatalog catalogFromHistory(List<ListeningRecord> history) {
        return MusicCatalog.build(songsOf(history));
    }

    @Override
    public EmbeddingTable embeddings() {
        return catalog.get().embeddings();
    }

    private static List<Song> songsOf(List<ListeningRecord> records) {
        List<Song> songs = new ArrayList<>();
        if (records != null) {
            for (ListeningRecord record : records) songs.add(record.song());
        }
        return songs;
    }

    /**
     * Current catalog snapshot.
     */
    public MusicCatalog catalog() {
        return catalog.get();
    }
}
