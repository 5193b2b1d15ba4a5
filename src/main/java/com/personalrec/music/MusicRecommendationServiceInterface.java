package com.personalrec.music;

import com.personalrec.engine.EmbeddingTable;

import java.util.List;

/**
 * Song retrieval from listening history.
 */
public interface MusicRecommendationServiceInterface {
    /**
     * Replaces the catalog with the given songs (duplicates collapsed, first seen wins) and retrains all song
     * embeddings. Requests running during the swap see either the old or the new catalog.
     * @param songs New catalog
     * @return Number of distinct songs now in the catalog
     */
    int loadCatalog(List<Song> songs);

    /**
     * Rebuilds the catalog from the songs referenced by a listening history.
     * @param records Listening records
     * @return Number of distinct songs now in the catalog
     */
    int loadCatalogFromHistory(List<ListeningRecord> records);

    /**
     * Ranks the whole catalog against the user vector built from {@code history}.
     * @param history Listening history, already fetched
     * @param limit Maximum number of songs returned
     * @return Songs by descending similarity; empty when the catalog or the history is empty
     */
    List<SongRecommendation> recommend(List<ListeningRecord> history, int limit);

    /**
     * Fetches the user's history from the configured source and ranks the catalog against it.
     * @param userId User identifier
     * @param limit Maximum number of songs returned
     * @return Songs by descending similarity; empty when the user has no history
     */
    List<SongRecommendation> recommendForUser(String userId, int limit);

    /**
     * Current song embedding table, keyed by song identity.
     */
    EmbeddingTable embeddings();
}
