package com.personalrec.music;

import com.personalrec.engine.EmbeddingTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of the song catalog together with its trained embeddings.
 * <p>
 * Built in one go by {@link #build(List)} and never modified afterwards; a retrain produces a new snapshot.
 * Songs sharing a {@link Song#key()} are collapsed to the first one seen.
 */
public final class MusicCatalog {
    private static final Logger logger = LoggerFactory.getLogger(MusicCatalog.class);

    private static final MusicCatalog EMPTY =
        new MusicCatalog(List.of(), Map.of(), EmbeddingTable.empty(SongEncoder.DIMENSION));

    private final List<Song> songs;
    private final Map<String, Song> songsByKey;
    private final EmbeddingTable embeddings;

    private MusicCatalog(List<Song> songs, Map<String, Song> songsByKey, EmbeddingTable embeddings) {
        this.songs = songs;
        this.songsByKey = songsByKey;
        this.embeddings = embeddings;
    }

    public static MusicCatalog empty() {
        return EMPTY;
    }

    /**
     * Deduplicates the songs and encodes each one.
     * @param songs Raw catalog, possibly with duplicates (null is treated as empty)
     * @return New snapshot
     */
    public static MusicCatalog build(List<Song> songs) {
        if (songs == null || songs.isEmpty()) return EMPTY;
        Map<String, Song> byKey = new LinkedHashMap<>();
        for (Song song : songs) {
            if (song == null) continue;
            byKey.putIfAbsent(song.key(), song);
        }
        List<Song> unique = Collections.unmodifiableList(new ArrayList<>(byKey.values()));
        EmbeddingTable table = SongEncoder.encodeAll(unique);
        if (unique.size() < songs.size()) {
            logger.info("Collapsed {} duplicate songs", songs.size() - unique.size());
        }
        return new MusicCatalog(unique, Collections.unmodifiableMap(byKey), table);
    }

    public List<Song> songs() {
        return songs;
    }

    public Optional<Song> song(String key) {
        return Optional.ofNullable(songsByKey.get(key));
    }

    public EmbeddingTable embeddings() {
        return embeddings;
    }

    public int size() {
        return songs.size();
    }

    public boolean isEmpty() {
        return songs.isEmpty();
    }
}
