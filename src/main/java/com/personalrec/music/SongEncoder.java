package com.personalrec.music;

import com.personalrec.engine.EmbeddingTable;
import com.personalrec.engine.FeatureHasher;

import java.util.List;

/**
 * Item tower for the music pipeline: turns one {@link Song} into a {@value #DIMENSION}-dimension vector.
 * <p>
 * Coordinate layout:
 * <pre>
 *   [0-15]    title hash        (weight 1.5)
 *   [16-31]   artist hash       (weight 1.5)
 *   [32-47]   genre hash        (weight 2.0)
 *   [48-63]   sub-genre hash    (weight 1.5)
 *   [64-79]   language hash     (weight 1.0)
 *   [80-95]   mood hash         (weight 1.8)
 *   [96-111]  activity hash     (weight 1.5)
 *   [112]     release year, (year - 1950) / 100
 *   [113]     duration / 600 s
 *   [114-119] completion rate, rating / 5, liked, min(repeats, 5) / 5, 1 - skipped, added to playlist
 *   [120-122] sin and cos of hour of day, weekend flag
 *   [123-127] weather hash (0.8) from 123, location hash (0.5) from 126
 * </pre>
 * Text hashes use {@link FeatureHasher#spread}, so text longer than its band runs on into the next one and the
 * location hash wraps to the start of the vector. Encoding is pure: equal songs give identical vectors.
 */
public final class SongEncoder {
    public static final int DIMENSION = 128;

    private SongEncoder() {}

    public static double[] encode(Song song) {
        double[] vec = new double[DIMENSION];

        FeatureHasher.spread(song.title(), vec, 0, 1.5);
        FeatureHasher.spread(song.artist(), vec, 16, 1.5);
        FeatureHasher.spread(song.genre(), vec, 32, 2.0);
        FeatureHasher.spread(song.subGenre(), vec, 48, 1.5);
        FeatureHasher.spread(song.language(), vec, 64, 1.0);
        FeatureHasher.spread(song.mood(), vec, 80, 1.8);
        FeatureHasher.spread(song.activity(), vec, 96, 1.5);

        vec[112] = (song.releaseYear() - 1950) / 100.0;
        vec[113] = song.durationSec() / 600.0;

        vec[114] = song.completionRate();
        vec[115] = song.rating() / 5.0;
        vec[116] = song.likedFlag();
        vec[117] = Math.min(song.repeatCount(), 5) / 5.0;
        vec[118] = 1 - song.skipFlag();
        vec[119] = song.addedToPlaylist();

        double hourAngle = 2 * Math.PI * song.hourOfDay() / 24.0;
        vec[120] = Math.sin(hourAngle);
        vec[121] = Math.cos(hourAngle);
        vec[122] = song.weekendFlag();

        FeatureHasher.spread(song.weather(), vec, 123, 0.8);
        FeatureHasher.spread(song.location(), vec, 126, 0.5);

        return vec;
    }

    /**
     * Encodes a deduplicated catalog into a table keyed by {@link Song#key()}, in catalog order.
     */
    public static EmbeddingTable encodeAll(List<Song> catalog) {
        EmbeddingTable.Builder builder = EmbeddingTable.builder(DIMENSION);
        for (Song song : catalog) {
            builder.put(song.key(), encode(song));
        }
        return builder.build();
    }
}
