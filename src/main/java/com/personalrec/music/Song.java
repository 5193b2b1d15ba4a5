package com.personalrec.music;

import com.personalrec.engine.RecordFieldRegistry;
import com.personalrec.engine.RowReader;

import java.util.Locale;
import java.util.Map;

/**
 * Immutable catalog entry for the music pipeline, in the one canonical shape the encoders read.
 * <p>
 * Catalog uploads and listening history share a layout, so besides descriptive metadata a song carries the
 * engagement and context signals of the row it was read from. Identity is {@link #key()}: the trimmed,
 * lower-cased {@code title::artist} pair.
 * <p>
 * Defaults for missing or unparseable numbers: release year 2020, duration 200 s, completion rate 0.5,
 * rating 3, hour of day 12, every flag and count 0.
 *
 * @author Recommendation Engine Team
 * @since 1.0
 */
public record Song(
    String title,
    String artist,
    String album,
    String genre,
    String subGenre,
    String language,
    String mood,
    String activity,
    int releaseYear,
    double durationSec,
    double completionRate,
    double rating,
    int likedFlag,
    int repeatCount,
    int skipFlag,
    int addedToPlaylist,
    int hourOfDay,
    int weekendFlag,
    String weather,
    String location
) {
    public static final int DEFAULT_RELEASE_YEAR = 2020;
    public static final double DEFAULT_DURATION_SEC = 200;
    public static final double DEFAULT_COMPLETION_RATE = 0.5;
    public static final double DEFAULT_RATING = 3;
    public static final int DEFAULT_HOUR_OF_DAY = 12;

    public Song {
        title = nullToEmpty(title);
        artist = nullToEmpty(artist);
        album = nullToEmpty(album);
        genre = nullToEmpty(genre);
        subGenre = nullToEmpty(subGenre);
        language = nullToEmpty(language);
        mood = nullToEmpty(mood);
        activity = nullToEmpty(activity);
        weather = nullToEmpty(weather);
        location = nullToEmpty(location);
    }

    /**
     * Minimal song with default engagement signals, mostly for catalog-only input.
     */
    public static Song of(String title, String artist, String genre) {
        return new Song(title, artist, "", genre, "", "", "", "",
            DEFAULT_RELEASE_YEAR, DEFAULT_DURATION_SEC, DEFAULT_COMPLETION_RATE, DEFAULT_RATING,
            0, 0, 0, 0, DEFAULT_HOUR_OF_DAY, 0, "", "");
    }

    /**
     * Normalizes a raw catalog or history row, accepting either column naming convention.
     * @param row Raw row keyed by column name
     * @return Canonical song
     */
    public static Song fromRow(Map<String, String> row) {
        RowReader r = new RowReader(RecordFieldRegistry.LISTENING, row);
        return new Song(
            r.text("title"),
            r.text("artist"),
            r.text("album"),
            r.text("genre"),
            r.text("subGenre"),
            r.text("language"),
            r.text("mood"),
            r.text("activity"),
            r.intOr("releaseYear", DEFAULT_RELEASE_YEAR),
            r.doubleOr("durationSec", DEFAULT_DURATION_SEC),
            r.doubleOr("completionRate", DEFAULT_COMPLETION_RATE),
            r.doubleOr("rating", DEFAULT_RATING),
            r.intOr("likedFlag", 0),
            r.intOr("repeatCount", 0),
            r.intOr("skipFlag", 0),
            r.intOr("addedToPlaylist", 0),
            r.intOr("hourOfDay", DEFAULT_HOUR_OF_DAY),
            r.intOr("weekendFlag", 0),
            r.text("weather"),
            r.text("location")
        );
    }

    /**
     * Normalized identity {@code title::artist}. A song with neither title nor artist falls back to its full
     * field rendering so that distinct anonymous rows stay distinct.
     */
    public String key() {
        return keyOf(title, artist, this);
    }

    static String keyOf(String title, String artist, Object fallback) {
        String t = nullToEmpty(title).trim().toLowerCase(Locale.ROOT);
        String a = nullToEmpty(artist).trim().toLowerCase(Locale.ROOT);
        if (t.isEmpty() && a.isEmpty()) return String.valueOf(fallback);
        return t + "::" + a;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
