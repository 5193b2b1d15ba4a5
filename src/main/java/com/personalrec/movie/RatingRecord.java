package com.personalrec.movie;

import com.personalrec.engine.RecordFieldRegistry;
import com.personalrec.engine.RowReader;

import java.time.Clock;
import java.util.Locale;
import java.util.Map;

/**
 * One explicit rating: a user, a movie, a star value and when it was given (epoch seconds). User and movie ids
 * are stored normalized, see {@link #normalizeId(String)}.
 */
public record RatingRecord(String userId, String movieId, double rating, long timestamp) {
    public RatingRecord {
        userId = normalizeId(userId);
        movieId = normalizeId(movieId);
    }

    /**
     * Lookup form of a user or movie id: trimmed and lower-cased, null reads as "".
     */
    public static String normalizeId(String id) {
        return id == null ? "" : id.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Normalizes a raw ratings row. A missing or unparseable rating reads as 0; a missing timestamp reads as the
     * clock's current time.
     * @param row Raw row keyed by column name
     * @param clock Clock supplying the fallback timestamp
     * @return Canonical rating
     */
    public static RatingRecord fromRow(Map<String, String> row, Clock clock) {
        RowReader r = new RowReader(RecordFieldRegistry.RATING, row);
        return new RatingRecord(
            r.text("userId"),
            r.text("movieId"),
            r.doubleOr("rating", 0),
            r.longOr("timestamp", clock.instant().getEpochSecond())
        );
    }

    public boolean isLiked() {
        return rating >= CatalogStatisticsBuilder.HIGH_RATING;
    }

    public boolean isDisliked() {
        return rating <= CatalogStatisticsBuilder.LOW_RATING;
    }
}
