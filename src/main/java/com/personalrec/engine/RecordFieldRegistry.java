package com.personalrec.engine;

import java.util.*;

/**
 * Central registry of the canonical input fields for each data stream and their tolerated column names.
 * <p>
 * Listening rows (song catalog and listening history share one layout), rating rows and movie rows each have
 * their own list. Add an alias here and every consumer picks it up.
 */
public final class RecordFieldRegistry {
    private RecordFieldRegistry() {}

    public static final String LISTENING = "listening";
    public static final String RATING = "rating";
    public static final String MOVIE = "movie";

    private static final List<RecordField> LISTENING_FIELDS = List.of(
        new RecordField("title", List.of("title", "Song_Title", "track_name")),
        new RecordField("artist", List.of("artist", "Artist_Name", "artist_name")),
        new RecordField("album", List.of("album", "Album")),
        new RecordField("genre", List.of("genre", "Genre")),
        new RecordField("subGenre", List.of("subGenre", "Sub_Genre")),
        new RecordField("language", List.of("language", "Language")),
        new RecordField("mood", List.of("mood", "Mood")),
        new RecordField("activity", List.of("activity", "Activity")),
        new RecordField("releaseYear", List.of("releaseYear", "Release_Year")),
        new RecordField("durationSec", List.of("durationSec", "duration", "Duration_sec")),
        new RecordField("listenDurationSec", List.of("listenDuration", "Listen_Duration_sec")),
        new RecordField("completionRate", List.of("completionRate", "Completion_Rate")),
        new RecordField("rating", List.of("rating", "Rating")),
        new RecordField("likedFlag", List.of("likedFlag", "Liked_Flag")),
        new RecordField("repeatCount", List.of("repeatCount", "Repeat_Count")),
        new RecordField("skipFlag", List.of("skipFlag", "Skip_Flag")),
        new RecordField("addedToPlaylist", List.of("addedToPlaylist", "Added_To_Playlist")),
        new RecordField("hourOfDay", List.of("hourOfDay", "Hour_of_Day")),
        new RecordField("weekendFlag", List.of("weekendFlag", "Weekend_Flag")),
        new RecordField("dayOfWeek", List.of("dayOfWeek", "Day_of_Week")),
        new RecordField("weather", List.of("weather", "Weather")),
        new RecordField("location", List.of("location", "Location")),
        new RecordField("device", List.of("device", "Device")),
        new RecordField("recommendedBySystem", List.of("recommendedBySystem", "Recommended_By_System")),
        new RecordField("recommendationSource", List.of("recommendationSource", "Recommendation_Source")),
        new RecordField("userAction", List.of("userAction", "User_Action"))
    );

    private static final List<RecordField> RATING_FIELDS = List.of(
        new RecordField("userId", List.of("userId", "user_id", "UserID")),
        new RecordField("movieId", List.of("movieId", "movie_id", "MovieID")),
        new RecordField("rating", List.of("rating", "Rating")),
        new RecordField("timestamp", List.of("timestamp", "Timestamp"))
    );

    private static final List<RecordField> MOVIE_FIELDS = List.of(
        new RecordField("movieId", List.of("movieId", "movie_id", "MovieID")),
        new RecordField("title", List.of("title", "Title")),
        new RecordField("genres", List.of("genres", "Genres", "genre")),
        new RecordField("year", List.of("year", "Year"))
    );

    private static final Map<String, List<RecordField>> STREAMS = Map.of(
        LISTENING, LISTENING_FIELDS,
        RATING, RATING_FIELDS,
        MOVIE, MOVIE_FIELDS
    );

    /**
     * Returns the fields of a data stream, or an empty list for an unknown stream.
     */
    public static List<RecordField> getFields(String stream) {
        return STREAMS.getOrDefault(stream, List.of());
    }

    /**
     * Returns the RecordField for a given stream and field name, or null if not found.
     */
    public static RecordField getField(String stream, String name) {
        for (RecordField f : getFields(stream)) if (f.fieldName.equals(name)) return f;
        return null;
    }
}
