package com.personalrec.music;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One row of a music recommendation list.
 */
public record SongRecommendation(
    String id,
    String title,
    String artist,
    String album,
    String genre,
    String mood,
    @JsonProperty("similarity_score") double similarityScore
) {
    public static final String[] CSV_HEADER = {"Id", "Title", "Artist", "Album", "Genre", "Mood", "SimilarityScore"};

    static SongRecommendation of(Song song, double score) {
        return new SongRecommendation(song.key(), song.title(), song.artist(), song.album(), song.genre(), song.mood(), score);
    }

    public String[] toCsvRow() {
        return new String[]{id, title, artist, album, genre, mood, Double.toString(similarityScore)};
    }
}
