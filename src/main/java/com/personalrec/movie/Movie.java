package com.personalrec.movie;

import com.personalrec.engine.RecordFieldRegistry;
import com.personalrec.engine.RowReader;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Optional descriptive metadata for a movie. Genres arrive as one {@code |}-joined string. The id is
 * normalized the same way as {@link RatingRecord#movieId()}.
 */
public record Movie(String movieId, String title, String genres, Integer year) {
    public static final String GENRE_DELIMITER = "|";

    public Movie {
        movieId = RatingRecord.normalizeId(movieId);
        title = title == null || title.isBlank() ? "Movie " + movieId : title;
        genres = genres == null ? "" : genres;
    }

    public static Movie fromRow(Map<String, String> row) {
        RowReader r = new RowReader(RecordFieldRegistry.MOVIE, row);
        return new Movie(r.text("movieId"), r.text("title"), r.text("genres"), r.intOrNull("year"));
    }

    /**
     * Individual genres in listed order; empty when the movie has none.
     */
    public List<String> genreList() {
        List<String> out = new ArrayList<>();
        if (genres.isEmpty()) return out;
        for (String g : genres.split(Pattern.quote(GENRE_DELIMITER), -1)) out.add(g);
        return out;
    }
}
