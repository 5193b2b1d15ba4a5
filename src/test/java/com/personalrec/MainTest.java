package com.personalrec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvException;
import com.personalrec.engine.CsvService;
import com.personalrec.engine.EngineConfig;
import com.personalrec.engine.JsonExportService;
import com.personalrec.movie.MovieRecommendation;
import com.personalrec.music.SongRecommendation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.FileReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end runs of the command-line pipelines over small CSV fixtures.
 */
public class MainTest {
    @TempDir
    Path tempDir;

    private Path outputDir;
    private Main app;

    @BeforeEach
    void setUp() {
        outputDir = tempDir.resolve("out");
        app = new Main(new EngineConfig(10, 20, outputDir), new CsvService(), new JsonExportService());
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    private static List<String[]> readCsv(Path file) throws IOException, CsvException {
        try (CSVReader reader = new CSVReader(new FileReader(file.toFile()))) {
            return reader.readAll();
        }
    }

    @Test
    void testMusicRunWritesRankedExports() throws Exception {
        Path catalog = write("catalog.csv",
            "Song_Title,Artist_Name,Genre,Mood\n"
                + "Sunrise,Aurora,Pop,Happy\n"
                + "Night Drive,Neon,Synthwave,Calm\n"
                + "Thunder,Storm,Metal,Angry\n");
        Path history = write("history.csv",
            "title,artist,genre,mood,completionRate,rating,likedFlag\n"
                + "Night Drive,Neon,Synthwave,Calm,1,5,1\n");

        assertEquals(0, app.run(new String[]{"music", catalog.toString(), history.toString()}));

        List<String[]> rows = readCsv(outputDir.resolve("music-recommendations.csv"));
        assertArrayEquals(SongRecommendation.CSV_HEADER, rows.get(0));
        assertEquals(4, rows.size());
        assertEquals("night drive::neon", rows.get(1)[0]);
        assertTrue(Files.exists(outputDir.resolve("song-embeddings.json")));

        JsonNode json = new ObjectMapper().readTree(outputDir.resolve("music-recommendations.json").toFile());
        assertEquals(3, json.get("recommendations").size());
        assertTrue(json.get("recommendations").get(0).has("similarity_score"));
    }

    @Test
    void testMusicRunCanBuildCatalogFromHistory() throws Exception {
        Path history = write("history.csv",
            "title,artist,genre\n"
                + "A,B,Pop\n"
                + "C,D,Rock\n"
                + "A,B,Pop\n");

        assertEquals(0, app.run(new String[]{"Music", "-", history.toString(), "1"}));

        List<String[]> rows = readCsv(outputDir.resolve("music-recommendations.csv"));
        assertEquals(2, rows.size());
    }

    @Test
    void testMovieRunWritesRankedExports() throws Exception {
        Path ratings = write("ratings.csv",
            "userId,movieId,rating,timestamp\n"
                + "u1,m1,5,1600000000\n"
                + "u1,m2,3,1600000000\n"
                + "u2,m1,4,1600000000\n"
                + "u2,m3,5,1600000000\n"
                + "u3,m2,2,1600000000\n");
        Path movies = write("movies.csv",
            "movieId,title,genres,year\n"
                + "m3,Third,Drama|Crime,1994\n");

        assertEquals(0, app.run(new String[]{"movie", ratings.toString(), "u1", movies.toString()}));

        List<String[]> rows = readCsv(outputDir.resolve("movie-recommendations.csv"));
        assertArrayEquals(MovieRecommendation.CSV_HEADER, rows.get(0));
        assertEquals(2, rows.size());
        assertEquals("m3", rows.get(1)[0]);
        assertEquals("Third", rows.get(1)[1]);

        JsonNode json = new ObjectMapper().readTree(outputDir.resolve("movie-recommendations.json").toFile());
        assertEquals("u1", json.get("userId").asText());
        assertEquals(5, json.get("stats").get("totalRatings").asInt());
        assertTrue(json.get("recommendations").get(0).has("predicted_rating"));
        assertTrue(Files.exists(outputDir.resolve("movie-embeddings.json")));
    }

    @Test
    void testBadUsageReturnsTwo() {
        assertEquals(2, app.run(new String[]{}));
        assertEquals(2, app.run(new String[]{"podcast", "x", "y"}));
        assertEquals(2, app.run(new String[]{"music", "catalog.csv"}));
        assertEquals(2, app.run(null));
    }

    @Test
    void testMissingInputReturnsOne() {
        Path missing = tempDir.resolve("nope.csv");
        assertEquals(1, app.run(new String[]{"music", "-", missing.toString()}));
        assertEquals(1, app.run(new String[]{"movie", missing.toString(), "u1"}));
    }

    @Test
    void testEmptyRatingsFileReturnsOne() throws Exception {
        Path ratings = write("ratings.csv", "userId,movieId,rating\n");
        assertEquals(1, app.run(new String[]{"movie", ratings.toString(), "u1"}));
    }
}
