package com.personalrec;

import com.personalrec.engine.CsvService;
import com.personalrec.engine.CsvServiceInterface;
import com.personalrec.engine.EngineConfig;
import com.personalrec.engine.JsonExportService;
import com.personalrec.engine.ModelNotTrainedException;
import com.personalrec.movie.DatasetSummary;
import com.personalrec.movie.MovieRecommendation;
import com.personalrec.movie.MovieRecommendationService;
import com.personalrec.music.InMemoryListeningHistorySource;
import com.personalrec.music.ListeningRecord;
import com.personalrec.music.MusicRecommendationService;
import com.personalrec.music.Song;
import com.personalrec.music.SongRecommendation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Command-line entry point that runs either pipeline over CSV files and exports the ranked list as JSON and CSV.
 * <pre>
 *   music &lt;catalog.csv|-&gt; &lt;history.csv&gt; [limit]
 *   movie &lt;ratings.csv&gt; &lt;userId&gt; [movies.csv|-] [limit]
 * </pre>
 * A catalog of {@code -} builds the song catalog from the listening history itself. Exports land in the
 * directory named by {@code REC_OUTPUT_DIR}.
 *
 * @author Recommendation Engine Team
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final String CLI_USER = "cli-user";

    private final EngineConfig config;
    private final CsvServiceInterface csvService;
    private final JsonExportService jsonService;

    public Main(EngineConfig config, CsvServiceInterface csvService, JsonExportService jsonService) {
        this.config = config;
        this.csvService = csvService;
        this.jsonService = jsonService;
    }

    /**
     * Runs one command.
     * @param args Command-line arguments
     * @return Process exit code: 0 on success, 1 on I/O or data errors, 2 on bad usage
     */
    public int run(String[] args) {
        String mode = (args != null && args.length > 0) ? args[0].trim().toLowerCase(Locale.ROOT) : "";
        try {
            switch (mode) {
                case "music":
                    if (args.length < 3) return usage();
                    return runMusic(args[1], Paths.get(args[2]), limitArg(args, 3, config.musicLimit()));
                case "movie":
                    if (args.length < 3) return usage();
                    String movies = args.length > 3 ? args[3] : "-";
                    return runMovie(Paths.get(args[1]), args[2], movies, limitArg(args, 4, config.movieLimit()));
                default:
                    return usage();
            }
        } catch (IOException e) {
            logger.error("Failed to read or write recommendation files: {}", e.getMessage());
            return 1;
        } catch (ModelNotTrainedException e) {
            logger.error("{}", e.getMessage());
            return 1;
        }
    }

    private int runMusic(String catalogArg, Path historyFile, int limit) throws IOException {
        List<ListeningRecord> history = new ArrayList<>();
        for (Map<String, String> row : csvService.readRows(historyFile)) {
            history.add(ListeningRecord.fromRow(row));
        }
        InMemoryListeningHistorySource source = new InMemoryListeningHistorySource();
        source.save(CLI_USER, history);
        MusicRecommendationService service = new MusicRecommendationService(source);
        if (!"-".equals(catalogArg)) {
            List<Song> songs = new ArrayList<>();
            for (Map<String, String> row : csvService.readRows(Paths.get(catalogArg))) {
                songs.add(Song.fromRow(row));
            }
            service.loadCatalog(songs);
        }

        List<SongRecommendation> recs = service.recommendForUser(CLI_USER, limit);
        if (recs.isEmpty()) {
            logger.warn("No recommendations produced. Upload a catalog and listening history first.");
        }
        List<String[]> rows = new ArrayList<>();
        for (SongRecommendation r : recs) rows.add(r.toCsvRow());
        csvService.writeTable(config.outputDir().resolve("music-recommendations.csv"), SongRecommendation.CSV_HEADER, rows);
        jsonService.writeJson(config.outputDir().resolve("music-recommendations.json"), Map.of("recommendations", recs));
        jsonService.writeJson(config.outputDir().resolve("song-embeddings.json"), JsonExportService.embeddingsAsMap(service.embeddings()));
        for (SongRecommendation r : recs) {
            logger.info("{} - {} ({})", r.title(), r.artist(), String.format(Locale.ROOT, "%.4f", r.similarityScore()));
        }
        return 0;
    }

    private int runMovie(Path ratingsFile, String userId, String moviesArg, int limit) throws IOException {
        List<Map<String, String>> ratingRows = csvService.readRows(ratingsFile);
        if (ratingRows.isEmpty()) {
            logger.error("No valid ratings found in {}", ratingsFile);
            return 1;
        }
        List<Map<String, String>> movieRows = "-".equals(moviesArg) ? List.of() : csvService.readRows(Paths.get(moviesArg));
        MovieRecommendationService service = new MovieRecommendationService();
        DatasetSummary summary = service.ingest(ratingRows, movieRows);
        logger.info("Dataset: {}", summary);

        List<MovieRecommendation> recs = service.recommend(userId, limit);
        if (recs.isEmpty()) {
            logger.warn("No recommendations for user {}", userId);
        }
        List<String[]> rows = new ArrayList<>();
        for (MovieRecommendation r : recs) rows.add(r.toCsvRow());
        csvService.writeTable(config.outputDir().resolve("movie-recommendations.csv"), MovieRecommendation.CSV_HEADER, rows);
        jsonService.writeJson(config.outputDir().resolve("movie-recommendations.json"),
            Map.of("userId", userId, "stats", summary, "recommendations", recs));
        jsonService.writeJson(config.outputDir().resolve("movie-embeddings.json"), JsonExportService.embeddingsAsMap(service.embeddings()));
        return 0;
    }

    private static int limitArg(String[] args, int index, int defaultLimit) {
        if (args.length <= index) return defaultLimit;
        try {
            int limit = Integer.parseInt(args[index].trim());
            return limit > 0 ? limit : defaultLimit;
        } catch (NumberFormatException e) {
            logger.warn("Ignoring invalid limit '{}', using {}", args[index], defaultLimit);
            return defaultLimit;
        }
    }

    private static int usage() {
        logger.error("Usage:\n  music <catalog.csv|-> <history.csv> [limit]\n  movie <ratings.csv> <userId> [movies.csv|-] [limit]");
        return 2;
    }

    /**
     * Main application entry point.
     * @param args Command-line arguments
     */
    public static void main(String[] args) {
        Main app = new Main(EngineConfig.load(), new CsvService(), new JsonExportService());
        int code = app.run(args);
        if (code != 0) System.exit(code);
    }
}
