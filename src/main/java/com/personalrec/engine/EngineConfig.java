package com.personalrec.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Runtime settings for the engine and CLI.
 * <p>
 * Each key is looked up as an environment variable first, then as a system property, then falls back to a
 * default:
 * <ul>
 *   <li>{@code REC_MUSIC_LIMIT} - songs returned per request (default 10)</li>
 *   <li>{@code REC_MOVIE_LIMIT} - movies returned per request (default 20)</li>
 *   <li>{@code REC_OUTPUT_DIR} - directory the CLI writes exports to (default {@code rec-output})</li>
 * </ul>
 *
 * @author Recommendation Engine Team
 * @since 1.0
 */
public final class EngineConfig {
    private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

    public static final int DEFAULT_MUSIC_LIMIT = 10;
    public static final int DEFAULT_MOVIE_LIMIT = 20;
    public static final String DEFAULT_OUTPUT_DIR = "rec-output";

    private final int musicLimit;
    private final int movieLimit;
    private final Path outputDir;

    public EngineConfig(int musicLimit, int movieLimit, Path outputDir) {
        this.musicLimit = musicLimit;
        this.movieLimit = movieLimit;
        this.outputDir = outputDir;
    }

    /**
     * Builds a config from environment variables and system properties.
     */
    public static EngineConfig load() {
        int music = intSetting("REC_MUSIC_LIMIT", DEFAULT_MUSIC_LIMIT);
        int movie = intSetting("REC_MOVIE_LIMIT", DEFAULT_MOVIE_LIMIT);
        Path out = Paths.get(envOrProp("REC_OUTPUT_DIR", DEFAULT_OUTPUT_DIR));
        logger.debug("Loaded config: musicLimit={}, movieLimit={}, outputDir={}", music, movie, out);
        return new EngineConfig(music, movie, out);
    }

    public static EngineConfig defaults() {
        return new EngineConfig(DEFAULT_MUSIC_LIMIT, DEFAULT_MOVIE_LIMIT, Paths.get(DEFAULT_OUTPUT_DIR));
    }

    public int musicLimit() {
        return musicLimit;
    }

    public int movieLimit() {
        return movieLimit;
    }

    public Path outputDir() {
        return outputDir;
    }

    static String envOrProp(String key, String defaultVal) {
        try {
            String ev = System.getenv(key);
            if (ev != null && !ev.isBlank()) return ev;
        } catch (SecurityException e) {
            logger.debug("Environment lookup for {} denied: {}", key, e.getMessage());
        }
        String prop = System.getProperty(key);
        return prop != null && !prop.isBlank() ? prop : defaultVal;
    }

    private static int intSetting(String key, int defaultVal) {
        String raw = envOrProp(key, Integer.toString(defaultVal));
        try {
            int value = Integer.parseInt(raw.trim());
            if (value > 0) return value;
            logger.warn("Setting {}={} is not positive, using {}", key, raw, defaultVal);
        } catch (NumberFormatException e) {
            logger.warn("Setting {}='{}' is not a number, using {}", key, raw, defaultVal);
        }
        return defaultVal;
    }
}
