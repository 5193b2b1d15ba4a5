package com.personalrec.engine;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

public class EngineConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty("REC_MUSIC_LIMIT");
        System.clearProperty("REC_MOVIE_LIMIT");
        System.clearProperty("REC_OUTPUT_DIR");
    }

    @Test
    void testDefaults() {
        EngineConfig config = EngineConfig.defaults();
        assertEquals(10, config.musicLimit());
        assertEquals(20, config.movieLimit());
        assertEquals(Paths.get("rec-output"), config.outputDir());
    }

    @Test
    void testSystemPropertiesOverrideDefaults() {
        System.setProperty("REC_MUSIC_LIMIT", "5");
        System.setProperty("REC_OUTPUT_DIR", "elsewhere");
        EngineConfig config = EngineConfig.load();
        assertEquals(5, config.musicLimit());
        assertEquals(Paths.get("elsewhere"), config.outputDir());
    }

    @Test
    void testInvalidLimitsFallBackToDefaults() {
        System.setProperty("REC_MUSIC_LIMIT", "ten");
        System.setProperty("REC_MOVIE_LIMIT", "-3");
        EngineConfig config = EngineConfig.load();
        assertEquals(EngineConfig.DEFAULT_MUSIC_LIMIT, config.musicLimit());
        assertEquals(EngineConfig.DEFAULT_MOVIE_LIMIT, config.movieLimit());
    }
}
