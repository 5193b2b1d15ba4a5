package com.personalrec.movie;

import com.personalrec.engine.EmbeddingTable;
import com.personalrec.engine.VectorMath;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ViewerEncoderTest {
    private static final double EPS = 1e-9;
    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochSecond(1_700_000_000L), ZoneOffset.UTC);

    private static double[] encode(String userId, List<RatingRecord> ratings, List<Movie> movies) {
        CatalogStatistics stats = CatalogStatisticsBuilder.build(ratings, movies);
        EmbeddingTable table = MovieEncoder.encodeAll(stats, CLOCK);
        return ViewerEncoder.encode(userId, stats, table);
    }

    @Test
    void testUnknownUserEncodesAsZeros() {
        double[] vec = encode("ghost", CatalogStatisticsBuilderTest.sampleRatings(), List.of());
        assertEquals(MovieEncoder.DIMENSION, vec.length);
        assertTrue(VectorMath.isZero(vec));
    }

    @Test
    void testKnownUserIsUnitLengthAndDeterministic() {
        double[] first = encode("u1", CatalogStatisticsBuilderTest.sampleRatings(), List.of());
        double[] second = encode("u1", CatalogStatisticsBuilderTest.sampleRatings(), List.of());
        assertEquals(1.0, VectorMath.norm(first), EPS);
        assertArrayEquals(first, second);
    }

    @Test
    void testStatisticalFeaturesKeepTheirProportions() {
        double[] vec = encode("u1", List.of(
            new RatingRecord("u1", "a", 3, 1),
            new RatingRecord("u1", "b", 3, 2)), List.of());
        assertEquals(150.0, vec[0] / vec[2], 1e-6);
        assertEquals(0.0, vec[1]);
        assertEquals(0.0, vec[3]);
        assertEquals(0.0, vec[4]);
    }

    @Test
    void testGenrePreferencesAreMeanRatingPerGenre() {
        double[] vec = encode("u1", List.of(
            new RatingRecord("u1", "a", 4, 1),
            new RatingRecord("u1", "b", 2, 2)),
            List.of(new Movie("a", "A", "Action|Comedy", null), new Movie("b", "B", "Drama", null)));
        assertEquals(2.0, vec[48] / vec[50], 1e-6);
        assertEquals(vec[48], vec[49], EPS);
        assertEquals(0.0, vec[51]);
    }

    @Test
    void testDislikedMoviesPushAwayInAntiPatternBand() {
        double[] vec = encode("u1", List.of(new RatingRecord("u1", "x", 1, 1)),
            List.of(new Movie("x", "X", "Documentary|Horror", null)));
        assertTrue(vec[32] < 0);
        assertTrue(vec[39] < 0);
        assertEquals(0.0, vec[40]);
    }

    @Test
    void testLikedMoviesPullTowardsTheirEmbedding() {
        List<RatingRecord> ratings = List.of(
            new RatingRecord("u1", "a", 5, 1),
            new RatingRecord("u2", "a", 5, 1),
            new RatingRecord("u2", "b", 1, 1));
        List<Movie> movies = List.of(new Movie("a", "A", "Comedy", null), new Movie("b", "B", "Horror", null));
        CatalogStatistics stats = CatalogStatisticsBuilder.build(ratings, movies);
        EmbeddingTable table = MovieEncoder.encodeAll(stats, CLOCK);
        double[] user = ViewerEncoder.encode("u1", stats, table);
        double toLiked = VectorMath.cosine(user, table.get("a").orElseThrow());
        double toOther = VectorMath.cosine(user, table.get("b").orElseThrow());
        assertTrue(toLiked > toOther);
    }
}
