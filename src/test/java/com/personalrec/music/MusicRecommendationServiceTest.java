package com.personalrec.music;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class MusicRecommendationServiceTest {

    private static List<Song> songs(String prefix, int count) {
        List<Song> songs = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            songs.add(Song.of(prefix + i, "Artist " + prefix, i % 2 == 0 ? "Rock" : "Jazz"));
        }
        return songs;
    }

    @Test
    void testSingleSongCatalogRecommendsItselfWithFullSimilarity() {
        MusicRecommendationService service = new MusicRecommendationService();
        Song song = new Song("A", "B", "", "Pop", "", "", "", "", 2020, 200, 1, 5, 1, 0, 0, 0, 12, 0, "", "");
        service.loadCatalog(List.of(song));

        List<SongRecommendation> recs = service.recommend(List.of(ListeningRecord.of(song)), 10);

        assertEquals(1, recs.size());
        assertEquals("a::b", recs.get(0).id());
        assertEquals(1.0, recs.get(0).similarityScore(), 1e-9);
    }

    @Test
    void testDuplicateSongsKeepFirstSeen() {
        MusicRecommendationService service = new MusicRecommendationService();
        Song first = new Song("Song", "Band", "First Album", "Rock", "", "", "", "", 2020, 200, 0.5, 3, 0, 0, 0, 0, 12, 0, "", "");
        Song second = new Song(" song ", "BAND", "Second Album", "Rock", "", "", "", "", 2020, 200, 0.5, 3, 0, 0, 0, 0, 12, 0, "", "");

        assertEquals(1, service.loadCatalog(List.of(first, second)));
        assertEquals("First Album", service.catalog().song("song::band").orElseThrow().album());
        assertEquals(1, service.embeddings().size());
    }

    @Test
    void testEmptyCatalogOrHistoryGivesNoRecommendations() {
        MusicRecommendationService service = new MusicRecommendationService();
        ListeningRecord record = ListeningRecord.of(Song.of("A", "B", "Pop"));
        assertTrue(service.recommend(List.of(record), 10).isEmpty());

        service.loadCatalog(songs("s", 3));
        assertTrue(service.recommend(List.of(), 10).isEmpty());
        assertTrue(service.recommend(null, 10).isEmpty());
    }

    @Test
    void testUnknownHistoryScoresEverySongZeroInCatalogOrder() {
        MusicRecommendationService service = new MusicRecommendationService();
        List<Song> catalog = songs("s", 4);
        service.loadCatalog(catalog);

        List<SongRecommendation> recs = service.recommend(List.of(ListeningRecord.of(Song.of("Other", "Else", "Pop"))), 10);

        assertEquals(4, recs.size());
        for (int i = 0; i < catalog.size(); i++) {
            assertEquals(catalog.get(i).key(), recs.get(i).id());
            assertEquals(0.0, recs.get(i).similarityScore());
        }
    }

    @Test
    void testResultsAreSortedAndTruncated() {
        MusicRecommendationService service = new MusicRecommendationService();
        service.loadCatalog(songs("s", 8));

        List<SongRecommendation> recs = service.recommend(List.of(ListeningRecord.of(Song.of("s3", "Artist s", "Jazz"))), 3);

        assertEquals(3, recs.size());
        assertEquals("s3::artist s", recs.get(0).id());
        for (int i = 1; i < recs.size(); i++) {
            assertTrue(recs.get(i - 1).similarityScore() >= recs.get(i).similarityScore());
        }
        assertTrue(service.recommend(List.of(ListeningRecord.of(Song.of("s3", "Artist s", "Jazz"))), 0).isEmpty());
    }

    @Test
    void testListenedSongsAreNotExcluded() {
        MusicRecommendationService service = new MusicRecommendationService();
        service.loadCatalog(songs("s", 3));
        List<SongRecommendation> recs = service.recommend(List.of(ListeningRecord.of(Song.of("s1", "Artist s", "Jazz"))), 10);
        assertEquals(3, recs.size());
        assertEquals("s1::artist s", recs.get(0).id());
    }

    @Test
    void testRecommendForUserBootstrapsCatalogFromHistory() {
        InMemoryListeningHistorySource source = new InMemoryListeningHistorySource();
        source.save("u1", List.of(ListeningRecord.of(Song.of("A", "B", "Pop")), ListeningRecord.of(Song.of("C", "D", "Rock"))));
        MusicRecommendationService service = new MusicRecommendationService(source);

        List<SongRecommendation> recs = service.recommendForUser("u1", 10);

        assertEquals(2, service.catalog().size());
        assertEquals(2, recs.size());
        assertTrue(service.recommendForUser("nobody", 10).isEmpty());
    }

    @Test
    void testBootstrapDoesNotOverwriteConcurrentlyLoadedCatalog() {
        InMemoryListeningHistorySource source = new InMemoryListeningHistorySource();
        source.save("u1", List.of(ListeningRecord.of(Song.of("A", "B", "Pop"))));
        List<Song> fullCatalog = songs("s", 3);
        MusicRecommendationService service = new MusicRecommendationService(source) {
            @Override
            MusicCatalog catalogFromHistory(List<ListeningRecord> history) {
                // another caller publishes a full catalog while the bootstrap is being built
                loadCatalog(fullCatalog);
                return super.catalogFromHistory(history);
            }
        };

        List<SongRecommendation> recs = service.recommendForUser("u1", 10);

        assertEquals(3, service.catalog().size());
        assertEquals(3, recs.size());
        assertFalse(service.embeddings().contains("a::b"));
    }

    @Test
    void testHistorySourceAppendsRecords() {
        InMemoryListeningHistorySource source = new InMemoryListeningHistorySource();
        source.save("u1", List.of(ListeningRecord.of(Song.of("A", "B", "Pop"))));
        source.save("u1", List.of(ListeningRecord.of(Song.of("C", "D", "Rock"))));
        assertEquals(2, source.historyFor("u1").size());
        assertEquals("a::b", source.historyFor("u1").get(0).songKey());
        assertTrue(source.historyFor("u2").isEmpty());
        assertThrows(IllegalArgumentException.class, () -> source.save(" ", List.of()));
    }

    @Test
    void testReloadReplacesCatalog() {
        MusicRecommendationService service = new MusicRecommendationService();
        service.loadCatalog(songs("a", 2));
        service.loadCatalog(songs("b", 3));
        assertEquals(3, service.catalog().size());
        assertFalse(service.embeddings().contains("a0::artist a"));
        assertTrue(service.embeddings().contains("b0::artist b"));
    }

    @Test
    void testConcurrentReloadNeverMixesCatalogs() throws Exception {
        MusicRecommendationService service = new MusicRecommendationService();
        List<Song> catalogA = songs("a", 6);
        List<Song> catalogB = songs("b", 6);
        service.loadCatalog(catalogA);
        List<ListeningRecord> history = List.of(ListeningRecord.of(catalogA.get(0)), ListeningRecord.of(catalogB.get(1)));

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            Future<?> writer = pool.submit(() -> {
                for (int i = 0; i < 200; i++) {
                    service.loadCatalog(i % 2 == 0 ? catalogB : catalogA);
                }
            });
            List<Future<Boolean>> readers = new ArrayList<>();
            for (int t = 0; t < 3; t++) {
                readers.add(pool.submit(() -> {
                    for (int i = 0; i < 200; i++) {
                        List<SongRecommendation> recs = service.recommend(history, 20);
                        if (recs.size() != 6) return false;
                        String prefix = recs.get(0).id().substring(0, 1);
                        for (SongRecommendation r : recs) {
                            if (!r.id().startsWith(prefix)) return false;
                        }
                    }
                    return true;
                }));
            }
            writer.get(30, TimeUnit.SECONDS);
            for (Future<Boolean> reader : readers) {
                assertTrue(reader.get(30, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
