package com.personalrec.music;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Listening history kept in memory, used by the CLI and tests. Each user's history is an immutable list that is
 * replaced, not mutated, when records are appended.
 */
public class InMemoryListeningHistorySource implements ListeningHistorySource {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryListeningHistorySource.class);

    private final Map<String, List<ListeningRecord>> histories = new ConcurrentHashMap<>();

    /**
     * Appends records to a user's history.
     * @param userId User identifier
     * @param records Records to append, in listening order
     */
    public void save(String userId, List<ListeningRecord> records) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User id cannot be null or blank");
        }
        if (records == null || records.isEmpty()) return;
        histories.merge(userId, List.copyOf(records), (existing, added) -> {
            List<ListeningRecord> merged = new ArrayList<>(existing);
            merged.addAll(added);
            return List.copyOf(merged);
        });
        logger.info("Saved {} listening records for user {}", records.size(), userId);
    }

    @Override
    public List<ListeningRecord> historyFor(String userId) {
        if (userId == null) return List.of();
        return histories.getOrDefault(userId, List.of());
    }
}
