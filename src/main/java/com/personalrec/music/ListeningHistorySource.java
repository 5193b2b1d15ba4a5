package com.personalrec.music;

import java.util.List;

/**
 * Provider of a user's listening history. Storage lives outside the engine; implementations must return
 * fully materialized records.
 */
public interface ListeningHistorySource {
    /**
     * @param userId User identifier
     * @return The user's records, empty when the user is unknown
     */
    List<ListeningRecord> historyFor(String userId);
}
