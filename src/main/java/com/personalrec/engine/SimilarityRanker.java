package com.personalrec.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scores a user vector against every item of an {@link EmbeddingTable} and keeps the best matches.
 * <p>
 * Ranking workflow:
 * <ul>
 *   <li>Candidates are visited in table (catalog) order; excluded keys are dropped before scoring.</li>
 *   <li>Each candidate is scored with {@link VectorMath#cosine(double[], double[])}.</li>
 *   <li>Candidates are sorted by score, highest first, with a stable sort: equal scores keep catalog order.</li>
 *   <li>The list is truncated to the requested limit.</li>
 * </ul>
 * A zero user vector scores every candidate 0, so the result is simply the first {@code limit} candidates in
 * catalog order.
 *
 * @author Recommendation Engine Team
 * @since 1.0
 */
public final class SimilarityRanker {
    private static final Logger logger = LoggerFactory.getLogger(SimilarityRanker.class);

    private static final Comparator<ScoredItem> BY_SCORE_DESC =
        Comparator.comparingDouble(ScoredItem::score).reversed();

    private SimilarityRanker() {}

    /**
     * Ranks every item in the table against the user vector.
     * @param userVector User embedding; must match the table dimension
     * @param table Item embeddings in catalog order
     * @param excluded Keys that must not appear in the result (may be null)
     * @param limit Maximum number of results; zero or negative yields an empty list
     * @return Candidates ordered by similarity, at most {@code limit} long
     * @throws IllegalArgumentException if the user vector length differs from the table dimension
     */
    public static List<ScoredItem> topK(double[] userVector, EmbeddingTable table, Set<String> excluded, int limit) {
        if (table == null) {
            throw new IllegalArgumentException("Embedding table cannot be null");
        }
        if (userVector == null || userVector.length != table.dimension()) {
            throw new IllegalArgumentException("User vector must have " + table.dimension() + " dimensions");
        }
        if (limit <= 0 || table.isEmpty()) {
            return Collections.emptyList();
        }
        Set<String> skip = excluded == null ? Set.of() : excluded;
        List<ScoredItem> scored = new ArrayList<>(table.size());
        for (Map.Entry<String, double[]> entry : table.view().entrySet()) {
            if (skip.contains(entry.getKey())) continue;
            scored.add(new ScoredItem(entry.getKey(), VectorMath.cosine(userVector, entry.getValue())));
        }
        // List.sort is a stable merge sort
        scored.sort(BY_SCORE_DESC);
        List<ScoredItem> top = scored.size() > limit ? new ArrayList<>(scored.subList(0, limit)) : scored;
        logger.debug("Ranked {} candidates ({} excluded), returning {}", scored.size(), table.size() - scored.size(), top.size());
        return Collections.unmodifiableList(top);
    }
}
