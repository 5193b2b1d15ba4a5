package com.personalrec.music;

import com.personalrec.engine.EmbeddingTable;
import com.personalrec.engine.VectorMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * User tower for the music pipeline.
 * <p>
 * The user vector is the engagement-weighted sum of the embeddings of the songs in the listening history,
 * scaled to unit length. Records for songs missing from the catalog are skipped. When nothing usable remains
 * the zero vector is returned.
 */
public final class ListenerEncoder {
    private static final Logger logger = LoggerFactory.getLogger(ListenerEncoder.class);

    static final double SKIP_PENALTY = 0.3;

    private ListenerEncoder() {}

    /**
     * Aggregation weight for one listening record:
     * {@code (0.5 + completion) * (0.6 + (rating / 5) * 0.8) + liked * 0.5 + min(repeats, 3) * 0.3},
     * multiplied by 0.3 when the song was skipped.
     * @param record Listening record
     * @return Non-negative weight for well-formed signals
     */
    public static double engagementWeight(ListeningRecord record) {
        Song s = record.song();
        double rating = s.rating() / 5.0;
        int repeats = Math.min(s.repeatCount(), 3);
        double weight = (0.5 + s.completionRate()) * (0.6 + rating * 0.8);
        weight += s.likedFlag() * 0.5;
        weight += repeats * 0.3;
        if (s.skipFlag() != 0) weight *= SKIP_PENALTY;
        return weight;
    }

    /**
     * Builds the user embedding from a listening history.
     * @param history Listening records in any order (null is treated as empty)
     * @param songEmbeddings Current song embedding table
     * @return Unit-length vector, or all zeros when no record matched the catalog
     */
    public static double[] encode(List<ListeningRecord> history, EmbeddingTable songEmbeddings) {
        int dim = songEmbeddings.dimension();
        double[] agg = new double[dim];
        double totalWeight = 0;
        int matched = 0;
        if (history != null) {
            for (ListeningRecord record : history) {
                Optional<double[]> emb = songEmbeddings.get(record.songKey());
                if (emb.isEmpty()) continue;
                double weight = engagementWeight(record);
                double[] e = emb.get();
                for (int i = 0; i < dim; i++) {
                    agg[i] += e[i] * weight;
                }
                totalWeight += weight;
                matched++;
            }
        }
        if (totalWeight == 0) {
            logger.debug("No usable listening history ({} records), returning zero vector", history == null ? 0 : history.size());
            return new double[dim];
        }
        logger.debug("Aggregated {} of {} records, total weight {}", matched, history.size(), totalWeight);
        return VectorMath.l2Normalize(agg);
    }
}
