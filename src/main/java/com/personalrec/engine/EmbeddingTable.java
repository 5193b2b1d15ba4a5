package com.personalrec.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable snapshot of item embeddings keyed by normalized identity.
 * <p>
 * Every vector has exactly {@link #dimension()} coordinates. Enumeration follows insertion order, which is
 * the catalog order the ranker uses to break ties. Vectors are copied on the way in and on the way out so a
 * published table can never change underneath a reader.
 *
 * @author Recommendation Engine Team
 * @since 1.0
 */
public final class EmbeddingTable {
    private final int dimension;
    private final Map<String, double[]> vectors;

    private EmbeddingTable(int dimension, Map<String, double[]> vectors) {
        this.dimension = dimension;
        this.vectors = Collections.unmodifiableMap(vectors);
    }

    public static EmbeddingTable empty(int dimension) {
        return new EmbeddingTable(dimension, new LinkedHashMap<>());
    }

    public static Builder builder(int dimension) {
        return new Builder(dimension);
    }

    public int dimension() {
        return dimension;
    }

    public int size() {
        return vectors.size();
    }

    public boolean isEmpty() {
        return vectors.isEmpty();
    }

    public boolean contains(String key) {
        return key != null && vectors.containsKey(key);
    }

    /**
     * Keys in catalog order.
     */
    public Set<String> keys() {
        return vectors.keySet();
    }

    /**
     * Returns a copy of the embedding for {@code key}, or empty when the key is unknown.
     */
    public Optional<double[]> get(String key) {
        if (key == null) return Optional.empty();
        double[] vec = vectors.get(key);
        return vec == null ? Optional.empty() : Optional.of(vec.clone());
    }

    /**
     * Read-only view used by the ranker; callers must not modify the arrays.
     */
    Map<String, double[]> view() {
        return vectors;
    }

    /**
     * Collects vectors into a new table. A key that is put twice keeps its first vector.
     */
    public static final class Builder {
        private final int dimension;
        private final Map<String, double[]> vectors = new LinkedHashMap<>();

        private Builder(int dimension) {
            if (dimension <= 0) {
                throw new IllegalArgumentException("Embedding dimension must be positive: " + dimension);
            }
            this.dimension = dimension;
        }

        public Builder put(String key, double[] vector) {
            if (key == null) {
                throw new IllegalArgumentException("Embedding key cannot be null");
            }
            if (vector == null || vector.length != dimension) {
                throw new IllegalArgumentException("Embedding for '" + key + "' must have " + dimension + " dimensions");
            }
            vectors.putIfAbsent(key, vector.clone());
            return this;
        }

        public EmbeddingTable build() {
            return new EmbeddingTable(dimension, new LinkedHashMap<>(vectors));
        }
    }
}
