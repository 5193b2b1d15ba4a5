package com.personalrec.engine;

/**
 * Numeric helpers over embedding vectors.
 * <p>
 * Zero vectors are valid input everywhere: they stand for "no information" and compare as 0 against
 * anything. Vectors of different lengths are a programming error and are rejected.
 *
 * @author Recommendation Engine Team
 * @since 1.0
 */
public final class VectorMath {
    private VectorMath() {}

    /**
     * Cosine similarity {@code dot(a, b) / (|a| * |b|)}, with a zero denominator replaced by 1.
     * @param a First vector
     * @param b Second vector
     * @return Similarity in [-1, 1]
     * @throws IllegalArgumentException if either vector is null or the lengths differ
     */
    public static double cosine(double[] a, double[] b) {
        requireSameLength(a, b);
        double dot = 0;
        double magA = 0;
        double magB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            magA += a[i] * a[i];
            magB += b[i] * b[i];
        }
        double denominator = Math.sqrt(magA) * Math.sqrt(magB);
        if (denominator == 0) denominator = 1;
        double similarity = dot / denominator;
        // rounding can push a self-comparison a hair past 1
        return Math.max(-1.0, Math.min(1.0, similarity));
    }

    /**
     * Euclidean norm of a vector.
     */
    public static double norm(double[] vec) {
        double sum = 0;
        for (double v : vec) sum += v * v;
        return Math.sqrt(sum);
    }

    /**
     * Returns a new vector scaled to unit length. A zero vector is returned unchanged (as a copy).
     * @param vec Vector to normalize
     * @return Unit-length copy, or an all-zero copy
     */
    public static double[] l2Normalize(double[] vec) {
        double magnitude = norm(vec);
        if (magnitude == 0) magnitude = 1;
        double[] out = new double[vec.length];
        for (int i = 0; i < vec.length; i++) out[i] = vec[i] / magnitude;
        return out;
    }

    /**
     * True when every coordinate is exactly zero.
     */
    public static boolean isZero(double[] vec) {
        for (double v : vec) {
            if (v != 0) return false;
        }
        return true;
    }

    private static void requireSameLength(double[] a, double[] b) {
        if (a == null || b == null) {
            throw new IllegalArgumentException("Vectors must not be null");
        }
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vector dimension mismatch: " + a.length + " vs " + b.length);
        }
    }
}
