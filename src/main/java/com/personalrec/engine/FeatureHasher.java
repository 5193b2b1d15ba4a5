package com.personalrec.engine;

import java.util.Locale;

/**
 * Character-code feature hashing shared by both item and user towers.
 * <p>
 * Every character of the lower-cased text adds {@code (code / 255) * weight} to one coordinate of the
 * target vector. The mapping is deterministic and order-sensitive but carries no semantics: unrelated
 * words can land on the same coordinates.
 * <ul>
 *   <li>{@link #spread} walks forward from the offset and wraps around the whole vector.</li>
 *   <li>{@link #hashBand} keeps the text inside a {@value #BAND_WIDTH}-wide band and never writes past the end of the vector.</li>
 * </ul>
 *
 * @author Recommendation Engine Team
 * @since 1.0
 */
public final class FeatureHasher {
    public static final int BAND_WIDTH = 16;

    private FeatureHasher() {}

    /**
     * Adds the text's character codes starting at {@code offset}, wrapping modulo the vector length.
     * @param text Text to hash (null is treated as empty)
     * @param vec Target vector, modified in place
     * @param offset First coordinate written
     * @param weight Importance weight applied to every character
     */
    public static void spread(String text, double[] vec, int offset, double weight) {
        String normalized = normalize(text);
        for (int i = 0; i < normalized.length(); i++) {
            int idx = (offset + i) % vec.length;
            vec[idx] += (normalized.charAt(i) / 255.0) * weight;
        }
    }

    /**
     * Adds the text's character codes into the band {@code [offset, offset + 16)}, folding longer text
     * back onto the band. Characters whose running position would fall past the end of the vector are dropped.
     * @param text Text to hash (null is treated as empty)
     * @param vec Target vector, modified in place
     * @param offset First coordinate of the band
     * @param weight Importance weight applied to every character
     */
    public static void hashBand(String text, double[] vec, int offset, double weight) {
        String normalized = normalize(text);
        for (int i = 0; i < normalized.length() && offset + i < vec.length; i++) {
            int idx = offset + (i % BAND_WIDTH);
            vec[idx] += (normalized.charAt(i) / 255.0) * weight;
        }
    }

    /**
     * Folds an identifier into [0, 1) with a 32-bit rolling hash ({@code h * 31 + c}).
     * Stable within and across runs.
     * @param id Identifier (null is treated as empty)
     * @return Value in [0, 1)
     */
    public static double hashUserId(String id) {
        String str = id == null ? "" : id;
        int hash = 0;
        for (int i = 0; i < str.length(); i++) {
            hash = ((hash << 5) - hash) + str.charAt(i);
        }
        // widen before abs so Integer.MIN_VALUE stays positive
        return (Math.abs((long) hash) % 1000) / 1000.0;
    }

    private static String normalize(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }
}
