package com.personalrec.engine;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class EmbeddingTableTest {

    @Test
    void testFirstVectorForKeyWins() {
        EmbeddingTable table = EmbeddingTable.builder(2)
            .put("a", new double[]{1, 0})
            .put("b", new double[]{0, 1})
            .put("a", new double[]{5, 5})
            .build();
        assertEquals(2, table.size());
        assertArrayEquals(new double[]{1, 0}, table.get("a").orElseThrow());
        assertEquals(List.of("a", "b"), List.copyOf(table.keys()));
    }

    @Test
    void testWrongDimensionIsRejected() {
        EmbeddingTable.Builder builder = EmbeddingTable.builder(3);
        assertThrows(IllegalArgumentException.class, () -> builder.put("x", new double[2]));
        assertThrows(IllegalArgumentException.class, () -> builder.put(null, new double[3]));
        assertThrows(IllegalArgumentException.class, () -> EmbeddingTable.builder(0));
    }

    @Test
    void testPublishedVectorsCannotBeModified() {
        double[] source = {1, 2};
        EmbeddingTable table = EmbeddingTable.builder(2).put("a", source).build();
        source[0] = 99;
        double[] copy = table.get("a").orElseThrow();
        copy[1] = 99;
        assertArrayEquals(new double[]{1, 2}, table.get("a").orElseThrow());
        assertThrows(UnsupportedOperationException.class, () -> table.keys().remove("a"));
    }

    @Test
    void testUnknownKeyIsEmpty() {
        EmbeddingTable table = EmbeddingTable.empty(4);
        assertTrue(table.isEmpty());
        assertTrue(table.get("missing").isEmpty());
        assertTrue(table.get(null).isEmpty());
        assertFalse(table.contains(null));
    }
}
