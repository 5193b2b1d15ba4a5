package com.personalrec.engine;

/**
 * One ranked candidate: the item's identity key and its cosine similarity to the user vector.
 */
public record ScoredItem(String key, double score) {}
