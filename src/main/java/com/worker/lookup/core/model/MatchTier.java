package com.worker.lookup.core.model;

/**
 * Qualitative category of a match between a search term and a candidate text.
 * Each tier carries the fixed score a candidate receives for it.
 */
public enum MatchTier {

    /** Normalized text equals the term. */
    EXACT(100),

    /** Normalized text starts with the term. */
    PREFIX(80),

    /** Normalized text contains the term somewhere past the start. */
    CONTAINS(60),

    /** No substring relation, but edit-distance similarity is above the fuzzy threshold. */
    FUZZY(40);

    private final int score;

    MatchTier(int score) {
        this.score = score;
    }

    public int score() {
        return score;
    }
}
