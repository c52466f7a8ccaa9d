package com.worker.lookup.core.model;

import java.util.Objects;

/**
 * A candidate paired with its best score and the tier that produced it.
 *
 * @param item      the candidate as supplied by the record store
 * @param score     0..100, taken from {@link MatchTier#score()}
 * @param matchTier the tier of the best-scoring searchable text
 * @param <C>       candidate type
 */
public record RankedResult<C>(C item, int score, MatchTier matchTier) {

    public RankedResult {
        Objects.requireNonNull(item, "item is required");
        Objects.requireNonNull(matchTier, "matchTier is required");
        if (score < 0 || score > 100) {
            throw new IllegalArgumentException("score must be between 0 and 100, got " + score);
        }
    }

    public static <C> RankedResult<C> of(C item, MatchTier tier) {
        return new RankedResult<>(item, tier.score(), tier);
    }
}
