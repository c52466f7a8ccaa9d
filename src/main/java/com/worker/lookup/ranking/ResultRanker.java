package com.worker.lookup.ranking;

import com.worker.lookup.core.model.MatchTier;
import com.worker.lookup.core.model.RankedResult;
import com.worker.lookup.core.model.SearchTerm;
import com.worker.lookup.similarity.LevenshteinSimilarity;
import com.worker.lookup.similarity.SimilarityAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/**
 * Scores store candidates against a search term and orders them best first.
 *
 * <p>Every searchable text of a candidate is normalized like the term and
 * classified, strongest tier first:</p>
 * <ol>
 *   <li>equal to the term: {@link MatchTier#EXACT} (100)</li>
 *   <li>starts with the term: {@link MatchTier#PREFIX} (80)</li>
 *   <li>contains the term: {@link MatchTier#CONTAINS} (60)</li>
 *   <li>similarity above {@value #DEFAULT_FUZZY_THRESHOLD}: {@link MatchTier#FUZZY} (40)</li>
 * </ol>
 *
 * <p>A candidate keeps the best tier across its texts. Candidates with no tier
 * are dropped. The sort is stable, so equal scores keep store order.</p>
 */
public class ResultRanker {
    private static final Logger log = LoggerFactory.getLogger(ResultRanker.class);

    public static final double DEFAULT_FUZZY_THRESHOLD = 0.7;

    private static final Comparator<RankedResult<?>> BY_SCORE_DESC =
            Comparator.comparingInt((RankedResult<?> r) -> r.score()).reversed();

    private final SimilarityAlgorithm similarity;
    private final double fuzzyThreshold;

    public ResultRanker() {
        this(new LevenshteinSimilarity(), DEFAULT_FUZZY_THRESHOLD);
    }

    public ResultRanker(SimilarityAlgorithm similarity, double fuzzyThreshold) {
        if (fuzzyThreshold < 0.0 || fuzzyThreshold > 1.0) {
            throw new IllegalArgumentException("fuzzyThreshold must be between 0.0 and 1.0");
        }
        this.similarity = similarity;
        this.fuzzyThreshold = fuzzyThreshold;
    }

    /**
     * Ranks candidates against raw input. Input that is not a valid search term
     * (under three characters, for example) yields an empty list.
     */
    public <C> List<RankedResult<C>> rank(List<C> candidates, String rawTerm,
                                          Function<? super C, ? extends List<String>> textsOf) {
        return SearchTerm.parse(rawTerm)
                .map(term -> rank(candidates, term, textsOf))
                .orElseGet(List::of);
    }

    /**
     * Ranks candidates against an already validated term.
     *
     * @param candidates store rows, in store order
     * @param term       the search term
     * @param textsOf    projection of a candidate onto its searchable texts
     * @return matched candidates, best score first
     */
    public <C> List<RankedResult<C>> rank(List<C> candidates, SearchTerm term,
                                          Function<? super C, ? extends List<String>> textsOf) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }

        String normalizedTerm = term.normalized();
        List<RankedResult<C>> ranked = new ArrayList<>(candidates.size());

        for (C candidate : candidates) {
            if (candidate == null) {
                continue;
            }
            MatchTier best = bestTier(textsOf.apply(candidate), normalizedTerm);
            if (best != null) {
                ranked.add(RankedResult.of(candidate, best));
            }
        }

        ranked.sort(BY_SCORE_DESC);

        log.debug("rank.completed term='{}' candidates={} matched={}",
                normalizedTerm, candidates.size(), ranked.size());
        return ranked;
    }

    /**
     * Classifies a single normalized text against a normalized term.
     *
     * @return the tier, or {@code null} when the text does not match at all
     */
    public MatchTier classify(String normalizedText, String normalizedTerm) {
        if (normalizedText.equals(normalizedTerm)) {
            return MatchTier.EXACT;
        }
        if (normalizedText.startsWith(normalizedTerm)) {
            return MatchTier.PREFIX;
        }
        if (normalizedText.contains(normalizedTerm)) {
            return MatchTier.CONTAINS;
        }
        if (similarity.compute(normalizedText, normalizedTerm) > fuzzyThreshold) {
            return MatchTier.FUZZY;
        }
        return null;
    }

    private MatchTier bestTier(List<String> texts, String normalizedTerm) {
        if (texts == null) {
            return null;
        }
        MatchTier best = null;
        for (String text : texts) {
            if (text == null) {
                continue;
            }
            MatchTier tier = classify(SearchTerm.normalize(text), normalizedTerm);
            if (tier != null && (best == null || tier.score() > best.score())) {
                best = tier;
                if (best == MatchTier.EXACT) {
                    break;
                }
            }
        }
        return best;
    }
}
