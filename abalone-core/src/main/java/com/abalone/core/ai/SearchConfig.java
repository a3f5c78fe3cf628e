package com.abalone.core.ai;

import java.util.Objects;

/**
 * Immutable search configuration passed to {@link Searcher} implementations.
 *
 * @param depth     search plies, between {@link #MIN_DEPTH} and {@link #MAX_DEPTH}
 * @param heuristic name of a {@link HeuristicPreset}; unknown names fall back to the default
 * @param tieBreak  name of a {@link TieBreakPolicy}
 */
public record SearchConfig(int depth, String heuristic, String tieBreak) {

    public static final int MIN_DEPTH = 1;
    public static final int MAX_DEPTH = 5;
    public static final int DEFAULT_DEPTH = 2;

    public SearchConfig {
        Objects.requireNonNull(heuristic, "heuristic");
        Objects.requireNonNull(tieBreak, "tieBreak");
        if (depth < MIN_DEPTH || depth > MAX_DEPTH) {
            throw new IllegalArgumentException("depth must be between " + MIN_DEPTH + " and " + MAX_DEPTH
                    + ": " + depth);
        }
    }

    /**
     * Depth 2 with the balanced preset and lexicographic tie-breaking.
     */
    public static SearchConfig defaults() {
        return new SearchConfig(DEFAULT_DEPTH, HeuristicPreset.DEFAULT.presetName(),
                TieBreakPolicy.LEXICOGRAPHIC.policyName());
    }

    public static SearchConfig ofDepth(int depth) {
        return defaults().withDepth(depth);
    }

    public SearchConfig withDepth(int newDepth) {
        return new SearchConfig(newDepth, heuristic, tieBreak);
    }

    public SearchConfig withHeuristic(String newHeuristic) {
        return new SearchConfig(depth, newHeuristic, tieBreak);
    }

    public SearchConfig withTieBreak(String newTieBreak) {
        return new SearchConfig(depth, heuristic, newTieBreak);
    }
}
