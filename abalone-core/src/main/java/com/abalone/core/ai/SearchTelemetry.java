package com.abalone.core.ai;

/**
 * Counters captured during a single {@link Searcher#search} call.
 *
 * @param nodes           positions visited, the root included
 * @param cutoffs         nodes whose remaining siblings were skipped by alpha-beta
 * @param leafEvaluations static evaluations performed
 * @param tieBreaks       times an equal-valued move replaced the incumbent
 * @param elapsedNanos    wall time of the search
 */
public record SearchTelemetry(long nodes, long cutoffs, long leafEvaluations, long tieBreaks, long elapsedNanos) {

    private static final SearchTelemetry EMPTY = new SearchTelemetry(0L, 0L, 0L, 0L, 0L);

    public static SearchTelemetry empty() {
        return EMPTY;
    }

    public double elapsedMillis() {
        return elapsedNanos / 1_000_000.0;
    }

    public double nodesPerSecond() {
        return elapsedNanos == 0L ? 0.0 : nodes * 1_000_000_000.0 / elapsedNanos;
    }
}
