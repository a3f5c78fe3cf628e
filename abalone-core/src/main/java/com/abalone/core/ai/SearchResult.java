package com.abalone.core.ai;

import com.abalone.core.Move;
import java.time.Duration;
import java.util.Objects;

/**
 * Result payload returned by {@link Searcher} implementations.
 *
 * @param move         the chosen move, or {@code null} when the mover has no legal move
 * @param score        value of the chosen line from the mover's perspective
 * @param visitedNodes positions visited
 * @param elapsed      wall time spent searching
 * @param depth        plies searched
 * @param telemetry    detailed counters
 */
public record SearchResult(Move move, double score, long visitedNodes, Duration elapsed, int depth,
        SearchTelemetry telemetry) {

    public SearchResult {
        Objects.requireNonNull(elapsed, "elapsed");
        telemetry = telemetry == null ? SearchTelemetry.empty() : telemetry;
    }

    public boolean hasMove() {
        return move != null;
    }

    public double elapsedMillis() {
        return elapsed.toNanos() / 1_000_000.0;
    }
}
