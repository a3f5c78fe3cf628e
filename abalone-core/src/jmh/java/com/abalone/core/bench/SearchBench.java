package com.abalone.core.bench;

import com.abalone.core.Board;
import com.abalone.core.Player;
import com.abalone.core.ai.MinimaxAI;
import com.abalone.core.ai.SearchConfig;
import java.util.concurrent.TimeUnit;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

/** Full searches from the standard opening, per depth and preset. */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@Warmup(iterations = 2, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@Fork(1)
@State(Scope.Benchmark)
public class SearchBench {

    @Param({"1", "2", "3"})
    int depth;

    @Param({"balanced", "material"})
    String heuristic;

    private final MinimaxAI searcher = new MinimaxAI();
    private final Board board = Board.standard();

    @Benchmark
    public long search() {
        SearchConfig config = new SearchConfig(depth, heuristic, "lexicographic");
        return searcher.search(board, Player.BLACK, config).visitedNodes();
    }
}
