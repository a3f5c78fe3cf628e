package com.abalone.core.bench;

import com.abalone.core.Board;
import com.abalone.core.Layout;
import com.abalone.core.Player;
import com.abalone.core.ai.HeuristicEvaluator;
import com.abalone.core.ai.HeuristicPreset;
import java.util.concurrent.TimeUnit;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

/** Leaf evaluation cost with the mobility term (balanced) against material only. */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@Warmup(iterations = 5, time = 400, timeUnit = TimeUnit.MILLISECONDS)
@Measurement(iterations = 10, time = 400, timeUnit = TimeUnit.MILLISECONDS)
@Fork(1)
public class EvaluatorBench {

    @State(Scope.Thread)
    public static class Positions {

        @Param({"standard", "belgian_daisy", "german_daisy"})
        String layout;

        Board board;
        HeuristicEvaluator balanced;
        HeuristicEvaluator material;

        @Setup(Level.Trial)
        public void init() {
            board = Board.withLayout(Layout.fromName(layout));
            balanced = new HeuristicEvaluator(HeuristicPreset.BALANCED);
            material = new HeuristicEvaluator(HeuristicPreset.MATERIAL);
        }
    }

    @Benchmark
    public double balanced(Positions positions) {
        return positions.balanced.evaluate(positions.board, Player.BLACK);
    }

    @Benchmark
    public double materialOnly(Positions positions) {
        return positions.material.evaluate(positions.board, Player.BLACK);
    }

    @Benchmark
    public double mobilityTerm(Positions positions) {
        return HeuristicEvaluator.mobility(positions.board, Player.BLACK);
    }
}
