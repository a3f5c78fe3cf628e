package com.abalone.core.ai;

import com.abalone.core.Board;
import com.abalone.core.Geometry;
import com.abalone.core.MoveGenerator;
import com.abalone.core.Player;
import com.abalone.core.Position;
import java.util.Objects;

/**
 * Weighted sum of four symmetric terms: captures, live material, closeness to the center and
 * the number of legal moves. Every term is the player's value minus the opponent's.
 */
public final class HeuristicEvaluator implements Evaluator {

    private final HeuristicPreset preset;

    public HeuristicEvaluator(HeuristicPreset preset) {
        this.preset = Objects.requireNonNull(preset, "preset");
    }

    public HeuristicPreset getPreset() {
        return preset;
    }

    @Override
    public double evaluate(Board board, Player perspective) {
        double value = preset.scoreWeight() * scoreAdvantage(board, perspective)
                + preset.materialWeight() * materialAdvantage(board, perspective);
        if (preset.centerWeight() != 0.0) {
            value += preset.centerWeight() * centerControl(board, perspective);
        }
        // generating moves for both sides dominates the cost, skip it when it carries no weight
        if (preset.mobilityWeight() != 0.0) {
            value += preset.mobilityWeight() * mobility(board, perspective);
        }
        return value;
    }

    public static double scoreAdvantage(Board board, Player player) {
        return board.score(player) - board.score(player.opponent());
    }

    public static double materialAdvantage(Board board, Player player) {
        return board.marbleCount(player) - board.marbleCount(player.opponent());
    }

    /**
     * Opponent's summed center distance minus the player's, so marbles nearer the center score
     * higher.
     */
    public static double centerControl(Board board, Player player) {
        return centerDistanceSum(board, player.opponent()) - centerDistanceSum(board, player);
    }

    public static double mobility(Board board, Player player) {
        return MoveGenerator.generateLegalMoves(board, player).size()
                - MoveGenerator.generateLegalMoves(board, player.opponent()).size();
    }

    private static int centerDistanceSum(Board board, Player player) {
        int total = 0;
        for (Position marble : board.marbles(player)) {
            total += Geometry.centerDistance(marble);
        }
        return total;
    }
}
