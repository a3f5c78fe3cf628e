package com.abalone.core.ai;

import com.abalone.core.Board;
import com.abalone.core.Move;
import com.abalone.core.MoveGenerator;
import com.abalone.core.Player;
import com.abalone.core.Rules;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Depth-limited minimax searcher with alpha-beta pruning.
 *
 * <p>Every node is scored from the root player's perspective: nodes where the root player moves
 * maximise, the others minimise. A node is a leaf when the depth is exhausted, when either side
 * has pushed off six marbles, or when the side to move has no legal move. Children are searched on
 * board copies in {@link MoveOrdering} order, and an exact tie with the current best is settled
 * by the configured {@link TieBreakPolicy}.
 *
 * <p>Instances hold no per-search state, so one searcher may serve several threads.
 */
public final class MinimaxAI implements Searcher {

    private static final Logger LOGGER = Logger.getLogger(MinimaxAI.class.getName());

    private final Function<HeuristicPreset, Evaluator> evaluatorFactory;

    /**
     * Creates a searcher that scores leaves with a {@link HeuristicEvaluator} for the configured
     * preset.
     */
    public MinimaxAI() {
        this(HeuristicEvaluator::new);
    }

    /**
     * Creates a searcher that scores leaves with the provided evaluator, ignoring the configured
     * preset.
     */
    public MinimaxAI(Evaluator evaluator) {
        this(fixed(evaluator));
    }

    public MinimaxAI(Function<HeuristicPreset, Evaluator> evaluatorFactory) {
        this.evaluatorFactory = Objects.requireNonNull(evaluatorFactory, "evaluatorFactory");
    }

    /**
     * Searches with the default configuration at the provided depth and returns the chosen move,
     * or {@code null} if there is none.
     */
    public Move findBestMove(Board board, Player player, int depth) {
        return search(board, player, SearchConfig.ofDepth(depth)).move();
    }

    @Override
    public SearchResult search(Board board, Player player, SearchConfig config) {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(player, "player");
        Objects.requireNonNull(config, "config");

        Evaluator evaluator = Objects.requireNonNull(
                evaluatorFactory.apply(HeuristicPreset.fromName(config.heuristic())), "evaluator");
        SearchContext context = new SearchContext(player, evaluator, TieBreakPolicy.fromName(config.tieBreak()));

        long searchStart = System.nanoTime();
        Scored root = minimax(context, board.copy(), player, config.depth(),
                Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);
        long elapsedNanos = System.nanoTime() - searchStart;

        SearchTelemetry telemetry = new SearchTelemetry(context.nodes, context.cutoffs, context.leafEvaluations,
                context.tieBreaks, elapsedNanos);
        LOGGER.info(() -> String.format("Minimax chose %s for %s (score=%.1f, nodes=%d, cutoffs=%d, depth=%d, %.1f ms)",
                root.move == null ? "no move" : root.move.notation(), player, root.value, context.nodes,
                context.cutoffs, config.depth(), telemetry.elapsedMillis()));

        return new SearchResult(root.move, root.value, context.nodes, Duration.ofNanos(elapsedNanos),
                config.depth(), telemetry);
    }

    private static Function<HeuristicPreset, Evaluator> fixed(Evaluator evaluator) {
        Objects.requireNonNull(evaluator, "evaluator");
        return ignored -> evaluator;
    }

    private Scored minimax(SearchContext context, Board board, Player toMove, int depth, double alpha, double beta) {
        context.nodes++;

        if (depth == 0 || board.isDecided()) {
            return new Scored(context.evaluate(board), null);
        }

        List<Move> moves = MoveGenerator.generateLegalMoves(board, toMove);
        if (moves.isEmpty()) {
            return new Scored(context.evaluate(board), null);
        }

        boolean maximizing = toMove == context.rootPlayer;
        Player next = toMove.opponent();
        double bestValue = maximizing ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        Move bestMove = null;

        for (Move move : MoveOrdering.order(board, toMove, moves)) {
            Board child = board.copy();
            applyGenerated(child, toMove, move);
            double value = minimax(context, child, next, depth - 1, alpha, beta).value;

            boolean improves = maximizing ? value > bestValue : value < bestValue;
            if (improves) {
                bestValue = value;
                bestMove = move;
            } else if (value == bestValue && context.tieBreak.prefers(move, bestMove)) {
                if (bestMove != null) {
                    context.tieBreaks++;
                }
                bestMove = move;
            }

            if (maximizing) {
                alpha = Math.max(alpha, bestValue);
            } else {
                beta = Math.min(beta, bestValue);
            }
            if (beta <= alpha) {
                context.cutoffs++;
                break;
            }
        }
        return new Scored(bestValue, bestMove);
    }

    /**
     * Applies a move produced by the generator. A refusal here means generation and the legality
     * checks disagree, which is reported as {@link SearchInvariantException}.
     */
    static void applyGenerated(Board board, Player toMove, Move move) {
        try {
            Rules.apply(board, toMove, move);
        } catch (IllegalArgumentException ex) {
            throw new SearchInvariantException(move, Rules.check(board, toMove, move), ex);
        }
    }

    private static final class SearchContext {

        private final Player rootPlayer;
        private final Evaluator evaluator;
        private final TieBreakPolicy tieBreak;

        private long nodes;
        private long cutoffs;
        private long leafEvaluations;
        private long tieBreaks;

        private SearchContext(Player rootPlayer, Evaluator evaluator, TieBreakPolicy tieBreak) {
            this.rootPlayer = rootPlayer;
            this.evaluator = evaluator;
            this.tieBreak = tieBreak;
        }

        private double evaluate(Board board) {
            leafEvaluations++;
            return evaluator.evaluate(board, rootPlayer);
        }
    }

    private record Scored(double value, Move move) {
    }
}
