package com.abalone.core;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Enumerates moves for a player.
 */
public final class MoveGenerator {

    /**
     * Size of the unfiltered move space per marble: 6 singles, 6 neighbours by 6 directions for
     * pairs and 3 axes by 6 directions for triples.
     */
    public static final int RAW_MOVES_PER_MARBLE = 6 + 6 * 6 + 3 * 6;

    private MoveGenerator() {
    }

    /**
     * Returns every distinct legal move of the player. Lines are only grown forward along the
     * three positive axis directions from marbles the player owns, so each line shape is built from
     * its lowest member. The list is in discovery order (marble, then axis, then direction).
     */
    public static List<Move> generateLegalMoves(Board board, Player player) {
        List<Move> moves = new ArrayList<>();
        Set<Move> seen = new HashSet<>();
        for (Position marble : board.marbles(player)) {
            for (Direction direction : Direction.values()) {
                addIfLegal(board, player, new Move(List.of(marble), direction), seen, moves);
            }
            for (Direction axis : Direction.POSITIVE) {
                Position second = marble.step(axis);
                if (board.isOccupiedBy(second, player)) {
                    addLine(board, player, List.of(marble, second), seen, moves);
                }
            }
            for (Direction axis : Direction.POSITIVE) {
                Position second = marble.step(axis);
                Position third = second.step(axis);
                if (board.isOccupiedBy(second, player) && board.isOccupiedBy(third, player)) {
                    addLine(board, player, List.of(marble, second, third), seen, moves);
                }
            }
        }
        return moves;
    }

    /**
     * Returns the unfiltered move space: {@link #RAW_MOVES_PER_MARBLE} candidates per marble, with
     * duplicates and without any legality or board membership check.
     */
    public static List<Move> generateRawMoves(Board board, Player player) {
        List<Position> marbles = board.marbles(player);
        List<Move> raw = new ArrayList<>(marbles.size() * RAW_MOVES_PER_MARBLE);
        for (Position marble : marbles) {
            for (Direction direction : Direction.values()) {
                raw.add(new Move(List.of(marble), direction));
            }
            for (Direction neighbour : Direction.values()) {
                List<Position> pair = List.of(marble, marble.step(neighbour));
                for (Direction direction : Direction.values()) {
                    raw.add(new Move(pair, direction));
                }
            }
            for (Direction axis : Direction.POSITIVE) {
                List<Position> triple = List.of(marble, marble.step(axis), marble.step(axis, 2));
                for (Direction direction : Direction.values()) {
                    raw.add(new Move(triple, direction));
                }
            }
        }
        return raw;
    }

    /**
     * Groups moves by shape, keeping the input order within each group. Every category is present
     * in the result, possibly with an empty list.
     */
    public static Map<MoveCategory, List<Move>> categorize(List<Move> moves) {
        Map<MoveCategory, List<Move>> categories = new EnumMap<>(MoveCategory.class);
        for (MoveCategory category : MoveCategory.values()) {
            categories.put(category, new ArrayList<>());
        }
        for (Move move : moves) {
            categories.get(MoveCategory.of(move)).add(move);
        }
        return categories;
    }

    private static void addLine(Board board, Player player, List<Position> line, Set<Move> seen, List<Move> moves) {
        for (Direction direction : Direction.values()) {
            addIfLegal(board, player, new Move(line, direction), seen, moves);
        }
    }

    private static void addIfLegal(Board board, Player player, Move move, Set<Move> seen, List<Move> moves) {
        if (seen.add(move) && Rules.isLegal(board, player, move)) {
            moves.add(move);
        }
    }
}
