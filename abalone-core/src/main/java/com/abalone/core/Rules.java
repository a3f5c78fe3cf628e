package com.abalone.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Legality checks and move application.
 */
public final class Rules {

    private Rules() {
    }

    /**
     * Checks the move against the board for the provided player. The board is not modified.
     */
    public static MoveValidation check(Board board, Player player, Move move) {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(player, "player");
        Objects.requireNonNull(move, "move");
        Rejection rejection = findRejection(board, player, move);
        return rejection == null ? MoveValidation.accepted(move) : MoveValidation.rejected(rejection);
    }

    public static boolean isLegal(Board board, Player player, Move move) {
        return findRejection(board, player, move) == null;
    }

    /**
     * Applies a legal move, mutating the board.
     *
     * @throws IllegalArgumentException if the move is illegal; the board is left unchanged
     */
    public static MoveOutcome apply(Board board, Player player, Move move) {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(player, "player");
        Objects.requireNonNull(move, "move");
        Rejection rejection = findRejection(board, player, move);
        if (rejection != null) {
            throw new IllegalArgumentException("Illegal move " + move + ": " + rejection.message());
        }
        return move.isInline() ? applyInline(board, player, move) : applyBroadside(board, player, move);
    }

    /**
     * Returns {@code true} if the move is an inline line of two or three marbles whose leading
     * marble is directly behind an opposing marble.
     */
    public static boolean wouldPush(Board board, Player player, Move move) {
        if (!move.isInline() || move.count() < 2) {
            return false;
        }
        Position ahead = move.leading().step(move.direction());
        return board.isOccupiedBy(ahead, player.opponent());
    }

    /**
     * Returns the direction along which the sorted marbles form a contiguous line, if any.
     * A single marble lies on every line; {@link Direction#E} is reported for it.
     */
    static Optional<Direction> lineDirection(List<Position> sorted) {
        if (sorted.size() == 1) {
            return Optional.of(Direction.E);
        }
        Position first = sorted.get(0);
        Position second = sorted.get(1);
        Optional<Direction> line = Direction.fromVector(second.row() - first.row(), second.column() - first.column());
        if (line.isEmpty()) {
            return line;
        }
        for (int i = 2; i < sorted.size(); i++) {
            if (!sorted.get(i).equals(first.step(line.get(), i))) {
                return Optional.empty();
            }
        }
        return line;
    }

    private static Rejection findRejection(Board board, Player player, Move move) {
        for (Position marble : move.marbles()) {
            if (!board.isOccupiedBy(marble, player)) {
                return Rejection.NOT_OWNED;
            }
        }
        if (lineDirection(move.marbles()).isEmpty()) {
            return Rejection.NOT_IN_LINE;
        }
        return move.isInline() ? checkInline(board, player, move) : checkBroadside(board, move);
    }

    private static Rejection checkInline(Board board, Player player, Move move) {
        Direction direction = move.direction();
        Position ahead = move.leading().step(direction);
        Cell target = board.get(ahead);
        if (target == null) {
            return Rejection.OWN_MARBLE_OFF_BOARD;
        }
        if (target == Cell.EMPTY) {
            return null;
        }
        if (target.isOccupiedBy(player)) {
            return Rejection.SELF_PUSH;
        }

        Player opponent = player.opponent();
        int pushed = 0;
        Position cursor = ahead;
        while (board.isOccupiedBy(cursor, opponent)) {
            pushed++;
            cursor = cursor.step(direction);
        }
        if (pushed >= move.count()) {
            return Rejection.OUTNUMBERED;
        }
        Cell beyond = board.get(cursor);
        if (beyond != null && beyond != Cell.EMPTY) {
            return Rejection.PUSH_BLOCKED;
        }
        return null;
    }

    private static Rejection checkBroadside(Board board, Move move) {
        for (Position marble : move.marbles()) {
            Cell destination = board.get(marble.step(move.direction()));
            if (destination == null) {
                return Rejection.BROADSIDE_OFF_BOARD;
            }
            if (destination != Cell.EMPTY) {
                return Rejection.BROADSIDE_BLOCKED;
            }
        }
        return null;
    }

    private static MoveOutcome applyInline(Board board, Player player, Move move) {
        Direction direction = move.direction();
        Player opponent = player.opponent();

        List<Position> pushed = new ArrayList<>(2);
        Position cursor = move.leading().step(direction);
        while (board.isOccupiedBy(cursor, opponent)) {
            pushed.add(cursor);
            cursor = cursor.step(direction);
        }
        boolean pushedOff = !pushed.isEmpty() && !Geometry.isValid(cursor);
        if (pushedOff) {
            board.incrementScore(player);
        }

        // farthest first, so no pushed marble lands on one that has not moved yet
        for (int i = pushed.size() - 1; i >= 0; i--) {
            Position from = pushed.get(i);
            Position to = from.step(direction);
            if (Geometry.isValid(to)) {
                board.set(to, opponent.cell());
            }
            board.set(from, Cell.EMPTY);
        }

        for (Position marble : move.marblesLeadingFirst()) {
            board.set(marble.step(direction), player.cell());
            board.set(marble, Cell.EMPTY);
        }
        return pushed.isEmpty() ? MoveOutcome.QUIET : new MoveOutcome(pushed, pushedOff);
    }

    private static MoveOutcome applyBroadside(Board board, Player player, Move move) {
        Direction direction = move.direction();
        for (Position marble : move.marbles()) {
            board.set(marble, Cell.EMPTY);
        }
        for (Position marble : move.marbles()) {
            board.set(marble.step(direction), player.cell());
        }
        return MoveOutcome.QUIET;
    }
}
