package com.abalone.core;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;

/**
 * Builds moves from loosely typed input (coordinates and a raw direction vector) and checks them,
 * reporting a specific reason instead of throwing.
 */
public final class MoveValidator {

    private MoveValidator() {
    }

    /**
     * Builds a move from textual coordinates such as {@code ["c3", "c4"]} and a direction vector.
     */
    public static MoveValidation build(List<String> marbles, int rowDelta, int columnDelta) {
        if (marbles == null) {
            return MoveValidation.rejected(Rejection.MISSING_MOVE);
        }
        List<Position> positions = new ArrayList<>(marbles.size());
        for (String marble : marbles) {
            Optional<Position> position = Position.tryParse(marble);
            if (position.isEmpty()) {
                return MoveValidation.rejected(Rejection.MALFORMED_NOTATION, "Cannot read position '" + marble + "'.");
            }
            positions.add(position.get());
        }
        return buildFromPositions(positions, rowDelta, columnDelta);
    }

    /**
     * Builds a move from positions and a direction vector, checking the shape of the input.
     */
    public static MoveValidation buildFromPositions(List<Position> marbles, int rowDelta, int columnDelta) {
        if (marbles == null) {
            return MoveValidation.rejected(Rejection.MISSING_MOVE);
        }
        if (marbles.isEmpty() || marbles.size() > Move.MAX_MARBLES) {
            return MoveValidation.rejected(Rejection.MARBLE_COUNT);
        }
        if (marbles.contains(null)) {
            return MoveValidation.rejected(Rejection.MALFORMED_NOTATION, "Position is missing.");
        }
        if (new HashSet<>(marbles).size() != marbles.size()) {
            return MoveValidation.rejected(Rejection.DUPLICATE_MARBLES);
        }
        for (Position marble : marbles) {
            if (!Geometry.isValid(marble)) {
                return MoveValidation.rejected(Rejection.INVALID_POSITION, marble.notation());
            }
        }
        Optional<Direction> direction = Direction.fromVector(rowDelta, columnDelta);
        if (direction.isEmpty()) {
            return MoveValidation.rejected(Rejection.UNKNOWN_DIRECTION,
                    "(" + rowDelta + ", " + columnDelta + ")");
        }
        Move move = new Move(marbles, direction.get());
        if (Rules.lineDirection(move.marbles()).isEmpty()) {
            return MoveValidation.rejected(Rejection.NOT_IN_LINE);
        }
        return MoveValidation.accepted(move);
    }

    /**
     * Checks an already built move against the board.
     */
    public static MoveValidation validate(Board board, Player player, Move move) {
        if (move == null) {
            return MoveValidation.rejected(Rejection.MISSING_MOVE);
        }
        return Rules.check(board, player, move);
    }

    /**
     * Builds the move and checks it against the board in one step.
     */
    public static MoveValidation validate(Board board, Player player, List<String> marbles, int rowDelta,
            int columnDelta) {
        MoveValidation built = build(marbles, rowDelta, columnDelta);
        return built.isValid() ? Rules.check(board, player, built.move()) : built;
    }
}
