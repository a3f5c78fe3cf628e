package com.abalone.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class RulesTest {

    @Test
    void threeMarblesPushTwoIntoEmptyCell() {
        Board board = board(List.of("e3", "e4", "e5"), List.of("e6", "e7"));
        Move move = Move.of(Direction.E, "e3", "e4", "e5");

        assertTrue(Rules.isLegal(board, Player.BLACK, move));
        MoveOutcome outcome = Rules.apply(board, Player.BLACK, move);

        assertEquals(positions("e4", "e5", "e6"), board.marbles(Player.BLACK));
        assertEquals(positions("e7", "e8"), board.marbles(Player.WHITE));
        assertEquals(positions("e6", "e7"), outcome.displaced());
        assertFalse(outcome.pushedOff());
        assertEquals(0, board.score(Player.BLACK));
    }

    @Test
    void pushAgainstTheEdgeCapturesTheEndMarble() {
        // c8 lies off the board, so the last pushed marble falls off
        Board board = board(List.of("c3", "c4", "c5"), List.of("c6", "c7"));
        Move move = Move.of(Direction.E, "c3", "c4", "c5");

        assertTrue(Rules.isLegal(board, Player.BLACK, move));
        MoveOutcome outcome = Rules.apply(board, Player.BLACK, move);

        assertEquals(positions("c4", "c5", "c6"), board.marbles(Player.BLACK));
        assertEquals(positions("c7"), board.marbles(Player.WHITE));
        assertTrue(outcome.pushedOff());
        assertEquals(positions("c6", "c7"), outcome.displaced());
        assertEquals(1, board.score(Player.BLACK));
        assertEquals(0, board.score(Player.WHITE));
    }

    @Test
    void equalLinesCannotPush() {
        Board board = board(List.of("e3", "e4", "e5"), List.of("e6", "e7", "e8"));
        Move move = Move.of(Direction.E, "e3", "e4", "e5");

        MoveValidation validation = Rules.check(board, Player.BLACK, move);

        assertFalse(validation.isValid());
        assertEquals(Rejection.OUTNUMBERED, validation.rejection());
    }

    @Test
    void broadsideIntoOccupiedCellIsIllegal() {
        Board board = board(List.of("a1", "a2"), List.of("b1"));
        Move move = Move.of(Direction.NW, "a1", "a2");

        assertFalse(move.isInline());
        assertEquals(Rejection.BROADSIDE_BLOCKED, Rules.check(board, Player.BLACK, move).rejection());
    }

    @Test
    void broadsideOffTheBoardIsIllegal() {
        Board board = board(List.of("a1", "a2"), List.of());
        assertEquals(Rejection.BROADSIDE_OFF_BOARD,
                Rules.check(board, Player.BLACK, Move.of(Direction.SE, "a1", "a2")).rejection());
    }

    @Test
    void reportsEachRejection() {
        Board board = board(List.of("e1", "e2", "e3", "a1", "c3", "d4"), List.of("e4", "e5", "e6", "d1", "d2"));

        assertEquals(Rejection.NOT_OWNED, reject(board, Move.of(Direction.E, "e3", "e4")));
        assertEquals(Rejection.NOT_IN_LINE, reject(board, Move.of(Direction.E, "a1", "c3")));
        assertEquals(Rejection.OWN_MARBLE_OFF_BOARD, reject(board, Move.of(Direction.W, "e1", "e2")));
        assertEquals(Rejection.SELF_PUSH, reject(board, Move.of(Direction.E, "e1", "e2")));
        assertEquals(Rejection.OUTNUMBERED, reject(board, Move.of(Direction.E, "e2", "e3")));
        assertEquals(Rejection.OUTNUMBERED, reject(board, Move.of(Direction.E, "e3")));
        assertEquals(Rejection.BROADSIDE_BLOCKED, reject(board, Move.of(Direction.NW, "c3", "d4")));
        assertTrue(Rules.isLegal(board, Player.BLACK, Move.of(Direction.NE, "c3", "d4")));
    }

    @Test
    void pushIsBlockedByOwnMarbleBehindTheOpponent() {
        Board board = board(List.of("e1", "e2", "e3", "e5"), List.of("e4"));
        assertEquals(Rejection.PUSH_BLOCKED, reject(board, Move.of(Direction.E, "e1", "e2", "e3")));
    }

    @Test
    void gappedLineIsNotInLine() {
        Board board = board(List.of("e1", "e2", "e4"), List.of());
        assertEquals(Rejection.NOT_IN_LINE, reject(board, Move.of(Direction.E, "e1", "e2", "e4")));
    }

    @Test
    void illegalApplyLeavesBoardUntouched() {
        Board board = board(List.of("e3", "e4", "e5"), List.of("e6", "e7", "e8"));
        Board before = board.copy();

        assertThrows(IllegalArgumentException.class,
                () -> Rules.apply(board, Player.BLACK, Move.of(Direction.E, "e3", "e4", "e5")));
        assertEquals(before, board);
    }

    @Test
    void broadsideOnlyTouchesOriginsAndDestinations() {
        Board board = Board.standard();
        Board before = board.copy();
        Move move = Move.of(Direction.NE, "c3", "c4", "c5");

        MoveOutcome outcome = Rules.apply(board, Player.BLACK, move);

        assertFalse(outcome.pushed());
        List<Position> touched = new ArrayList<>(move.marbles());
        for (Position marble : move.marbles()) {
            touched.add(marble.step(move.direction()));
        }
        for (Position position : Geometry.ALL) {
            if (!touched.contains(position)) {
                assertEquals(before.get(position), board.get(position), "Unexpected change at " + position);
            }
        }
        for (Position marble : move.marbles()) {
            assertEquals(Cell.BLACK, board.get(marble.step(move.direction())));
            assertEquals(Cell.EMPTY, board.get(marble));
        }
    }

    @Test
    void singleMarbleMovesIntoEmptyCell() {
        Board board = board(List.of("e5"), List.of());
        MoveOutcome outcome = Rules.apply(board, Player.BLACK, Move.of(Direction.SW, "e5"));
        assertEquals(positions("d4"), board.marbles(Player.BLACK));
        assertEquals(MoveOutcome.QUIET, outcome);
    }

    @Test
    void whitePushesBlackOffTheTopEdge() {
        Board board = board(List.of("h5"), List.of("f5", "g5"));
        Move move = Move.of(Direction.NW, "f5", "g5");

        assertTrue(Rules.wouldPush(board, Player.WHITE, move));
        MoveOutcome outcome = Rules.apply(board, Player.WHITE, move);

        // i5 is on the board, so the black marble is only displaced
        assertFalse(outcome.pushedOff());
        assertEquals(positions("i5"), board.marbles(Player.BLACK));

        outcome = Rules.apply(board, Player.WHITE, Move.of(Direction.NW, "g5", "h5"));
        assertTrue(outcome.pushedOff());
        assertEquals(0, board.marbleCount(Player.BLACK));
        assertEquals(1, board.score(Player.WHITE));
    }

    @Test
    void detectsPushMoves() {
        Board board = board(List.of("e3", "e4"), List.of("e5"));
        assertTrue(Rules.wouldPush(board, Player.BLACK, Move.of(Direction.E, "e3", "e4")));
        assertFalse(Rules.wouldPush(board, Player.BLACK, Move.of(Direction.W, "e3", "e4")));
        assertFalse(Rules.wouldPush(board, Player.BLACK, Move.of(Direction.E, "e4")));
    }

    private static Rejection reject(Board board, Move move) {
        MoveValidation validation = Rules.check(board, Player.BLACK, move);
        assertFalse(validation.isValid(), () -> "Expected " + move + " to be illegal");
        return validation.rejection();
    }

    static Board board(List<String> black, List<String> white) {
        return Board.of(positions(black.toArray(new String[0])), positions(white.toArray(new String[0])));
    }

    static List<Position> positions(String... cells) {
        List<Position> positions = new ArrayList<>(cells.length);
        for (String cell : cells) {
            positions.add(Position.parse(cell));
        }
        return positions;
    }
}
