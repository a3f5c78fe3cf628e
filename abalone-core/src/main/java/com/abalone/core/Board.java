package com.abalone.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Mutable Abalone board backed by a flat array indexed through {@link Geometry#indexOf(Position)}.
 * The board also tracks how many opposing marbles each player has pushed off.
 * Moves mutate the board in place; {@link #copy()} produces an independent board for search
 * and snapshots.
 */
public final class Board {

    public static final int WINNING_SCORE = 6;

    private final Cell[] cells;
    private final int[] scores;

    private Board(Cell[] cells, int[] scores) {
        this.cells = cells;
        this.scores = scores;
    }

    /**
     * Creates a board with every cell empty and both scores at zero.
     */
    public static Board empty() {
        Cell[] cells = new Cell[Geometry.CELL_COUNT];
        Arrays.fill(cells, Cell.EMPTY);
        return new Board(cells, new int[Player.values().length]);
    }

    /**
     * Creates a board set up with the provided starting layout.
     */
    public static Board withLayout(Layout layout) {
        Objects.requireNonNull(layout, "layout");
        return of(layout.positions(Player.BLACK), layout.positions(Player.WHITE));
    }

    /**
     * Creates the standard opening position.
     */
    public static Board standard() {
        return withLayout(Layout.STANDARD);
    }

    /**
     * Creates a board with the provided marbles and both scores at zero.
     */
    public static Board of(Collection<Position> black, Collection<Position> white) {
        return of(black, white, 0, 0);
    }

    /**
     * Creates a board with the provided marbles and push-off counters.
     *
     * @throws IllegalArgumentException if a position is off the board or listed twice, or a score is
     *         outside {@code 0..6}
     */
    public static Board of(Collection<Position> black, Collection<Position> white, int blackScore, int whiteScore) {
        Objects.requireNonNull(black, "black");
        Objects.requireNonNull(white, "white");
        Board board = empty();
        board.placeAll(black, Cell.BLACK);
        board.placeAll(white, Cell.WHITE);
        board.scores[Player.BLACK.ordinal()] = checkScore(blackScore);
        board.scores[Player.WHITE.ordinal()] = checkScore(whiteScore);
        return board;
    }

    /**
     * Returns an independent copy of this board.
     */
    public Board copy() {
        return new Board(cells.clone(), scores.clone());
    }

    /**
     * Returns the state of the cell, or {@code null} when the position lies off the board.
     */
    public Cell get(Position position) {
        int index = Geometry.indexOf(position);
        return index < 0 ? null : cells[index];
    }

    /**
     * Returns {@code true} if the position is on the board and holds a marble of the player.
     */
    public boolean isOccupiedBy(Position position, Player player) {
        return get(position) == player.cell();
    }

    /**
     * Returns {@code true} if the position is on the board and empty.
     */
    public boolean isEmpty(Position position) {
        return get(position) == Cell.EMPTY;
    }

    /**
     * Returns the player's marbles in row, then column order.
     */
    public List<Position> marbles(Player player) {
        Cell cell = player.cell();
        List<Position> marbles = new ArrayList<>(Layout.MARBLES_PER_SIDE);
        for (int index = 0; index < cells.length; index++) {
            if (cells[index] == cell) {
                marbles.add(Geometry.positionAt(index));
            }
        }
        return marbles;
    }

    public int marbleCount(Player player) {
        Cell cell = player.cell();
        int count = 0;
        for (Cell value : cells) {
            if (value == cell) {
                count++;
            }
        }
        return count;
    }

    /**
     * Returns the number of opposing marbles the player has pushed off the board.
     */
    public int score(Player player) {
        return scores[player.ordinal()];
    }

    /**
     * Returns {@code true} once either player has pushed off {@link #WINNING_SCORE} marbles.
     */
    public boolean isDecided() {
        return scores[0] >= WINNING_SCORE || scores[1] >= WINNING_SCORE;
    }

    void set(Position position, Cell cell) {
        int index = Geometry.indexOf(position);
        if (index < 0) {
            throw new IllegalArgumentException("Position is off the board: " + position);
        }
        cells[index] = cell;
    }

    void incrementScore(Player player) {
        scores[player.ordinal()]++;
    }

    private void placeAll(Collection<Position> positions, Cell cell) {
        for (Position position : positions) {
            Cell current = get(position);
            if (current == null) {
                throw new IllegalArgumentException("Position is off the board: " + position);
            }
            if (current != Cell.EMPTY) {
                throw new IllegalArgumentException("Position " + position + " is already occupied");
            }
            set(position, cell);
        }
    }

    private static int checkScore(int score) {
        if (score < 0 || score > WINNING_SCORE) {
            throw new IllegalArgumentException("Score out of range: " + score);
        }
        return score;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Board)) {
            return false;
        }
        Board board = (Board) other;
        return Arrays.equals(cells, board.cells) && Arrays.equals(scores, board.scores);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(cells) + Arrays.hashCode(scores);
    }
}
