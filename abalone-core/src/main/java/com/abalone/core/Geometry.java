package com.abalone.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Static description of the 61-cell hexagonal board: the valid position set, the flat index
 * table used by {@link Board}, and adjacency.
 */
public final class Geometry {

    public static final int ROWS = 9;
    public static final int CELL_COUNT = 61;
    public static final Position CENTER = new Position(4, 5);

    private static final int COLUMN_SLOTS = 10;
    private static final int[][] INDEX_BY_COORDINATE = new int[ROWS][COLUMN_SLOTS];
    private static final Position[] POSITIONS_BY_INDEX = new Position[CELL_COUNT];

    /**
     * All valid positions sorted by row, then column. The list index equals the flat board index.
     */
    public static final List<Position> ALL;

    static {
        List<Position> positions = new ArrayList<>(CELL_COUNT);
        for (int row = 0; row < ROWS; row++) {
            Arrays.fill(INDEX_BY_COORDINATE[row], -1);
            for (int column = firstColumn(row); column <= lastColumn(row); column++) {
                INDEX_BY_COORDINATE[row][column] = positions.size();
                positions.add(new Position(row, column));
            }
        }
        if (positions.size() != CELL_COUNT) {
            throw new IllegalStateException("Board has " + positions.size() + " cells instead of " + CELL_COUNT);
        }
        positions.toArray(POSITIONS_BY_INDEX);
        ALL = Collections.unmodifiableList(positions);
    }

    private Geometry() {
    }

    /**
     * Returns {@code true} if the position lies on the board.
     */
    public static boolean isValid(Position position) {
        return indexOf(position) >= 0;
    }

    /**
     * Returns the flat index of the position, or {@code -1} if it lies off the board.
     */
    public static int indexOf(Position position) {
        int row = position.row();
        int column = position.column();
        if (row < 0 || row >= ROWS || column < 0 || column >= COLUMN_SLOTS) {
            return -1;
        }
        return INDEX_BY_COORDINATE[row][column];
    }

    public static Position positionAt(int index) {
        if (index < 0 || index >= CELL_COUNT) {
            throw new IllegalArgumentException("Cell index out of range: " + index);
        }
        return POSITIONS_BY_INDEX[index];
    }

    public static Position neighbor(Position position, Direction direction) {
        return position.step(direction);
    }

    public static Direction opposite(Direction direction) {
        return direction.opposite();
    }

    /**
     * Row-plus-column distance used by the center control heuristic.
     */
    public static int centerDistance(Position position) {
        return Math.abs(position.row() - CENTER.row()) + Math.abs(position.column() - CENTER.column());
    }

    static int firstColumn(int row) {
        return row <= 4 ? 1 : row - 3;
    }

    static int lastColumn(int row) {
        return row <= 4 ? 5 + row : 9;
    }
}
