package com.abalone.core;

import java.util.Locale;
import java.util.Optional;

/**
 * A cell coordinate on the hex grid. Rows run from {@code a} (0) at Black's edge to {@code i} (8)
 * at White's edge, columns from 1 to 9. A position may lie off the board; use
 * {@link Geometry#isValid(Position)} to test membership.
 */
public record Position(int row, int column) implements Comparable<Position> {

    static final String ROW_LETTERS = "abcdefghi";

    /**
     * Parses coordinates such as {@code "e5"}.
     *
     * @throws IllegalArgumentException if the text is not a row letter followed by a column digit
     */
    public static Position parse(String text) {
        return tryParse(text).orElseThrow(() -> new IllegalArgumentException("Malformed position: " + text));
    }

    /**
     * Parses coordinates such as {@code "e5"}, returning an empty result for malformed text.
     * The result is not checked against the board.
     */
    public static Optional<Position> tryParse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String trimmed = text.trim().toLowerCase(Locale.ROOT);
        if (trimmed.length() != 2) {
            return Optional.empty();
        }
        int row = ROW_LETTERS.indexOf(trimmed.charAt(0));
        char columnChar = trimmed.charAt(1);
        if (row < 0 || columnChar < '0' || columnChar > '9') {
            return Optional.empty();
        }
        return Optional.of(new Position(row, columnChar - '0'));
    }

    /**
     * Returns the adjacent position in the provided direction.
     */
    public Position step(Direction direction) {
        return new Position(row + direction.rowDelta(), column + direction.columnDelta());
    }

    /**
     * Returns the position {@code distance} steps away in the provided direction.
     */
    public Position step(Direction direction, int distance) {
        return new Position(row + direction.rowDelta() * distance, column + direction.columnDelta() * distance);
    }

    public String notation() {
        if (row >= 0 && row < ROW_LETTERS.length() && column >= 0 && column <= 9) {
            return String.valueOf(ROW_LETTERS.charAt(row)) + column;
        }
        return "(" + row + "," + column + ")";
    }

    @Override
    public int compareTo(Position other) {
        int byRow = Integer.compare(row, other.row);
        return byRow != 0 ? byRow : Integer.compare(column, other.column);
    }

    @Override
    public String toString() {
        return notation();
    }
}
