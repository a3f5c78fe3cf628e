package com.abalone.core;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The six unit vectors of the hex grid, expressed as {@code (rowDelta, columnDelta)}.
 * Declaration order is the canonical order used by move generation.
 */
public enum Direction {
    E(0, 1),
    W(0, -1),
    NW(1, 0),
    SE(-1, 0),
    NE(1, 1),
    SW(-1, -1);

    /**
     * One direction per axis. Lines of marbles are only ever extended along these, so every
     * line is discovered from its lowest member exactly once.
     */
    public static final List<Direction> POSITIVE = List.of(E, NW, NE);

    private static final Direction[] VALUES = values();

    private final int rowDelta;
    private final int columnDelta;

    Direction(int rowDelta, int columnDelta) {
        this.rowDelta = rowDelta;
        this.columnDelta = columnDelta;
    }

    public int rowDelta() {
        return rowDelta;
    }

    public int columnDelta() {
        return columnDelta;
    }

    /**
     * Returns the direction pointing the other way along the same axis.
     */
    public Direction opposite() {
        switch (this) {
            case E:
                return W;
            case W:
                return E;
            case NW:
                return SE;
            case SE:
                return NW;
            case NE:
                return SW;
            default:
                return NE;
        }
    }

    /**
     * Returns {@code true} if the other direction lies on the same axis as this one.
     */
    public boolean isParallelTo(Direction other) {
        return other == this || other == opposite();
    }

    /**
     * Scalar projection of a position onto this direction.
     */
    public int project(Position position) {
        return position.row() * rowDelta + position.column() * columnDelta;
    }

    /**
     * Resolves a raw vector. Anything other than the six canonical unit vectors is unrecognised.
     */
    public static Optional<Direction> fromVector(int rowDelta, int columnDelta) {
        for (Direction direction : VALUES) {
            if (direction.rowDelta == rowDelta && direction.columnDelta == columnDelta) {
                return Optional.of(direction);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves a canonical direction name such as {@code "NE"}, ignoring case.
     */
    public static Optional<Direction> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (Direction direction : VALUES) {
            if (direction.name().equals(normalized)) {
                return Optional.of(direction);
            }
        }
        return Optional.empty();
    }
}
