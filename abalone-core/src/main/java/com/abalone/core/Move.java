package com.abalone.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * Immutable candidate move: one to three marbles and the direction they travel in.
 * Marbles are stored in row, then column order, so two moves built from the same marbles in any
 * order are equal. The shape is not checked here; {@link Rules} rejects marbles that do not
 * form a contiguous line.
 */
public final class Move {

    public static final int MAX_MARBLES = 3;

    private final List<Position> marbles;
    private final Direction direction;
    private final boolean inline;
    private final Position trailing;
    private final Position leading;

    /**
     * @throws IllegalArgumentException if there are not between one and three distinct marbles
     */
    public Move(Collection<Position> marbles, Direction direction) {
        Objects.requireNonNull(marbles, "marbles");
        this.direction = Objects.requireNonNull(direction, "direction");
        if (marbles.isEmpty() || marbles.size() > MAX_MARBLES) {
            throw new IllegalArgumentException("Move must contain between 1 and 3 marbles: " + marbles);
        }
        if (new HashSet<>(marbles).size() != marbles.size()) {
            throw new IllegalArgumentException("Move contains duplicate marbles: " + marbles);
        }
        List<Position> sorted = new ArrayList<>(marbles);
        for (Position marble : sorted) {
            Objects.requireNonNull(marble, "marble");
        }
        Collections.sort(sorted);
        this.marbles = Collections.unmodifiableList(sorted);
        this.inline = computeInline(sorted, direction);

        Position back = sorted.get(0);
        Position front = sorted.get(0);
        for (Position marble : sorted) {
            int projection = direction.project(marble);
            if (projection < direction.project(back)) {
                back = marble;
            }
            if (projection >= direction.project(front)) {
                front = marble;
            }
        }
        this.trailing = back;
        this.leading = front;
    }

    public static Move of(Direction direction, Position... marbles) {
        return new Move(Arrays.asList(marbles), direction);
    }

    /**
     * Convenience factory taking coordinates in text form, e.g. {@code Move.of(Direction.E, "c3", "c4")}.
     */
    public static Move of(Direction direction, String... marbles) {
        List<Position> positions = new ArrayList<>(marbles.length);
        for (String marble : marbles) {
            positions.add(Position.parse(marble));
        }
        return new Move(positions, direction);
    }

    /**
     * Returns the marbles in row, then column order.
     */
    public List<Position> marbles() {
        return marbles;
    }

    public Direction direction() {
        return direction;
    }

    public int count() {
        return marbles.size();
    }

    /**
     * Returns {@code true} if the marbles travel along their own axis. A single marble is always
     * inline.
     */
    public boolean isInline() {
        return inline;
    }

    /**
     * The rearmost marble relative to the direction of travel.
     */
    public Position trailing() {
        return trailing;
    }

    /**
     * The foremost marble relative to the direction of travel.
     */
    public Position leading() {
        return leading;
    }

    /**
     * Returns the marbles ordered foremost first, the order in which they can be relocated
     * without overwriting each other.
     */
    public List<Position> marblesLeadingFirst() {
        List<Position> ordered = new ArrayList<>(marbles);
        ordered.sort((a, b) -> Integer.compare(direction.project(b), direction.project(a)));
        return ordered;
    }

    public String notation() {
        return MoveNotation.format(this, false);
    }

    private static boolean computeInline(List<Position> sorted, Direction direction) {
        if (sorted.size() == 1) {
            return true;
        }
        Position first = sorted.get(0);
        Position second = sorted.get(1);
        int lineRow = second.row() - first.row();
        int lineColumn = second.column() - first.column();
        return (direction.rowDelta() == lineRow && direction.columnDelta() == lineColumn)
                || (direction.rowDelta() == -lineRow && direction.columnDelta() == -lineColumn);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Move)) {
            return false;
        }
        Move move = (Move) other;
        return direction == move.direction && marbles.equals(move.marbles);
    }

    @Override
    public int hashCode() {
        return 31 * marbles.hashCode() + direction.hashCode();
    }

    @Override
    public String toString() {
        return notation();
    }
}
