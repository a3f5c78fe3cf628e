package com.abalone.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Text notation for moves.
 *
 * <ul>
 *   <li>Inline: {@code {count}:{trailing}{goal}}, where goal is the cell ahead of the leading
 *       marble, e.g. {@code 3:a1d1}.</li>
 *   <li>Broadside: {@code {count}:{low}-{high}>{DIR}} using the two extreme marbles in sorted
 *       order, e.g. {@code 2:c3-c4>NW}.</li>
 * </ul>
 *
 * A trailing {@code *} marks a move that pushes opposing marbles. It is informational and is
 * ignored when parsing.
 */
public final class MoveNotation {

    private static final String PUSH_MARKER = "*";

    private MoveNotation() {
    }

    public static String format(Move move, boolean pushed) {
        StringBuilder builder = new StringBuilder(12);
        builder.append(move.count()).append(':');
        if (move.isInline()) {
            Position goal = move.leading().step(move.direction());
            builder.append(move.trailing().notation()).append(goal.notation());
        } else {
            List<Position> marbles = move.marbles();
            builder.append(marbles.get(0).notation())
                    .append('-')
                    .append(marbles.get(marbles.size() - 1).notation())
                    .append('>')
                    .append(move.direction().name());
        }
        if (pushed) {
            builder.append(PUSH_MARKER);
        }
        return builder.toString();
    }

    /**
     * Parses either notation form. Only the shape is checked; legality on a board is left to
     * {@link Rules}.
     */
    public static MoveValidation parse(String text) {
        if (text == null || text.isBlank()) {
            return MoveValidation.rejected(Rejection.MALFORMED_NOTATION, "Notation is empty.");
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        if (normalized.endsWith(PUSH_MARKER)) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        int colon = normalized.indexOf(':');
        if (colon != 1) {
            return MoveValidation.rejected(Rejection.MALFORMED_NOTATION, "Expected '<count>:' prefix in '" + text + "'.");
        }
        int count = normalized.charAt(0) - '0';
        if (count < 1 || count > Move.MAX_MARBLES) {
            return MoveValidation.rejected(Rejection.MARBLE_COUNT);
        }
        String body = normalized.substring(colon + 1);
        return body.indexOf('>') >= 0 ? parseBroadside(count, body, text) : parseInline(count, body, text);
    }

    private static MoveValidation parseInline(int count, String body, String text) {
        if (body.length() != 4) {
            return MoveValidation.rejected(Rejection.MALFORMED_NOTATION, "Cannot read '" + text + "'.");
        }
        Optional<Position> start = Position.tryParse(body.substring(0, 2));
        Optional<Position> goal = Position.tryParse(body.substring(2, 4));
        if (start.isEmpty() || goal.isEmpty()) {
            return MoveValidation.rejected(Rejection.MALFORMED_NOTATION, "Cannot read '" + text + "'.");
        }
        int rowDelta = goal.get().row() - start.get().row();
        int columnDelta = goal.get().column() - start.get().column();
        if (rowDelta % count != 0 || columnDelta % count != 0) {
            return MoveValidation.rejected(Rejection.UNKNOWN_DIRECTION);
        }
        Optional<Direction> direction = Direction.fromVector(rowDelta / count, columnDelta / count);
        if (direction.isEmpty()) {
            return MoveValidation.rejected(Rejection.UNKNOWN_DIRECTION);
        }
        return buildLine(start.get(), direction.get(), count, direction.get());
    }

    private static MoveValidation parseBroadside(int count, String body, String text) {
        String[] halves = body.split(">", -1);
        String[] ends = halves[0].split("-", -1);
        if (halves.length != 2 || ends.length != 2) {
            return MoveValidation.rejected(Rejection.MALFORMED_NOTATION, "Cannot read '" + text + "'.");
        }
        Optional<Direction> direction = Direction.fromName(halves[1]);
        if (direction.isEmpty()) {
            return MoveValidation.rejected(Rejection.UNKNOWN_DIRECTION);
        }
        Optional<Position> low = Position.tryParse(ends[0]);
        Optional<Position> high = Position.tryParse(ends[1]);
        if (low.isEmpty() || high.isEmpty()) {
            return MoveValidation.rejected(Rejection.MALFORMED_NOTATION, "Cannot read '" + text + "'.");
        }
        int rowSpan = high.get().row() - low.get().row();
        int columnSpan = high.get().column() - low.get().column();
        int steps = Math.max(Math.abs(rowSpan), Math.abs(columnSpan));
        if (steps == 0 || steps != count - 1 || rowSpan % steps != 0 || columnSpan % steps != 0) {
            return MoveValidation.rejected(Rejection.NOT_IN_LINE);
        }
        Optional<Direction> line = Direction.fromVector(rowSpan / steps, columnSpan / steps);
        if (line.isEmpty()) {
            return MoveValidation.rejected(Rejection.NOT_IN_LINE);
        }
        return buildLine(low.get(), line.get(), count, direction.get());
    }

    private static MoveValidation buildLine(Position start, Direction line, int count, Direction direction) {
        List<Position> marbles = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Position marble = start.step(line, i);
            if (!Geometry.isValid(marble)) {
                return MoveValidation.rejected(Rejection.INVALID_POSITION, marble.notation());
            }
            marbles.add(marble);
        }
        return MoveValidation.accepted(new Move(marbles, direction));
    }
}
