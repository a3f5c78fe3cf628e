package com.abalone.core;

import java.util.List;

/**
 * Side effects of an applied move, reported for display and transcripts.
 *
 * @param displaced opposing positions that were pushed, nearest first
 * @param pushedOff whether the last pushed marble left the board
 */
public record MoveOutcome(List<Position> displaced, boolean pushedOff) {

    public static final MoveOutcome QUIET = new MoveOutcome(List.of(), false);

    public MoveOutcome {
        displaced = List.copyOf(displaced);
    }

    public boolean pushed() {
        return !displaced.isEmpty();
    }
}
