package com.abalone.core;

/**
 * Reasons a move can be refused, either because it is malformed or because the rules forbid it.
 */
public enum Rejection {
    MISSING_MOVE("Move is missing."),
    MARBLE_COUNT("Move must contain between 1 and 3 marbles."),
    DUPLICATE_MARBLES("Move contains duplicate marbles."),
    INVALID_POSITION("Marble position is not on the board."),
    UNKNOWN_DIRECTION("Direction is not one of the six hex directions."),
    MALFORMED_NOTATION("Move notation is malformed."),
    NOT_OWNED("Every marble must belong to the moving player."),
    NOT_IN_LINE("Marbles must form a contiguous straight line."),
    OWN_MARBLE_OFF_BOARD("A line cannot move its own marble off the board."),
    SELF_PUSH("A line cannot push its own marble."),
    OUTNUMBERED("The pushing line must outnumber the pushed line."),
    PUSH_BLOCKED("The cell behind the pushed marbles is occupied."),
    BROADSIDE_OFF_BOARD("A broadside move cannot leave the board."),
    BROADSIDE_BLOCKED("Every broadside destination must be empty."),
    GAME_OVER("The game is already over.");

    private final String message;

    Rejection(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }

    /**
     * Returns {@code true} for shape problems detected before the board is consulted.
     */
    public boolean isMalformedInput() {
        switch (this) {
            case MISSING_MOVE:
            case MARBLE_COUNT:
            case DUPLICATE_MARBLES:
            case INVALID_POSITION:
            case UNKNOWN_DIRECTION:
            case MALFORMED_NOTATION:
                return true;
            default:
                return false;
        }
    }
}
