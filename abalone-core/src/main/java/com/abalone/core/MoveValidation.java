package com.abalone.core;

import java.util.Objects;

/**
 * Outcome of building or checking a move: either the accepted move or the reason it was refused.
 *
 * @param move      the accepted move, or {@code null} when rejected
 * @param rejection the rejection kind, or {@code null} when accepted
 * @param reason    human-readable explanation, or {@code null} when accepted
 */
public record MoveValidation(Move move, Rejection rejection, String reason) {

    public MoveValidation {
        if ((move == null) == (rejection == null)) {
            throw new IllegalArgumentException("Exactly one of move and rejection must be present");
        }
    }

    public static MoveValidation accepted(Move move) {
        return new MoveValidation(Objects.requireNonNull(move, "move"), null, null);
    }

    public static MoveValidation rejected(Rejection rejection) {
        return new MoveValidation(null, rejection, rejection.message());
    }

    public static MoveValidation rejected(Rejection rejection, String detail) {
        return new MoveValidation(null, rejection, rejection.message() + " " + detail);
    }

    public boolean isValid() {
        return move != null;
    }
}
