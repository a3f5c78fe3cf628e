package com.abalone.core.ai;

import com.abalone.core.Move;
import com.abalone.core.MoveValidation;

/**
 * Thrown when a searcher returns a move that the rules reject. This points at a disagreement
 * between move generation and the legality checks rather than at bad input.
 */
public final class SearchInvariantException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final transient Move move;

    public SearchInvariantException(Move move, MoveValidation validation) {
        super("Search produced an illegal move " + move + ": " + validation.reason());
        this.move = move;
    }

    public SearchInvariantException(Move move, MoveValidation validation, Throwable cause) {
        super("Search produced an illegal move " + move + ": " + validation.reason(), cause);
        this.move = move;
    }

    public Move getMove() {
        return move;
    }
}
