package com.abalone.core;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of playing a move in a {@link GameState}.
 *
 * @param state      the state after the move, or the unchanged state when the move was rejected
 * @param validation the acceptance or the rejection reason
 */
public record MoveResult(GameState state, MoveValidation validation) {

    public MoveResult {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(validation, "validation");
    }

    public boolean isAccepted() {
        return validation.isValid();
    }

    public Optional<Rejection> rejection() {
        return Optional.ofNullable(validation.rejection());
    }

    /**
     * Side effects of the move, empty when it was rejected.
     */
    public Optional<MoveOutcome> outcome() {
        return isAccepted() ? state.getLastOutcome() : Optional.empty();
    }
}
