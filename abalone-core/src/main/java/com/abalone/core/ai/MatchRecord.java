package com.abalone.core.ai;

import com.abalone.core.GameState;
import com.abalone.core.Player;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Summary of a finished self-play match.
 *
 * @param transcript moves in notation, a push marked with {@code *}
 * @param finalState the position the match ended in
 * @param winner     the winning side, or {@code null} for a draw
 * @param endReason  why the match stopped
 */
public record MatchRecord(List<String> transcript, GameState finalState, Player winner, EndReason endReason) {

    public MatchRecord {
        Objects.requireNonNull(finalState, "finalState");
        Objects.requireNonNull(endReason, "endReason");
        transcript = List.copyOf(transcript);
    }

    public Optional<Player> winnerIfAny() {
        return Optional.ofNullable(winner);
    }

    public int moveCount() {
        return transcript.size();
    }

    public int score(Player player) {
        return finalState.getScore(player);
    }

    public enum EndReason {
        /** A side pushed off six marbles. */
        SCORE,
        /** The move cap was reached; the side with more captures wins. */
        MAX_MOVES,
        /** The side to move had no legal move and loses. */
        NO_MOVES
    }
}
