package com.abalone.core;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of an Abalone match: the board, the player to move, the move number and the
 * move that led here. The live board is never exposed; accessors hand out copies.
 */
public final class GameState {

    private final Board board;
    private final Player currentPlayer;
    private final int moveNumber;
    private final Move lastMove;
    private final MoveOutcome lastOutcome;

    /**
     * Creates the standard opening with Black to move.
     */
    public GameState() {
        this(Board.standard(), Player.BLACK, 0, null, null);
    }

    private GameState(Board board, Player currentPlayer, int moveNumber, Move lastMove, MoveOutcome lastOutcome) {
        this.board = board;
        this.currentPlayer = currentPlayer;
        this.moveNumber = moveNumber;
        this.lastMove = lastMove;
        this.lastOutcome = lastOutcome;
    }

    /**
     * Creates the opening of the provided layout with Black to move.
     */
    public static GameState start(Layout layout) {
        return new GameState(Board.withLayout(layout), Player.BLACK, 0, null, null);
    }

    /**
     * Creates a state from an arbitrary position. The board is copied.
     */
    public static GameState of(Board board, Player currentPlayer) {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(currentPlayer, "currentPlayer");
        return new GameState(board.copy(), currentPlayer, 0, null, null);
    }

    /**
     * Returns a copy of the board.
     */
    public Board getBoard() {
        return board.copy();
    }

    public Player getCurrentPlayer() {
        return currentPlayer;
    }

    /**
     * Returns the number of moves played since this line of states was started.
     */
    public int getMoveNumber() {
        return moveNumber;
    }

    public int getScore(Player player) {
        return board.score(player);
    }

    public int getMarbleCount(Player player) {
        return board.marbleCount(player);
    }

    public Optional<Move> getLastMove() {
        return Optional.ofNullable(lastMove);
    }

    public Optional<MoveOutcome> getLastOutcome() {
        return Optional.ofNullable(lastOutcome);
    }

    /**
     * Returns {@code true} once a player has pushed off six marbles.
     */
    public boolean isGameOver() {
        return board.isDecided();
    }

    public Optional<Player> winner() {
        for (Player player : Player.values()) {
            if (board.score(player) >= Board.WINNING_SCORE) {
                return Optional.of(player);
            }
        }
        return Optional.empty();
    }

    public List<Move> legalMoves() {
        return MoveGenerator.generateLegalMoves(board, currentPlayer);
    }

    /**
     * Checks the move for the player to move without changing anything.
     */
    public MoveValidation validate(Move move) {
        if (isGameOver()) {
            return MoveValidation.rejected(Rejection.GAME_OVER);
        }
        return MoveValidator.validate(board, currentPlayer, move);
    }

    /**
     * Plays the move for the player to move. A rejected move leaves this state as it is and is
     * reported through the result.
     */
    public MoveResult applyMove(Move move) {
        MoveValidation validation = validate(move);
        if (!validation.isValid()) {
            return new MoveResult(this, validation);
        }
        Board updated = board.copy();
        MoveOutcome outcome = Rules.apply(updated, currentPlayer, move);
        return new MoveResult(new GameState(updated, currentPlayer.opponent(), moveNumber + 1, move, outcome),
                validation);
    }

    /**
     * Notation of the move that produced this state, with the push marker when it pushed.
     */
    public Optional<String> lastMoveNotation() {
        if (lastMove == null) {
            return Optional.empty();
        }
        return Optional.of(MoveNotation.format(lastMove, lastOutcome != null && lastOutcome.pushed()));
    }
}
