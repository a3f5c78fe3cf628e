package com.abalone.core.ai;

import com.abalone.core.GameState;
import com.abalone.core.Layout;
import com.abalone.core.MoveResult;
import com.abalone.core.Player;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Plays complete matches between two search configurations. Every move the searcher proposes is
 * checked against the live position before it is played; a rejected move raises
 * {@link SearchInvariantException}.
 */
public final class SelfPlay {

    private static final Logger LOGGER = Logger.getLogger(SelfPlay.class.getName());

    private final Searcher searcher;
    private final SearchConfig blackConfig;
    private final SearchConfig whiteConfig;
    private final Layout layout;
    private final int maxMoves;

    private int gamesPlayed;
    private final int[] wins = new int[Player.values().length];

    public SelfPlay(SearchConfig config) {
        this(new MinimaxAI(), config, config, Layout.STANDARD, 0);
    }

    /**
     * @param maxMoves move cap for each match, {@code 0} for none
     */
    public SelfPlay(Searcher searcher, SearchConfig blackConfig, SearchConfig whiteConfig, Layout layout,
            int maxMoves) {
        this.searcher = Objects.requireNonNull(searcher, "searcher");
        this.blackConfig = Objects.requireNonNull(blackConfig, "blackConfig");
        this.whiteConfig = Objects.requireNonNull(whiteConfig, "whiteConfig");
        this.layout = Objects.requireNonNull(layout, "layout");
        if (maxMoves < 0) {
            throw new IllegalArgumentException("Move cap must be non-negative");
        }
        this.maxMoves = maxMoves;
    }

    public List<MatchRecord> playGames(int gameCount) {
        if (gameCount < 1) {
            throw new IllegalArgumentException("Game count must be at least 1");
        }
        List<MatchRecord> records = new ArrayList<>(gameCount);
        for (int i = 0; i < gameCount; i++) {
            records.add(playSingleGame());
        }
        return records;
    }

    public MatchRecord playSingleGame() {
        GameState state = GameState.start(layout);
        List<String> transcript = new ArrayList<>();
        MatchRecord record = null;

        while (record == null) {
            if (state.isGameOver()) {
                record = new MatchRecord(transcript, state, state.winner().orElse(null), MatchRecord.EndReason.SCORE);
            } else if (maxMoves > 0 && transcript.size() >= maxMoves) {
                record = new MatchRecord(transcript, state, leaderByScore(state), MatchRecord.EndReason.MAX_MOVES);
            } else {
                Player mover = state.getCurrentPlayer();
                SearchResult result = searcher.search(state.getBoard(), mover, configFor(mover));
                if (!result.hasMove()) {
                    record = new MatchRecord(transcript, state, mover.opponent(), MatchRecord.EndReason.NO_MOVES);
                } else {
                    MoveResult played = state.applyMove(result.move());
                    if (!played.isAccepted()) {
                        throw new SearchInvariantException(result.move(), played.validation());
                    }
                    state = played.state();
                    transcript.add(state.lastMoveNotation().orElseThrow());
                }
            }
        }

        gamesPlayed++;
        record.winnerIfAny().ifPresent(winner -> wins[winner.ordinal()]++);
        final MatchRecord finished = record;
        final int gameNumber = gamesPlayed;
        LOGGER.info(() -> String.format("Completed self-play game %d (moves=%d, score=%d-%d, winner=%s, reason=%s)",
                gameNumber, finished.moveCount(), finished.score(Player.BLACK), finished.score(Player.WHITE),
                finished.winnerIfAny().map(Enum::name).orElse("draw"), finished.endReason()));
        return record;
    }

    public int getGamesPlayed() {
        return gamesPlayed;
    }

    public int getWins(Player player) {
        return wins[player.ordinal()];
    }

    private SearchConfig configFor(Player player) {
        return player == Player.BLACK ? blackConfig : whiteConfig;
    }

    private static Player leaderByScore(GameState state) {
        int black = state.getScore(Player.BLACK);
        int white = state.getScore(Player.WHITE);
        if (black == white) {
            return null;
        }
        return black > white ? Player.BLACK : Player.WHITE;
    }
}
