package com.abalone.core.ai;

import com.abalone.core.BoardRenderer;
import com.abalone.core.Layout;
import com.abalone.core.Player;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line entry point for running {@link SelfPlay} matches with configurable parameters.
 */
public final class SelfPlayRunner {

    private static final Logger LOGGER = Logger.getLogger(SelfPlayRunner.class.getName());

    private SelfPlayRunner() {
    }

    public static void main(String[] args) {
        if (args.length < 2 || args.length > 6) {
            printUsage();
            return;
        }
        try {
            int gameCount = Integer.parseInt(args[0]);
            int depth = Integer.parseInt(args[1]);
            String heuristic = HeuristicPreset.DEFAULT.presetName();
            String tieBreak = TieBreakPolicy.LEXICOGRAPHIC.policyName();
            Layout layout = Layout.STANDARD;
            int maxMoves = 200;

            for (int index = 2; index < args.length; index++) {
                String option = args[index];
                if (option.startsWith("--heuristic=")) {
                    heuristic = option.substring("--heuristic=".length());
                } else if (option.startsWith("--tieBreak=")) {
                    tieBreak = option.substring("--tieBreak=".length());
                } else if (option.startsWith("--layout=")) {
                    layout = Layout.fromName(option.substring("--layout=".length()));
                } else if (option.startsWith("--maxMoves=")) {
                    maxMoves = Integer.parseInt(option.substring("--maxMoves=".length()));
                } else {
                    throw new IllegalArgumentException("Unrecognised argument: " + option);
                }
            }

            SearchConfig config = new SearchConfig(depth, heuristic, tieBreak);
            SelfPlay selfPlay = new SelfPlay(new MinimaxAI(), config, config, layout, maxMoves);
            List<MatchRecord> records = selfPlay.playGames(gameCount);

            MatchRecord last = records.get(records.size() - 1);
            System.out.println(BoardRenderer.render(last.finalState().getBoard()));
            System.out.println(String.join(" ", last.transcript()));
            System.out.printf("Games: %d, Black wins: %d, White wins: %d%n", selfPlay.getGamesPlayed(),
                    selfPlay.getWins(Player.BLACK), selfPlay.getWins(Player.WHITE));
        } catch (NumberFormatException ex) {
            LOGGER.log(Level.SEVERE, "Failed to parse arguments", ex);
            printUsage();
        } catch (IllegalArgumentException ex) {
            LOGGER.log(Level.SEVERE, ex.getMessage(), ex);
        }
    }

    private static void printUsage() {
        System.err.println("Usage: SelfPlayRunner <gameCount> <depth> [--heuristic=<balanced|material>] "
                + "[--tieBreak=<lexicographic|first>] [--layout=<standard|belgian_daisy|german_daisy>] "
                + "[--maxMoves=<n>]");
    }
}
