package com.abalone.core.ai;

import com.abalone.core.Board;
import com.abalone.core.Player;

/**
 * Generic interface for game tree search implementations.
 */
public interface Searcher {

    /**
     * Searches for the best move of {@code player} on the provided board. The board is not
     * modified. Callers should check the returned move against the live position before applying
     * it.
     *
     * @param board  the position to analyse
     * @param player the player to move
     * @param config depth, heuristic and tie-break settings
     * @return the result of the search; its move is {@code null} if no legal move exists
     */
    SearchResult search(Board board, Player player, SearchConfig config);
}
