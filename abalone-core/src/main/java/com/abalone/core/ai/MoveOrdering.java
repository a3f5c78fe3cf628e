package com.abalone.core.ai;

import com.abalone.core.Board;
import com.abalone.core.Move;
import com.abalone.core.Player;
import com.abalone.core.Rules;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders candidate moves before search: pushes first, then longer lines, then by notation.
 * The order only affects how much alpha-beta prunes, not the value found.
 */
public final class MoveOrdering {

    private static final Comparator<Keyed> ORDER = Comparator
            .comparing((Keyed keyed) -> !keyed.push)
            .thenComparing(keyed -> -keyed.move.count())
            .thenComparing(keyed -> keyed.notation);

    private MoveOrdering() {
    }

    public static List<Move> order(Board board, Player player, List<Move> moves) {
        List<Keyed> keyed = new ArrayList<>(moves.size());
        for (Move move : moves) {
            keyed.add(new Keyed(move, Rules.wouldPush(board, player, move), move.notation()));
        }
        keyed.sort(ORDER);
        List<Move> ordered = new ArrayList<>(keyed.size());
        for (Keyed entry : keyed) {
            ordered.add(entry.move);
        }
        return ordered;
    }

    private record Keyed(Move move, boolean push, String notation) {
    }
}
