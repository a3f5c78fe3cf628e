package com.abalone.core;

/**
 * Shape classification of a move by marble count and inline/broadside.
 */
public enum MoveCategory {
    SINGLE_INLINE,
    DOUBLE_INLINE,
    DOUBLE_BROADSIDE,
    TRIPLE_INLINE,
    TRIPLE_BROADSIDE;

    public static MoveCategory of(Move move) {
        switch (move.count()) {
            case 1:
                return SINGLE_INLINE;
            case 2:
                return move.isInline() ? DOUBLE_INLINE : DOUBLE_BROADSIDE;
            default:
                return move.isInline() ? TRIPLE_INLINE : TRIPLE_BROADSIDE;
        }
    }
}
