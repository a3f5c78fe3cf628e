package com.abalone.core;

/**
 * The two sides. Black moves first.
 */
public enum Player {
    BLACK,
    WHITE;

    public Player opponent() {
        return this == BLACK ? WHITE : BLACK;
    }

    public Cell cell() {
        return this == BLACK ? Cell.BLACK : Cell.WHITE;
    }
}
