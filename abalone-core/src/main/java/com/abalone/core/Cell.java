package com.abalone.core;

/**
 * Occupancy of a single board cell.
 */
public enum Cell {
    EMPTY,
    BLACK,
    WHITE;

    public boolean isOccupiedBy(Player player) {
        return this == player.cell();
    }
}
