package com.abalone.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Named starting layouts. Each places fourteen marbles per side.
 */
public enum Layout {
    STANDARD("standard",
            "a1 a2 a3 a4 a5 b1 b2 b3 b4 b5 b6 c3 c4 c5",
            "g5 g6 g7 h4 h5 h6 h7 h8 h9 i5 i6 i7 i8 i9"),
    BELGIAN_DAISY("belgian_daisy",
            "a1 a2 b1 b2 b3 c1 c2 g8 g9 h7 h8 h9 i8 i9",
            "a4 a5 b4 b5 b6 c6 c7 g3 g4 h4 h5 h6 i5 i6"),
    GERMAN_DAISY("german_daisy",
            "b1 b2 c1 c2 c3 d1 d2 f8 f9 g7 g8 g9 h8 h9",
            "b5 b6 c5 c6 c7 d7 d8 f2 f3 g3 g4 g5 h4 h5");

    public static final int MARBLES_PER_SIDE = 14;

    private final String layoutName;
    private final List<Position> black;
    private final List<Position> white;

    Layout(String layoutName, String black, String white) {
        this.layoutName = layoutName;
        this.black = parsePositions(black);
        this.white = parsePositions(white);
    }

    public String layoutName() {
        return layoutName;
    }

    public List<Position> positions(Player player) {
        return player == Player.BLACK ? black : white;
    }

    /**
     * Resolves a layout by its name, e.g. {@code "belgian_daisy"}.
     *
     * @throws IllegalArgumentException if no layout carries that name
     */
    public static Layout fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (Layout layout : values()) {
                if (layout.layoutName.equals(normalized)) {
                    return layout;
                }
            }
        }
        throw new IllegalArgumentException("Unknown layout: " + name);
    }

    private static List<Position> parsePositions(String cells) {
        List<Position> positions = new ArrayList<>();
        for (String token : cells.split(" ")) {
            positions.add(Position.parse(token));
        }
        return List.copyOf(positions);
    }
}
