package com.abalone.core;

/**
 * Plain text picture of a board, top row first. Empty cells show their coordinates, Black marbles
 * {@code @@} and White marbles {@code OO}.
 */
public final class BoardRenderer {

    private static final int LABEL_COLUMN = 40;

    private BoardRenderer() {
    }

    public static String render(Board board) {
        StringBuilder builder = new StringBuilder();
        builder.append(String.format("  Score: Black(@@) %d - %d White(OO)%n%n",
                board.score(Player.BLACK), board.score(Player.WHITE)));
        for (int row = Geometry.ROWS - 1; row >= 0; row--) {
            char letter = Position.ROW_LETTERS.charAt(row);
            StringBuilder line = new StringBuilder("  ");
            int indent = Math.abs(row - 4);
            for (int i = 0; i < indent; i++) {
                line.append("  ");
            }
            for (int column = Geometry.firstColumn(row); column <= Geometry.lastColumn(row); column++) {
                if (column > Geometry.firstColumn(row)) {
                    line.append(' ');
                }
                line.append(symbol(board.get(new Position(row, column)), letter, column));
            }
            while (line.length() < LABEL_COLUMN) {
                line.append(' ');
            }
            builder.append(line).append(letter).append(System.lineSeparator());
        }
        return builder.toString();
    }

    private static String symbol(Cell cell, char letter, int column) {
        switch (cell) {
            case BLACK:
                return "@@";
            case WHITE:
                return "OO";
            default:
                return String.valueOf(letter) + column;
        }
    }
}
