package com.abalone.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class BoardRendererTest {

    @Test
    void drawsTopRowFirst() {
        String[] lines = BoardRenderer.render(Board.standard()).split("\\R");

        assertEquals("  Score: Black(@@) 0 - 0 White(OO)", lines[0]);
        assertEquals(2 + Geometry.ROWS, lines.length);
        assertTrue(lines[2].startsWith("          OO OO OO OO OO"), lines[2]);
        assertTrue(lines[2].endsWith("i"));
        assertTrue(lines[10].startsWith("          @@ @@ @@ @@ @@"), lines[10]);
        assertTrue(lines[10].endsWith("a"));
    }

    @Test
    void emptyCellsShowCoordinates() {
        String[] lines = BoardRenderer.render(Board.empty()).split("\\R");

        assertTrue(lines[6].startsWith("  e1 e2 e3 e4 e5 e6 e7 e8 e9"), lines[6]);
        for (int i = 2; i < lines.length; i++) {
            assertEquals(41, lines[i].length(), lines[i]);
        }
    }

    @Test
    void showsScores() {
        Board board = Board.of(RulesTest.positions("e5"), RulesTest.positions("a1"), 2, 3);
        assertTrue(BoardRenderer.render(board).startsWith("  Score: Black(@@) 2 - 3 White(OO)"));
    }
}
