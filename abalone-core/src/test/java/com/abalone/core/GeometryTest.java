package com.abalone.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class GeometryTest {

    @Test
    void boardHasSixtyOneCells() {
        assertEquals(Geometry.CELL_COUNT, Geometry.ALL.size());
        assertTrue(Geometry.isValid(Position.parse("a1")));
        assertTrue(Geometry.isValid(Position.parse("a5")));
        assertFalse(Geometry.isValid(Position.parse("a6")));
        assertTrue(Geometry.isValid(Position.parse("e1")));
        assertTrue(Geometry.isValid(Position.parse("e9")));
        assertFalse(Geometry.isValid(Position.parse("i4")));
        assertTrue(Geometry.isValid(Position.parse("i9")));
        assertFalse(Geometry.isValid(Position.parse("c8")));
        assertFalse(Geometry.isValid(new Position(-1, 3)));
        assertFalse(Geometry.isValid(new Position(9, 9)));
    }

    @Test
    void indexTableRoundTrips() {
        for (int index = 0; index < Geometry.CELL_COUNT; index++) {
            Position position = Geometry.positionAt(index);
            assertEquals(index, Geometry.indexOf(position));
        }
        assertEquals(-1, Geometry.indexOf(new Position(0, 0)));
    }

    @Test
    void positionsAreListedInSortedOrder() {
        List<Position> sorted = new ArrayList<>(Geometry.ALL);
        sorted.sort(null);
        assertEquals(sorted, Geometry.ALL);
    }

    @Test
    void directionsAreClosedUnderNegation() {
        for (Direction direction : Direction.values()) {
            Direction opposite = Geometry.opposite(direction);
            assertEquals(-direction.rowDelta(), opposite.rowDelta());
            assertEquals(-direction.columnDelta(), opposite.columnDelta());
            assertEquals(direction, opposite.opposite());
            assertTrue(direction.isParallelTo(opposite));
        }
    }

    @Test
    void neighbourIsVectorAddition() {
        Position center = Geometry.CENTER;
        assertEquals(Position.parse("e6"), Geometry.neighbor(center, Direction.E));
        assertEquals(Position.parse("f5"), Geometry.neighbor(center, Direction.NW));
        assertEquals(Position.parse("f6"), Geometry.neighbor(center, Direction.NE));
        assertEquals(Position.parse("d4"), Geometry.neighbor(center, Direction.SW));
        assertEquals(new Position(-1, 1), Geometry.neighbor(Position.parse("a1"), Direction.SE));
    }

    @Test
    void onlyCanonicalVectorsResolve() {
        assertEquals(Direction.NE, Direction.fromVector(1, 1).orElseThrow());
        assertTrue(Direction.fromVector(1, -1).isEmpty());
        assertTrue(Direction.fromVector(0, 2).isEmpty());
        assertTrue(Direction.fromVector(0, 0).isEmpty());
        assertEquals(Direction.SW, Direction.fromName("sw").orElseThrow());
        assertTrue(Direction.fromName("N").isEmpty());
    }

    @Test
    void everyCellHasAtMostSixNeighbours() {
        int interior = 0;
        for (Position position : Geometry.ALL) {
            int neighbours = 0;
            for (Direction direction : Direction.values()) {
                if (Geometry.isValid(Geometry.neighbor(position, direction))) {
                    neighbours++;
                }
            }
            assertTrue(neighbours >= 3 && neighbours <= 6, "Unexpected neighbour count at " + position);
            if (neighbours == 6) {
                interior++;
            }
        }
        assertEquals(37, interior);
    }
}
