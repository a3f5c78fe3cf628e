package com.abalone.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class MoveTest {

    @Test
    void identityIgnoresInputOrder() {
        Move forward = Move.of(Direction.E, "c3", "c4", "c5");
        Move shuffled = Move.of(Direction.E, "c5", "c3", "c4");
        assertEquals(forward, shuffled);
        assertEquals(forward.hashCode(), shuffled.hashCode());
        assertEquals(List.of(Position.parse("c3"), Position.parse("c4"), Position.parse("c5")), shuffled.marbles());
        assertNotEquals(forward, Move.of(Direction.W, "c3", "c4", "c5"));
    }

    @Test
    void classifiesInlineAndBroadside() {
        assertTrue(Move.of(Direction.NE, "e5").isInline());
        assertTrue(Move.of(Direction.E, "c3", "c4").isInline());
        assertTrue(Move.of(Direction.W, "c3", "c4").isInline());
        assertFalse(Move.of(Direction.NW, "c3", "c4").isInline());
        assertTrue(Move.of(Direction.SW, "b2", "c3", "d4").isInline());
        assertFalse(Move.of(Direction.E, "b2", "c3", "d4").isInline());
        assertEquals(3, Move.of(Direction.E, "b2", "c3", "d4").count());
    }

    @Test
    void leadingAndTrailingFollowDirection() {
        Move east = Move.of(Direction.E, "c3", "c4", "c5");
        assertEquals(Position.parse("c3"), east.trailing());
        assertEquals(Position.parse("c5"), east.leading());

        Move west = Move.of(Direction.W, "c3", "c4", "c5");
        assertEquals(Position.parse("c5"), west.trailing());
        assertEquals(Position.parse("c3"), west.leading());
        assertEquals(List.of(Position.parse("c3"), Position.parse("c4"), Position.parse("c5")),
                west.marblesLeadingFirst());

        Move southWest = Move.of(Direction.SW, "c3", "d4");
        assertEquals(Position.parse("d4"), southWest.trailing());
        assertEquals(Position.parse("c3"), southWest.leading());
    }

    @Test
    void rejectsMalformedShapes() {
        assertThrows(IllegalArgumentException.class, () -> new Move(List.of(), Direction.E));
        assertThrows(IllegalArgumentException.class, () -> Move.of(Direction.E, "a1", "a2", "a3", "a4"));
        assertThrows(IllegalArgumentException.class, () -> Move.of(Direction.E, "a1", "a1"));
        assertThrows(NullPointerException.class, () -> new Move(List.of(Position.parse("a1")), null));
    }

    @Test
    void nonColinearMarblesAreRepresentable() {
        Move scattered = Move.of(Direction.E, "a1", "c3");
        assertEquals(2, scattered.count());
        assertFalse(scattered.isInline());
    }

    @Test
    void categoriesFollowShape() {
        assertEquals(MoveCategory.SINGLE_INLINE, MoveCategory.of(Move.of(Direction.E, "e5")));
        assertEquals(MoveCategory.DOUBLE_INLINE, MoveCategory.of(Move.of(Direction.E, "e5", "e6")));
        assertEquals(MoveCategory.DOUBLE_BROADSIDE, MoveCategory.of(Move.of(Direction.NE, "e5", "e6")));
        assertEquals(MoveCategory.TRIPLE_INLINE, MoveCategory.of(Move.of(Direction.NW, "d5", "e5", "f5")));
        assertEquals(MoveCategory.TRIPLE_BROADSIDE, MoveCategory.of(Move.of(Direction.E, "d5", "e5", "f5")));
    }
}
