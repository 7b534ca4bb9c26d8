package com.tyron.snipj.api.editor;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TextRangeTest {

    @Test
    public void containsIsInclusive() {
        TextRange range = new TextRange(2, 5);

        assertTrue(range.contains(new TextRange(2, 5)));
        assertTrue(range.contains(TextRange.empty(2)));
        assertTrue(range.contains(TextRange.empty(5)));
        assertFalse(range.contains(new TextRange(1, 3)));
        assertFalse(range.contains(new TextRange(4, 6)));
        assertTrue(range.containsOffset(5));
        assertFalse(range.containsOffset(6));
    }

    @Test
    public void factoriesAndShift() {
        assertEquals(new TextRange(3, 7), TextRange.from(3, 4));
        assertEquals(new TextRange(5, 9), TextRange.from(3, 4).shiftRight(2));
        assertTrue(TextRange.empty(4).isEmpty());
        assertEquals(3, new TextRange(1, 4).getLength());
    }

    @Test
    public void rejectsInvalidBounds() {
        assertThrows(IllegalArgumentException.class, () -> new TextRange(-1, 2));
        assertThrows(IllegalArgumentException.class, () -> new TextRange(3, 2));
        assertThrows(IllegalArgumentException.class, () -> new DocumentEvent(null, 4, 1, ""));
    }

    @Test
    public void eventDelta() {
        DocumentEvent event = new DocumentEvent(null, 2, 5, "ab");

        assertEquals(3, event.getOldLength());
        assertEquals(-1, event.getDelta());
        assertEquals(new TextRange(2, 5), event.getRange());
    }
}
