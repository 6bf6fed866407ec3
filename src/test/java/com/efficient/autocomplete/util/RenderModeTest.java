package com.efficient.autocomplete.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RenderModeTest {

    @Test
    void parsesModesIgnoringCase() {
        assertEquals(RenderMode.LIST, RenderMode.fromString("list"));
        assertEquals(RenderMode.TREE, RenderMode.fromString(" Tree "));
    }

    @Test
    void rejectsUnknownModes() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> RenderMode.fromString("markdown"));
        assertTrue(e.getMessage().contains("markdown"));
        assertThrows(IllegalArgumentException.class, () -> RenderMode.fromString(null));
    }
}
