package com.efficient.autocomplete.util;

import java.util.Locale;

public enum RenderMode {
    /** Every stored word, one per line. */
    LIST,
    /** Every node as a markdown style heading: depth marker, label, terminal glyph. */
    TREE;

    public static RenderMode fromString(String mode) {
        if (mode == null) {
            throw new IllegalArgumentException("Render mode must not be null");
        }
        try {
            return valueOf(mode.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown render mode '" + mode + "', expected one of list, tree", e);
        }
    }
}
