package io.hearthwarrio.outlinium.core;

import java.util.Locale;

/**
 * Which tree an outline is built from.
 */
public enum SnapshotMode {

    /**
     * Compact outline keyed by accessible role, built from the browser's accessibility tree.
     * Identifiers map to DOM elements through the shared backend identity.
     */
    ACCESSIBILITY("accessibility"),

    /**
     * Exhaustive outline keyed by tag name, built from the DOM snapshot. Includes hidden and file inputs.
     */
    DOM("dom");

    private final String value;

    SnapshotMode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static SnapshotMode defaultMode() {
        return ACCESSIBILITY;
    }

    /**
     * Parses {@code "accessibility"} or {@code "dom"} (case-insensitive).
     *
     * @throws IllegalArgumentException for any other value
     */
    public static SnapshotMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Snapshot mode must not be blank");
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (SnapshotMode mode : values()) {
            if (mode.value.equals(v)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown snapshot mode: '" + value + "'. Expected 'accessibility' or 'dom'");
    }
}
