package io.devguard.model;

import java.util.Locale;

/**
 * Kind of change proposed for a symbol in a blast radius simulation.
 */
public enum ChangeKind {
    RENAME,
    REMOVE,
    SIGNATURE_CHANGE;

    /**
     * Parses "rename", "remove", "signature-change" and their constant forms.
     */
    public static ChangeKind parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Change kind must not be null");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return ChangeKind.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown change kind: " + value
                    + " (expected rename, remove or signature-change)");
        }
    }
}
