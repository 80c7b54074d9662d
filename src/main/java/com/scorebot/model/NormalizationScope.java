package com.scorebot.model;

import java.util.Locale;

/**
 * Peer group a metric is normalized against.
 */
public enum NormalizationScope {
    /** Every fetched symbol. */
    UNIVERSE,
    /** Symbols of the same sector; 50 means the sector average. */
    SECTOR;

    /**
     * @throws IllegalArgumentException for anything but {@code universe} or {@code sector}
     */
    public static NormalizationScope fromText(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return UNIVERSE;
        }
        String value = raw.trim().toUpperCase(Locale.ROOT);
        for (NormalizationScope scope : values()) {
            if (scope.name().equals(value)) {
                return scope;
            }
        }
        throw new IllegalArgumentException("score.normalization.scope must be universe or sector, got: " + raw);
    }
}
