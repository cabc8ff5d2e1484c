package com.showdownlab.optimizer.domain;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Closed roster position vocabulary for a Showdown slate.
 */
public enum Position {
    QB,
    RB,
    WR,
    TE,
    K,
    DST;

    /**
     * Wide receivers and tight ends are the stack partners of a quarterback captain.
     */
    public boolean isPassCatcher() {
        return this == WR || this == TE;
    }

    /**
     * Parse a position code, accepting the common defense aliases.
     */
    @JsonCreator
    public static Position fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Position code is required");
        }

        String normalized = code.trim().toUpperCase(Locale.ROOT);
        return switch (normalized) {
            case "D", "DEF", "D/ST", "DST" -> DST;
            case "PK" -> K;
            default -> {
                try {
                    yield Position.valueOf(normalized);
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("Unknown position: " + code, e);
                }
            }
        };
    }
}
