package com.example.pdfcompress.domain.model;

import java.util.Locale;

/**
 * Coarse policy knob that governs how aggressively structural entries are pruned.
 * Levels are ordered: {@code LOW < MEDIUM < HIGH}.
 */
public enum CompressionLevel {
    LOW,
    MEDIUM,
    HIGH;

	/**
	 * Parses a raw request value such as {@code "high"} into a level.
	 *
	 * @param rawValue value coming from the HTTP layer
	 * @return parsed level or {@code null} when the input is blank or unknown
	 */
    public static CompressionLevel fromString(String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            return null;
        }
        try {
            return CompressionLevel.valueOf(rawValue.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }

    public boolean isHigh() {
        return this == HIGH;
    }

    /**
     * Wire representation used by clients ({@code low}, {@code medium}, {@code high}).
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
