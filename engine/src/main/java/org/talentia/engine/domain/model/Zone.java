package org.talentia.engine.domain.model;

import java.util.Locale;

/**
 * Operating regions a position belongs to and a recruiter covers.
 */
public enum Zone {
    TRUJILLO("Trujillo"),
    VIRU("Viru"),
    CHAO("Chao"),
    CHICAMA("Chicama"),
    CHICLAYO("Chiclayo"),
    AREQUIPA("Arequipa"),
    ICA("Ica"),
    LIMA("Lima");

    private final String displayName;

    Zone(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Resolve a zone from its display name or constant name, ignoring case.
     *
     * @throws IllegalArgumentException if the value names no known zone
     */
    public static Zone fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("zone must not be null");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (Zone zone : values()) {
            if (zone.name().equals(normalized)) {
                return zone;
            }
        }
        throw new IllegalArgumentException("Unknown zone: " + value);
    }
}
