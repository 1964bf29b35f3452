package org.mimetica.runtime;

import java.util.Locale;

/**
 * How aggression propagates between neighbors.
 */
public enum SpreadMode {
    /** Convex blend of own aggression and the prestige-weighted neighbor mean. */
    LINEAR,
    /** Neighbor hostility sharpened by the salience exponent, then rescaled to its original mass. */
    ATTENTION;

    /**
     * Parses a selector such as {@code "linear"} or {@code "Attention"}.
     *
     * @throws IllegalArgumentException if the value is not a known mode.
     */
    public static SpreadMode parse(String value) {
        if (value != null) {
            for (SpreadMode mode : values()) {
                if (mode.name().equalsIgnoreCase(value.trim())) {
                    return mode;
                }
            }
        }
        throw new IllegalArgumentException("Invalid spread mode: '" + value + "'. Expected one of: linear, attention");
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
