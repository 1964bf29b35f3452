package org.mimetica.runtime;

import java.util.Locale;

/**
 * How rivalry is converted into aggression increments.
 */
public enum SourceMode {
    /** Overlap of desire over rivalrous objects, attenuated by social distance. */
    OBJECT,
    /** Closeness in status with an upward bias toward higher-status rivals. */
    STATUS;

    /**
     * Parses a selector such as {@code "object"} or {@code "STATUS"}.
     *
     * @throws IllegalArgumentException if the value is not a known mode.
     */
    public static SourceMode parse(String value) {
        if (value != null) {
            for (SourceMode mode : values()) {
                if (mode.name().equalsIgnoreCase(value.trim())) {
                    return mode;
                }
            }
        }
        throw new IllegalArgumentException("Invalid source mode: '" + value + "'. Expected one of: object, status");
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
