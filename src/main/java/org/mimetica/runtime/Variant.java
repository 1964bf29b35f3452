package org.mimetica.runtime;

import java.util.Arrays;

/**
 * Canonical names for the four source/spread combinations.
 */
public enum Variant {
    LM(SourceMode.OBJECT, SpreadMode.LINEAR),
    AC(SourceMode.OBJECT, SpreadMode.ATTENTION),
    RL(SourceMode.STATUS, SpreadMode.LINEAR),
    RA(SourceMode.STATUS, SpreadMode.ATTENTION);

    private final SourceMode source;
    private final SpreadMode spread;

    Variant(SourceMode source, SpreadMode spread) {
        this.source = source;
        this.spread = spread;
    }

    public SourceMode source() {
        return source;
    }

    public SpreadMode spread() {
        return spread;
    }

    /**
     * @throws IllegalArgumentException if the name is not one of LM, AC, RL, RA.
     */
    public static Variant parse(String name) {
        if (name != null) {
            for (Variant v : values()) {
                if (v.name().equalsIgnoreCase(name.trim())) {
                    return v;
                }
            }
        }
        throw new IllegalArgumentException("Unknown variant '" + name + "'. Expected one of " + Arrays.toString(values()));
    }
}
