package com.streamfirst.nomicon.domain;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Joining and casing conventions a name can be rendered in.
 * Each style has a stable wire name used in style priority lists and per-resource overrides.
 */
public enum NamingStyle {
    DASHED("dashed"),
    UNDERSCORE("underscore"),
    STRAIGHT("straight"),
    PASCAL("pascal"),
    PASCAL_DASHED("pascaldashed"),
    CAMEL("camel");

    private final String wireName;

    NamingStyle(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Returns the wire name (e.g., "dashed", "pascaldashed").
     */
    public String wireName() {
        return wireName;
    }

    /**
     * Looks up a style by wire name, ignoring case and surrounding whitespace.
     *
     * @param value the wire name, may be null
     * @return the style, or empty if the value names no known style
     */
    public static Optional<NamingStyle> fromWireName(String value) {
        String normalized = normalize(value);
        for (NamingStyle style : values()) {
            if (style.wireName.equals(normalized)) {
                return Optional.of(style);
            }
        }
        return Optional.empty();
    }

    /**
     * Lowercases and trims a style name without checking that it is known.
     */
    public static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * The priority used when neither the configuration nor the call supplies one.
     */
    public static List<String> defaultPriority() {
        return List.of(DASHED.wireName, PASCAL.wireName, PASCAL_DASHED.wireName,
                CAMEL.wireName, STRAIGHT.wireName, UNDERSCORE.wireName);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
