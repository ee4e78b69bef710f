package io.surfworks.flowgrinder.core.config;

import java.util.Locale;

/**
 * How operators are ordered for conversion.
 */
public enum OrderingPolicy {
    /** Producers before consumers, declaration order as tie-break. */
    TOPOLOGICAL,
    /** Declaration order as given; a consumer declared before its producer fails. */
    DECLARATION;

    public static OrderingPolicy parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown ordering policy '" + value
                    + "'; expected topological or declaration", e);
        }
    }
}
