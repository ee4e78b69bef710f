package io.surfworks.flowgrinder.core.padding;

import io.surfworks.flowgrinder.core.InvalidPaddingModeException;

import java.util.Locale;

/**
 * Padding policy of a spatial operator.
 */
public enum PaddingMode {
    /** No padding. */
    VALID,
    /** Output extent is ceil(input / stride); odd padding goes after. */
    SAME_UPPER,
    /** Like {@link #SAME_UPPER} but odd padding goes before. */
    SAME_LOWER,
    /** Extents come from the node's {@code padding_before}/{@code padding_after}. */
    CUSTOMIZED;

    public static PaddingMode parse(String value) {
        if (value == null) {
            throw new InvalidPaddingModeException("null");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "valid" -> VALID;
            case "same", "same_upper" -> SAME_UPPER;
            case "same_lower" -> SAME_LOWER;
            case "customized", "explicit" -> CUSTOMIZED;
            default -> throw new InvalidPaddingModeException(value);
        };
    }

    public boolean isSame() {
        return this == SAME_UPPER || this == SAME_LOWER;
    }
}
