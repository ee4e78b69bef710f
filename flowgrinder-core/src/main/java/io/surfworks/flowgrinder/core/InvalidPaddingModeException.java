package io.surfworks.flowgrinder.core;

/**
 * Thrown for a padding policy string that is not one of the known modes.
 */
public class InvalidPaddingModeException extends ConversionException {

    private final String mode;

    public InvalidPaddingModeException(String mode) {
        super(String.format("Value '%s' of attribute \"padding\" is invalid", mode));
        this.mode = mode;
    }

    public String getMode() {
        return mode;
    }
}
