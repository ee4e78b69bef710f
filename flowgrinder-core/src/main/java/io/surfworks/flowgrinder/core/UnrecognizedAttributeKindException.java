package io.surfworks.flowgrinder.core;

/**
 * Thrown when an attribute carries a tag the attribute parser does not know.
 */
public class UnrecognizedAttributeKindException extends ConversionException {

    private final String key;
    private final String tag;

    public UnrecognizedAttributeKindException(String key, String tag) {
        super(String.format("Attribute '%s' has unrecognized kind '%s'", key, tag));
        this.key = key;
        this.tag = tag;
    }

    public UnrecognizedAttributeKindException(String key, String tag, String detail) {
        super(String.format("Attribute '%s' of kind '%s' is malformed: %s", key, tag, detail));
        this.key = key;
        this.tag = tag;
    }

    public String getKey() {
        return key;
    }

    public String getTag() {
        return tag;
    }
}
