package io.surfworks.flowgrinder.core;

/**
 * Thrown when the graph as a whole is inconsistent: a dependency cycle, a
 * free variable that is neither input nor parameter, or no outputs.
 */
public class MalformedGraphException extends ConversionException {

    public MalformedGraphException(String message) {
        super(message);
    }
}
