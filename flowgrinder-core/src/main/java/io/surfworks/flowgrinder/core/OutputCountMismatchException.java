package io.surfworks.flowgrinder.core;

/**
 * Thrown when a converter produces a different number of values than the
 * node declares outputs.
 */
public class OutputCountMismatchException extends ConversionException {

    public OutputCountMismatchException(String opType, String nodeName, int declared, int produced) {
        super(String.format("Number of outputs mismatch in %s node '%s': declared %d, produced %d",
                opType, nodeName, declared, produced));
    }
}
