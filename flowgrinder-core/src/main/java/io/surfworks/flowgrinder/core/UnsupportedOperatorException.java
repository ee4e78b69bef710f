package io.surfworks.flowgrinder.core;

import java.util.List;
import java.util.SortedSet;

/**
 * Thrown before any conversion when the graph uses operator types that have
 * neither a converter nor an identity pass-through.
 */
public class UnsupportedOperatorException extends ConversionException {

    private final List<String> opTypes;

    public UnsupportedOperatorException(SortedSet<String> opTypes) {
        super("The following operators are not supported: " + String.join(", ", opTypes));
        this.opTypes = List.copyOf(opTypes);
    }

    /**
     * All unsupported operator types, sorted.
     */
    public List<String> getOpTypes() {
        return opTypes;
    }
}
