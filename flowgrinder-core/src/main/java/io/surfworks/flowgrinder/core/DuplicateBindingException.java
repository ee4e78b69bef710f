package io.surfworks.flowgrinder.core;

import io.surfworks.flowgrinder.core.graph.BlobPath;

/**
 * Thrown when two distinct symbols claim the same storage path.
 */
public class DuplicateBindingException extends ConversionException {

    private final BlobPath path;

    public DuplicateBindingException(BlobPath path, String existing, String attempted) {
        super(String.format("Path '%s' is already bound to '%s', cannot bind it to '%s'",
                path, existing, attempted));
        this.path = path;
    }

    public BlobPath getPath() {
        return path;
    }
}
