package io.surfworks.flowgrinder.core;

import io.surfworks.flowgrinder.core.graph.BlobPath;

/**
 * Thrown when a storage path is referenced but no producer, graph input or
 * checkpoint parameter provides it.
 */
public class UnboundReferenceException extends ConversionException {

    private final BlobPath path;

    public UnboundReferenceException(BlobPath path, String referrer) {
        super(String.format("%s references '%s', which no operator, input or parameter provides",
                referrer, path));
        this.path = path;
    }

    public BlobPath getPath() {
        return path;
    }
}
