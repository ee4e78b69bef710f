package io.surfworks.flowgrinder.core.checkpoint;

import io.surfworks.flowgrinder.core.graph.BlobPath;

import java.util.Objects;

/**
 * A trained parameter: its checkpoint name, the blob path consumers use to
 * reference it, and its tensor.
 */
public record ParameterRecord(String name, BlobPath path, TensorBuffer buffer) {

    public ParameterRecord {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(buffer, "buffer");
    }
}
