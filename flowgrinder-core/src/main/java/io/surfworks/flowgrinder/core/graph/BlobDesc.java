package io.surfworks.flowgrinder.core.graph;

import io.surfworks.flowgrinder.ir.TensorIr.ScalarType;
import io.surfworks.flowgrinder.ir.TensorIr.TensorType;

import java.util.List;

/**
 * Logical shape and data type the exporter recorded for a blob.
 */
public record BlobDesc(List<Integer> shape, ScalarType dtype) {

    public BlobDesc {
        shape = List.copyOf(shape);
    }

    public TensorType toTensorType() {
        return new TensorType(shape, dtype);
    }
}
