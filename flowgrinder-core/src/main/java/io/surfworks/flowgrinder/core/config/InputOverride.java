package io.surfworks.flowgrinder.core.config;

import io.surfworks.flowgrinder.ir.TensorIr.ScalarType;

import java.util.List;

/**
 * User-supplied replacement for the primary input's declaration.
 *
 * @param name  variable name, or null to keep the declared one
 * @param shape shape, or null to keep the declared one; -1 marks a dynamic extent
 * @param dtype element type, or null to keep the declared one
 */
public record InputOverride(String name, List<Integer> shape, ScalarType dtype) {

    public InputOverride {
        shape = shape == null ? null : List.copyOf(shape);
        if (name != null && name.isBlank()) {
            throw new IllegalArgumentException("Input override name cannot be blank");
        }
    }

    public static InputOverride shape(List<Integer> shape) {
        return new InputOverride(null, shape, null);
    }
}
