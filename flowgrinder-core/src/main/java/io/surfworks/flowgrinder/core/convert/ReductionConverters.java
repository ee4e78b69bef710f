package io.surfworks.flowgrinder.core.convert;

import io.surfworks.flowgrinder.ir.Ops;

import java.util.List;

/**
 * reduce_sum, reduce_max, reduce_min, reduce_mean.
 */
final class ReductionConverters {

    private ReductionConverters() {}

    static void registerAll(ConverterRegistry.Builder b) {
        b.register("reduce_sum", reduction("sum"));
        b.register("reduce_max", reduction("max"));
        b.register("reduce_min", reduction("min"));
        b.register("reduce_mean", reduction("mean"));
    }

    private static OpConverter reduction(String op) {
        return (inputs, attributes, parameters) -> List.of(Ops.reduce(op, inputs.data(),
                attributes.getInts("axis", List.of()),
                attributes.getBool("keepdims", false)));
    }
}
