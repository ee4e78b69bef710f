package io.surfworks.flowgrinder.core.config;

import java.util.Objects;

/**
 * Options of one conversion run.
 *
 * @param moduleName        name of the produced IR module
 * @param primaryInput      override for the primary input (may be null)
 * @param strictOutputs     fail on an output whose path nothing provides, instead of dropping it
 * @param ordering          operator ordering policy
 * @param checkpointThreads reader threads for checkpoint loading
 */
public record ConversionOptions(
        String moduleName,
        InputOverride primaryInput,
        boolean strictOutputs,
        OrderingPolicy ordering,
        int checkpointThreads
) {

    /** Default module name */
    public static final String DEFAULT_MODULE_NAME = "main";

    /** Default checkpoint reader threads */
    public static final int DEFAULT_CHECKPOINT_THREADS = 4;

    public ConversionOptions {
        Objects.requireNonNull(moduleName, "moduleName cannot be null");
        Objects.requireNonNull(ordering, "ordering cannot be null");
        if (moduleName.isBlank()) {
            throw new IllegalArgumentException("moduleName cannot be blank");
        }
        if (checkpointThreads < 1) {
            throw new IllegalArgumentException("checkpointThreads must be >= 1: " + checkpointThreads);
        }
    }

    /**
     * Lenient outputs, topological ordering, no input override.
     */
    public static ConversionOptions defaults() {
        return new ConversionOptions(DEFAULT_MODULE_NAME, null, false, OrderingPolicy.TOPOLOGICAL,
                DEFAULT_CHECKPOINT_THREADS);
    }

    public ConversionOptions withModuleName(String name) {
        return new ConversionOptions(name, primaryInput, strictOutputs, ordering, checkpointThreads);
    }

    public ConversionOptions withPrimaryInput(InputOverride override) {
        return new ConversionOptions(moduleName, override, strictOutputs, ordering, checkpointThreads);
    }

    public ConversionOptions withStrictOutputs(boolean strict) {
        return new ConversionOptions(moduleName, primaryInput, strict, ordering, checkpointThreads);
    }

    public ConversionOptions withOrdering(OrderingPolicy policy) {
        return new ConversionOptions(moduleName, primaryInput, strictOutputs, policy, checkpointThreads);
    }

    public ConversionOptions withCheckpointThreads(int threads) {
        return new ConversionOptions(moduleName, primaryInput, strictOutputs, ordering, threads);
    }
}
