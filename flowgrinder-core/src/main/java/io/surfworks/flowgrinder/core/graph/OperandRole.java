package io.surfworks.flowgrinder.core.graph;

import java.util.Locale;

/**
 * Explicit role of an operator input slot.
 *
 * <p>Converters pick operands by role (data vs. weight vs. statistic), never
 * by looking at generated variable names.
 */
public enum OperandRole {
    DATA,
    OPERAND,
    WEIGHT,
    BIAS,
    GAMMA,
    BETA,
    MOVING_MEAN,
    MOVING_VARIANCE;

    /**
     * Default role for a slot of the operator schema, matched on the exact slot name.
     */
    public static OperandRole forSlot(String slot) {
        return switch (slot) {
            case "in", "x", "a", "input" -> DATA;
            case "weight", "filter" -> WEIGHT;
            case "bias" -> BIAS;
            case "gamma" -> GAMMA;
            case "beta" -> BETA;
            case "moving_mean" -> MOVING_MEAN;
            case "moving_variance" -> MOVING_VARIANCE;
            default -> OPERAND;
        };
    }

    public static OperandRole parse(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
