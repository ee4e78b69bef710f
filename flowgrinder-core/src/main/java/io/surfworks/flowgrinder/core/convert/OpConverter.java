package io.surfworks.flowgrinder.core.convert;

import io.surfworks.flowgrinder.core.attr.AttributeMap;
import io.surfworks.flowgrinder.core.checkpoint.ParameterStore;
import io.surfworks.flowgrinder.ir.TensorIr.Expr;

import java.util.List;

/**
 * Converts one framework operator into IR values.
 * Converters are pure: everything they need arrives as arguments.
 */
@FunctionalInterface
public interface OpConverter {

    /**
     * Convert the operator.
     *
     * @param inputs     resolved operands, in slot order
     * @param attributes normalized attributes
     * @param parameters checkpoint parameters
     * @return one value per declared output path, in slot order
     */
    List<Expr> convert(OperatorInputs inputs, AttributeMap attributes, ParameterStore parameters);
}
