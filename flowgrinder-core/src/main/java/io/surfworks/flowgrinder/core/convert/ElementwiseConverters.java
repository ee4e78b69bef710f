package io.surfworks.flowgrinder.core.convert;

import io.surfworks.flowgrinder.core.ConversionException;
import io.surfworks.flowgrinder.core.attr.AttributeMap;
import io.surfworks.flowgrinder.core.checkpoint.ParameterStore;
import io.surfworks.flowgrinder.ir.Ops;
import io.surfworks.flowgrinder.ir.TensorIr.Expr;
import io.surfworks.flowgrinder.ir.TensorIr.TensorType;

import java.util.List;
import java.util.function.BinaryOperator;

/**
 * Elementwise and broadcasting arithmetic.
 *
 * <p>The data operand is the first on the left. A lower-rank operand gets
 * leading unit axes before the call; {@code bias_add} instead places its
 * vector on {@code axis}.
 */
final class ElementwiseConverters {

    private ElementwiseConverters() {}

    static void registerAll(ConverterRegistry.Builder b) {
        b.register("broadcast_add", binary(Ops::add));
        b.register("broadcast_sub", binary(Ops::subtract));
        b.register("broadcast_mul", binary(Ops::multiply));
        b.register("broadcast_div", binary(Ops::divide));
        b.register("pow", binary(Ops::power));
        b.register("add_n", ElementwiseConverters::addN);
        b.register("bias_add", ElementwiseConverters::biasAdd);
        b.register("scalar_add", scalar(Ops::add));
        b.register("scalar_mul", scalar(Ops::multiply));
    }

    private static OpConverter binary(BinaryOperator<Expr> op) {
        return (inputs, attributes, parameters) -> {
            Expr lhs = inputs.data();
            List<Expr> others = inputs.others();
            if (others.size() != 1) {
                throw new ConversionException(String.format("%s node '%s' needs 2 operands, has %d",
                        inputs.opType(), inputs.nodeName(), others.size() + 1));
            }
            Expr rhs = others.get(0);
            int rank = Math.max(lhs.tensorType().rank(), rhs.tensorType().rank());
            return List.of(op.apply(ConverterSupport.alignRank(lhs, rank), ConverterSupport.alignRank(rhs, rank)));
        };
    }

    static List<Expr> addN(OperatorInputs inputs, AttributeMap attributes, ParameterStore parameters) {
        List<Expr> values = inputs.values();
        if (values.isEmpty()) {
            throw new ConversionException("add_n node '" + inputs.nodeName() + "' has no operands");
        }
        Expr sum = values.get(0);
        for (int i = 1; i < values.size(); i++) {
            sum = Ops.add(sum, values.get(i));
        }
        return List.of(sum);
    }

    static List<Expr> biasAdd(OperatorInputs inputs, AttributeMap attributes, ParameterStore parameters) {
        Expr data = inputs.data();
        Expr bias = inputs.others().isEmpty() ? null : inputs.others().get(0);
        if (bias == null) {
            throw new ConversionException("bias_add node '" + inputs.nodeName() + "' has no bias operand");
        }
        TensorType type = data.tensorType();
        int axis = Ops.normalizeAxis("bias_add", attributes.getInt("axis", 1), type.rank());
        return List.of(Ops.add(data, ConverterSupport.placeOnAxis(bias, axis, type.rank())));
    }

    /**
     * Arithmetic with a scalar carried as an attribute rather than an operand.
     */
    private static OpConverter scalar(BinaryOperator<Expr> op) {
        return (inputs, attributes, parameters) -> {
            Expr x = inputs.data();
            Number operand = attributes.getBool("has_float_operand", false)
                    ? (Number) attributes.getDouble("float_operand")
                    : (Number) attributes.getLong("int_operand");
            return List.of(op.apply(x, ConverterSupport.scalar(operand, x.tensorType().elementType())));
        };
    }
}
