package io.surfworks.flowgrinder.core.convert;

import io.surfworks.flowgrinder.core.ConversionException;
import io.surfworks.flowgrinder.core.attr.AttributeMap;
import io.surfworks.flowgrinder.core.checkpoint.ParameterStore;
import io.surfworks.flowgrinder.ir.Ops;
import io.surfworks.flowgrinder.ir.TensorIr.Expr;
import io.surfworks.flowgrinder.ir.TensorIr.ScalarType;

import java.util.List;

/**
 * Matrix multiply, softmax family, softplus, dropout and identity.
 */
final class ActivationConverters {

    private ActivationConverters() {}

    static void registerAll(ConverterRegistry.Builder b) {
        b.register("matmul", ActivationConverters::matmul);
        b.register("softmax", (in, a, p) -> List.of(Ops.softmax(in.data(), a.getInt("axis", -1))));
        b.register("log_softmax", (in, a, p) -> List.of(Ops.logSoftmax(in.data(), a.getInt("axis", -1))));
        b.register("softplus", ActivationConverters::softplus);
        b.register("dropout", ActivationConverters::dropout);
        b.register("identity", (in, a, p) -> List.of(in.data()));
    }

    /**
     * {@code alpha * op(a) . op(b) (+ addend)}, lowered to {@code nn.dense}, which
     * takes its weight as {@code (units, K)}: b is transposed unless
     * {@code transpose_b} already says it is laid out that way. The DATA operand
     * is a; the remaining operands are b and the optional addend, in slot order.
     */
    static List<Expr> matmul(OperatorInputs inputs, AttributeMap attributes, ParameterStore parameters) {
        if (inputs.size() < 2) {
            throw new ConversionException("matmul node '" + inputs.nodeName() + "' needs two operands");
        }
        Expr a = inputs.data();
        List<Expr> rest = inputs.others();
        Expr b = rest.get(0);
        if (b.tensorType().rank() != 2) {
            throw new ConversionException(String.format("matmul node '%s': b must be rank 2, got %s",
                    inputs.nodeName(), b.tensorType().toIrString()));
        }
        if (attributes.getBool("transpose_a", false)) {
            a = Ops.transpose(a, List.of());
        }
        if (!attributes.getBool("transpose_b", false)) {
            b = Ops.transpose(b, List.of(1, 0));
        }
        if (a.tensorType().rank() > 2) {
            a = Ops.batchFlatten(a);
        }
        Expr out = Ops.dense(a, b);

        double alpha = attributes.getDouble("alpha", 1.0);
        if (alpha != 1.0) {
            out = Ops.multiply(out, ConverterSupport.scalar(alpha, out.tensorType().elementType()));
        }
        if (rest.size() > 1) {
            out = Ops.add(out, rest.get(1));
        }
        return List.of(out);
    }

    /**
     * {@code log(exp(x) + 1)}.
     */
    static List<Expr> softplus(OperatorInputs inputs, AttributeMap attributes, ParameterStore parameters) {
        Expr x = inputs.data();
        ScalarType dtype = x.tensorType().elementType();
        return List.of(Ops.log(Ops.add(Ops.exp(x), ConverterSupport.scalar(1.0, dtype))));
    }

    /**
     * Produces out and mask; graphs that only declare out get out alone.
     */
    static List<Expr> dropout(OperatorInputs inputs, AttributeMap attributes, ParameterStore parameters) {
        double rate = attributes.getDouble("rate", 0.5);
        Expr dropout = Ops.dropout(inputs.data(), rate);
        return ConverterSupport.leading(ConverterSupport.unpack(dropout), inputs.declaredOutputs());
    }
}
