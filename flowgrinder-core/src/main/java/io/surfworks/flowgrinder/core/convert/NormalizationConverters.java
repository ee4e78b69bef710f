package io.surfworks.flowgrinder.core.convert;

import io.surfworks.flowgrinder.core.ConversionException;
import io.surfworks.flowgrinder.core.attr.AttributeMap;
import io.surfworks.flowgrinder.core.checkpoint.ParameterStore;
import io.surfworks.flowgrinder.core.graph.OperandRole;
import io.surfworks.flowgrinder.ir.Ops;
import io.surfworks.flowgrinder.ir.TensorIr.Expr;
import io.surfworks.flowgrinder.ir.TensorIr.ScalarType;
import io.surfworks.flowgrinder.ir.TensorIr.TensorType;

import java.util.ArrayList;
import java.util.List;

import static io.surfworks.flowgrinder.ir.TensorIr.TensorType.DYNAMIC;

/**
 * Batch and layer normalization.
 */
final class NormalizationConverters {

    private NormalizationConverters() {}

    static void registerAll(ConverterRegistry.Builder b) {
        b.register("normalization", NormalizationConverters::batchNorm);
        b.register("layer_norm", NormalizationConverters::layerNorm);
    }

    /**
     * Inference-time batch norm. Operands are picked by role; a missing gamma
     * or beta becomes ones or zeros. The moving statistics are required.
     */
    static List<Expr> batchNorm(OperatorInputs inputs, AttributeMap attributes, ParameterStore parameters) {
        Expr data = inputs.data();
        TensorType in = data.tensorType();
        int axis = Ops.normalizeAxis("normalization", attributes.getInt("axis", 1), in.rank());
        double epsilon = attributes.getDouble("epsilon", 1e-5);

        Expr mean = inputs.require(OperandRole.MOVING_MEAN);
        Expr variance = inputs.require(OperandRole.MOVING_VARIANCE);
        int channels = channelsOf(in, axis, mean);
        ScalarType dtype = in.elementType();
        Expr gamma = inputs.byRole(OperandRole.GAMMA)
                .orElseGet(() -> ConverterSupport.filled(1.0, dtype, channels));
        Expr beta = inputs.byRole(OperandRole.BETA)
                .orElseGet(() -> ConverterSupport.filled(0.0, dtype, channels));

        Expr bn = Ops.batchNorm(data, gamma, beta, mean, variance, axis, epsilon);
        return ConverterSupport.leading(ConverterSupport.unpack(bn), inputs.declaredOutputs());
    }

    /**
     * Layer norm over axes {@code begin_norm_axis..}; gamma and beta cover
     * axes {@code begin_params_axis..}. Produces y, mean and inv_variance, the
     * statistics shaped like the leading, unnormalized axes.
     */
    static List<Expr> layerNorm(OperatorInputs inputs, AttributeMap attributes, ParameterStore parameters) {
        Expr x = inputs.data();
        TensorType in = x.tensorType();
        int rank = in.rank();
        int beginNorm = Ops.normalizeAxis("layer_norm", attributes.getInt("begin_norm_axis", 1), rank);
        int beginParams = Ops.normalizeAxis("layer_norm", attributes.getInt("begin_params_axis", -1), rank);
        double epsilon = attributes.getDouble("epsilon", 1e-5);
        ScalarType dtype = in.elementType();

        List<Integer> normAxes = new ArrayList<>();
        for (int i = beginNorm; i < rank; i++) {
            normAxes.add(i);
        }
        Expr eps = ConverterSupport.scalar(epsilon, dtype);

        Expr mean = Ops.reduce("mean", x, normAxes, true);
        Expr centered = Ops.subtract(x, mean);
        Expr variance = Ops.reduce("mean", Ops.multiply(centered, centered), normAxes, true);
        Expr invVariance = Ops.rsqrt(Ops.add(variance, eps));

        Expr y;
        boolean lastAxisOnly = beginNorm == rank - 1 && beginParams == rank - 1;
        if (lastAxisOnly && in.dim(rank - 1) != DYNAMIC) {
            int features = in.dim(rank - 1);
            Expr gamma = inputs.byRole(OperandRole.GAMMA)
                    .orElseGet(() -> ConverterSupport.filled(1.0, dtype, features));
            Expr beta = inputs.byRole(OperandRole.BETA)
                    .orElseGet(() -> ConverterSupport.filled(0.0, dtype, features));
            y = Ops.layerNorm(x, gamma, beta, -1, epsilon);
        } else {
            y = Ops.multiply(centered, invVariance);
            if (inputs.byRole(OperandRole.GAMMA).isPresent()) {
                y = Ops.multiply(y, inputs.require(OperandRole.GAMMA));
            }
            if (inputs.byRole(OperandRole.BETA).isPresent()) {
                y = Ops.add(y, inputs.require(OperandRole.BETA));
            }
        }

        List<Integer> statShape = new ArrayList<>(in.shape().subList(0, beginNorm));
        Expr meanOut = Ops.reshape(mean, statShape.isEmpty() ? List.of() : leadingShape(statShape));
        Expr invOut = Ops.reshape(invVariance, statShape.isEmpty() ? List.of() : leadingShape(statShape));
        return ConverterSupport.leading(List.of(y, meanOut, invOut), inputs.declaredOutputs());
    }

    /**
     * Reshape target for the statistics: static extents kept, a single dynamic
     * one inferred, further dynamic ones copied positionally.
     */
    private static List<Integer> leadingShape(List<Integer> shape) {
        List<Integer> target = new ArrayList<>(shape.size());
        boolean inferred = false;
        for (int d : shape) {
            if (d != DYNAMIC) {
                target.add(d);
            } else if (!inferred) {
                target.add(-1);
                inferred = true;
            } else {
                target.add(0);
            }
        }
        return target;
    }

    private static int channelsOf(TensorType in, int axis, Expr movingMean) {
        int channels = in.dim(axis);
        if (channels == DYNAMIC) {
            channels = movingMean.tensorType().dim(0);
        }
        if (channels == DYNAMIC) {
            throw new ConversionException("normalization needs a static channel extent on axis " + axis);
        }
        return channels;
    }
}
