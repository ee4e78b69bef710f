package io.surfworks.flowgrinder.core.convert;

import io.surfworks.flowgrinder.core.ConversionException;
import io.surfworks.flowgrinder.core.attr.Attribute;
import io.surfworks.flowgrinder.core.attr.AttributeMap;
import io.surfworks.flowgrinder.core.checkpoint.ParameterStore;
import io.surfworks.flowgrinder.core.graph.FlowDataType;
import io.surfworks.flowgrinder.ir.Ops;
import io.surfworks.flowgrinder.ir.TensorIr.Expr;
import io.surfworks.flowgrinder.ir.TensorIr.ScalarType;
import io.surfworks.flowgrinder.ir.TensorIr.TensorType;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static io.surfworks.flowgrinder.ir.TensorIr.TensorType.DYNAMIC;

/**
 * Shape rewrites and dtype changes.
 */
final class ShapeConverters {

    private ShapeConverters() {}

    static void registerAll(ConverterRegistry.Builder b) {
        b.register("reshape", ShapeConverters::reshape);
        b.register("flatten", ShapeConverters::flatten);
        b.register("split", ShapeConverters::split);
        b.register("slice", ShapeConverters::slice);
        b.register("concat", ShapeConverters::concat);
        b.register("expand", ShapeConverters::expand);
        b.register("expand_dims", ShapeConverters::expandDims);
        b.register("unsqueeze", ShapeConverters::expandDims);
        b.register("squeeze", ShapeConverters::squeeze);
        b.register("transpose", ShapeConverters::transpose);
        b.register("one_hot", ShapeConverters::oneHot);
        b.register("cast", ShapeConverters::cast);
    }

    static List<Expr> reshape(OperatorInputs inputs, AttributeMap attributes, ParameterStore parameters) {
        return List.of(Ops.reshape(inputs.data(), attributes.getInts("shape")));
    }

    /**
     * Collapses axes {@code start_dim..end_dim} (inclusive) into one.
     */
    static List<Expr> flatten(OperatorInputs inputs, AttributeMap attributes, ParameterStore parameters) {
        Expr x = inputs.data();
        TensorType type = x.tensorType();
        int rank = type.rank();
        if (rank == 0) {
            return List.of(Ops.reshape(x, List.of(1)));
        }
        int start = Ops.normalizeAxis("flatten", attributes.getInt("start_dim", 0), rank);
        int end = Ops.normalizeAxis("flatten", attributes.getInt("end_dim", -1), rank);
        if (end < start) {
            throw new ConversionException(String.format("flatten node '%s': end_dim %d precedes start_dim %d",
                    inputs.nodeName(), end, start));
        }

        List<Integer> target = new ArrayList<>();
        boolean inferred = false;
        for (int i = 0; i < start; i++) {
            target.add(0);
        }
        long collapsed = 1;
        for (int i = start; i <= end; i++) {
            if (type.dim(i) == DYNAMIC) {
                collapsed = DYNAMIC;
                break;
            }
            collapsed *= type.dim(i);
        }
        if (collapsed == DYNAMIC) {
            target.add(-1);
            inferred = true;
        } else {
            target.add((int) collapsed);
        }
        for (int i = end + 1; i < rank; i++) {
            int d = type.dim(i);
            if (d != DYNAMIC) {
                target.add(d);
            } else if (!inferred) {
                target.add(-1);
                inferred = true;
            } else {
                throw new ConversionException("flatten node '" + inputs.nodeName()
                        + "' has too many dynamic extents: " + type.toIrString());
            }
        }
        return List.of(Ops.reshape(x, target));
    }

    static List<Expr> split(OperatorInputs inputs, AttributeMap attributes, ParameterStore parameters) {
        Expr x = inputs.data();
        int axis = attributes.getInt("axis", 0);
        List<Integer> sections = attributes.getInts("sections");
        return ConverterSupport.unpack(Ops.split(x, sections, axis));
    }

    /**
     * Per-axis start/stop/step; axes beyond the lists are kept whole.
     */
    static List<Expr> slice(OperatorInputs inputs, AttributeMap attributes, ParameterStore parameters) {
        Expr x = inputs.data();
        List<Integer> start = attributes.getInts("start");
        List<Integer> stop = attributes.getInts("stop");
        List<Integer> step = attributes.getInts("step", ConverterSupport.repeat(1, start.size()));
        return List.of(Ops.stridedSlice(x, start, stop, step));
    }

    static List<Expr> concat(OperatorInputs inputs, AttributeMap attributes, ParameterStore parameters) {
        return List.of(Ops.concatenate(inputs.values(), attributes.getInt("axis", 0)));
    }

    /**
     * Broadcasts to {@code expand_shape}; {@code -1} keeps the input extent.
     */
    static List<Expr> expand(OperatorInputs inputs, AttributeMap attributes, ParameterStore parameters) {
        Expr x = inputs.data();
        TensorType type = x.tensorType();
        List<Integer> requested = attributes.getInts("expand_shape");
        int offset = requested.size() - type.rank();
        if (offset < 0) {
            throw new ConversionException(String.format("expand node '%s': shape %s has fewer axes than %s",
                    inputs.nodeName(), requested, type.toIrString()));
        }
        List<Integer> shape = new ArrayList<>(requested.size());
        for (int i = 0; i < requested.size(); i++) {
            int d = requested.get(i);
            shape.add(d == -1 && i >= offset ? type.dim(i - offset) : d);
        }
        return List.of(Ops.broadcastTo(x, shape));
    }

    static List<Expr> expandDims(OperatorInputs inputs, AttributeMap attributes, ParameterStore parameters) {
        return List.of(Ops.expandDims(inputs.data(), attributes.getInt("axis"), 1));
    }

    static List<Expr> squeeze(OperatorInputs inputs, AttributeMap attributes, ParameterStore parameters) {
        return List.of(Ops.squeeze(inputs.data(), attributes.getInts("axes", List.of())));
    }

    static List<Expr> transpose(OperatorInputs inputs, AttributeMap attributes, ParameterStore parameters) {
        return List.of(Ops.transpose(inputs.data(), attributes.getInts("perm", List.of())));
    }

    /**
     * One-hot encoding; float outputs use the floating on/off values, integer
     * outputs the integer ones.
     */
    static List<Expr> oneHot(OperatorInputs inputs, AttributeMap attributes, ParameterStore parameters) {
        Expr indices = inputs.data();
        int depth = Math.toIntExact(attributes.getLong("depth"));
        ScalarType dtype = dataType(attributes, "dtype").orElse(ScalarType.F32);
        Number on;
        Number off;
        if (dtype.isFloatingPoint()) {
            on = attributes.getDouble("floating_on_value", 1.0);
            off = attributes.getDouble("floating_off_value", 0.0);
        } else {
            on = attributes.has("integer_on_value") ? attributes.getLong("integer_on_value") : 1L;
            off = attributes.has("integer_off_value") ? attributes.getLong("integer_off_value") : 0L;
        }
        return List.of(Ops.oneHot(indices, ConverterSupport.scalar(on, dtype), ConverterSupport.scalar(off, dtype),
                depth, -1, dtype));
    }

    static List<Expr> cast(OperatorInputs inputs, AttributeMap attributes, ParameterStore parameters) {
        ScalarType dtype = dataType(attributes, "dtype").orElseThrow(() -> new ConversionException(
                "cast node '" + inputs.nodeName() + "' has no dtype"));
        return List.of(Ops.cast(inputs.data(), dtype));
    }

    /**
     * A dtype attribute given either as the framework's numeric code or as an IR type name.
     */
    static Optional<ScalarType> dataType(AttributeMap attributes, String name) {
        Optional<Attribute> attr = attributes.get(name);
        if (attr.isEmpty()) {
            return Optional.empty();
        }
        if (attr.get() instanceof Attribute.StringAttr s) {
            return Optional.of(ScalarType.of(s.value()));
        }
        try {
            return Optional.of(FlowDataType.fromCode(attributes.getInt(name)).scalarType());
        } catch (IllegalArgumentException e) {
            throw new ConversionException("Attribute '" + name + "': " + e.getMessage(), e);
        }
    }
}
