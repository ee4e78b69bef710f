package io.surfworks.flowgrinder.core.convert;

import io.surfworks.flowgrinder.ir.Ops;
import io.surfworks.flowgrinder.ir.TensorIr.Constant;
import io.surfworks.flowgrinder.ir.TensorIr.Expr;
import io.surfworks.flowgrinder.ir.TensorIr.ScalarType;
import io.surfworks.flowgrinder.ir.TensorIr.TensorType;
import io.surfworks.flowgrinder.ir.TensorIr.TupleGetItem;
import io.surfworks.flowgrinder.ir.TensorIr.TupleType;

import java.util.ArrayList;
import java.util.List;

/**
 * Helpers shared by the converter families.
 */
final class ConverterSupport {

    private ConverterSupport() {}

    /**
     * Projects every field of a tuple-typed value; a tensor-typed value is returned alone.
     */
    static List<Expr> unpack(Expr value) {
        if (!(value.type() instanceof TupleType tuple)) {
            return List.of(value);
        }
        List<Expr> fields = new ArrayList<>(tuple.size());
        for (int i = 0; i < tuple.size(); i++) {
            fields.add(TupleGetItem.of(value, i));
        }
        return fields;
    }

    /**
     * The first {@code declared} values when the node declares fewer outputs than the
     * operator can produce (inference graphs often drop statistics and masks).
     */
    static List<Expr> leading(List<Expr> values, int declared) {
        if (declared >= 1 && declared < values.size()) {
            return List.copyOf(values.subList(0, declared));
        }
        return values;
    }

    /**
     * Prepends unit axes until {@code x} has {@code rank} axes.
     */
    static Expr alignRank(Expr x, int rank) {
        int missing = rank - x.tensorType().rank();
        return missing > 0 ? Ops.expandDims(x, 0, missing) : x;
    }

    /**
     * Places a rank-1 tensor on {@code axis} of a rank-{@code rank} tensor by
     * appending trailing unit axes.
     */
    static Expr placeOnAxis(Expr vector, int axis, int rank) {
        int trailing = rank - axis - 1;
        return trailing > 0 ? Ops.expandDims(vector, 1, trailing) : vector;
    }

    static Constant scalar(Number value, ScalarType dtype) {
        return Constant.scalar(dtype.isFloatingPoint() ? value.doubleValue() : value.longValue(), dtype);
    }

    static Constant filled(Number value, ScalarType dtype, int... dims) {
        return Constant.filled(dtype.isFloatingPoint() ? value.doubleValue() : value.longValue(),
                TensorType.of(dtype, dims));
    }

    static int spatialRank(Expr data) {
        return data.tensorType().rank() - 2;
    }

    static List<Integer> repeat(int value, int count) {
        List<Integer> values = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            values.add(value);
        }
        return values;
    }
}
