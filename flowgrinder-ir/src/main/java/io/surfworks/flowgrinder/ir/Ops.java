package io.surfworks.flowgrinder.ir;

import io.surfworks.flowgrinder.ir.TensorIr.ArrayAttr;
import io.surfworks.flowgrinder.ir.TensorIr.Attr;
import io.surfworks.flowgrinder.ir.TensorIr.BoolAttr;
import io.surfworks.flowgrinder.ir.TensorIr.Call;
import io.surfworks.flowgrinder.ir.TensorIr.Constant;
import io.surfworks.flowgrinder.ir.TensorIr.Expr;
import io.surfworks.flowgrinder.ir.TensorIr.FloatAttr;
import io.surfworks.flowgrinder.ir.TensorIr.IntAttr;
import io.surfworks.flowgrinder.ir.TensorIr.ScalarType;
import io.surfworks.flowgrinder.ir.TensorIr.StringAttr;
import io.surfworks.flowgrinder.ir.TensorIr.TensorType;
import io.surfworks.flowgrinder.ir.TensorIr.Type;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.surfworks.flowgrinder.ir.TensorIr.TensorType.DYNAMIC;

/**
 * Typed builders for IR operator calls.
 *
 * Every builder checks its operands and computes the result type, so a call
 * never exists without a checked type. Layouts follow the IR conventions:
 * NCHW data, OIHW kernels, pads ordered as all "before" extents followed by
 * all "after" extents.
 */
public final class Ops {

    private Ops() {}

    // ==================== Generic ====================

    /**
     * Builds a shape-preserving call, used for identity pass-through operators.
     */
    public static Call call(String op, List<Expr> args, Map<String, Attr> attrs) {
        if (args.isEmpty()) {
            throw new IrException(op + " needs at least one operand");
        }
        return new Call(op, args, attrs, args.get(0).tensorType());
    }

    public static Call unary(String op, Expr x) {
        return new Call(op, List.of(x), Map.of(), x.tensorType());
    }

    public static Call exp(Expr x) {
        return unary("exp", x);
    }

    public static Call log(Expr x) {
        return unary("log", x);
    }

    public static Call rsqrt(Expr x) {
        return unary("rsqrt", x);
    }

    // ==================== Elementwise binary ====================

    public static Call add(Expr a, Expr b) {
        return binary("add", a, b);
    }

    public static Call subtract(Expr a, Expr b) {
        return binary("subtract", a, b);
    }

    public static Call multiply(Expr a, Expr b) {
        return binary("multiply", a, b);
    }

    public static Call divide(Expr a, Expr b) {
        return binary("divide", a, b);
    }

    public static Call power(Expr a, Expr b) {
        return binary("power", a, b);
    }

    public static Call maximum(Expr a, Expr b) {
        return binary("maximum", a, b);
    }

    public static Call mod(Expr a, Expr b) {
        return binary("mod", a, b);
    }

    public static Call floorDivide(Expr a, Expr b) {
        return binary("floor_divide", a, b);
    }

    public static Call equal(Expr a, Expr b) {
        TensorType type = broadcastType("equal", a, b);
        return new Call("equal", List.of(a, b), Map.of(), type.withElementType(ScalarType.BOOL));
    }

    public static Call where(Expr condition, Expr onTrue, Expr onFalse) {
        if (!condition.tensorType().elementType().equals(ScalarType.BOOL)) {
            throw new IrException("where condition must be bool, got " + condition.tensorType().toIrString());
        }
        TensorType branches = broadcastType("where", onTrue, onFalse);
        List<Integer> shape = broadcastShape("where", condition.tensorType().shape(), branches.shape());
        return new Call("where", List.of(condition, onTrue, onFalse), Map.of(), branches.withShape(shape));
    }

    private static Call binary(String op, Expr a, Expr b) {
        return new Call(op, List.of(a, b), Map.of(), broadcastType(op, a, b));
    }

    private static TensorType broadcastType(String op, Expr a, Expr b) {
        TensorType lhs = a.tensorType();
        TensorType rhs = b.tensorType();
        if (!lhs.elementType().equals(rhs.elementType())) {
            throw new IrException(String.format("%s operand element types must match: %s vs %s",
                    op, lhs.elementType(), rhs.elementType()));
        }
        return lhs.withShape(broadcastShape(op, lhs.shape(), rhs.shape()));
    }

    /**
     * Numpy-style broadcast of two shapes, aligned on trailing axes.
     */
    public static List<Integer> broadcastShape(String op, List<Integer> a, List<Integer> b) {
        int rank = Math.max(a.size(), b.size());
        List<Integer> result = new ArrayList<>(rank);
        for (int i = 0; i < rank; i++) {
            int ai = i - (rank - a.size());
            int bi = i - (rank - b.size());
            int da = ai >= 0 ? a.get(ai) : 1;
            int db = bi >= 0 ? b.get(bi) : 1;
            if (da == db) {
                result.add(da);
            } else if (da == 1) {
                result.add(db);
            } else if (db == 1) {
                result.add(da);
            } else if (da == DYNAMIC || db == DYNAMIC) {
                result.add(da == DYNAMIC ? db : da);
            } else {
                throw new IrException(String.format("%s shapes %s and %s are not broadcast compatible",
                        op, a, b));
            }
        }
        return result;
    }

    // ==================== Shape manipulation ====================

    public static Call expandDims(Expr x, int axis, int numNewAxis) {
        TensorType type = x.tensorType();
        int at = axis < 0 ? axis + type.rank() + 1 : axis;
        if (at < 0 || at > type.rank()) {
            throw new IrException("expand_dims axis " + axis + " out of range for rank " + type.rank());
        }
        List<Integer> shape = new ArrayList<>(type.shape());
        for (int i = 0; i < numNewAxis; i++) {
            shape.add(at, 1);
        }
        return new Call("expand_dims", List.of(x), attrs("axis", at, "num_newaxis", numNewAxis),
                type.withShape(shape));
    }

    /**
     * Reshape; {@code 0} copies the input extent and one {@code -1} is inferred.
     */
    public static Call reshape(Expr x, List<Integer> newShape) {
        TensorType type = x.tensorType();
        List<Integer> shape = new ArrayList<>(newShape.size());
        int inferIndex = -1;
        long known = 1;
        boolean dynamicKnown = false;
        for (int i = 0; i < newShape.size(); i++) {
            int d = newShape.get(i);
            if (d == -1) {
                if (inferIndex >= 0) {
                    throw new IrException("reshape allows only one inferred extent: " + newShape);
                }
                inferIndex = i;
            } else if (d == 0) {
                if (i >= type.rank()) {
                    throw new IrException("reshape cannot copy axis " + i + " of " + type.toIrString());
                }
                d = type.dim(i);
                if (d == DYNAMIC) {
                    dynamicKnown = true;
                } else {
                    known *= d;
                }
            } else if (d < -1) {
                throw new IrException("reshape extent " + d + " is invalid in " + newShape);
            } else {
                known *= d;
            }
            shape.add(d);
        }
        long total = type.elementCount();
        if (inferIndex >= 0) {
            if (total == DYNAMIC || dynamicKnown || known == 0) {
                shape.set(inferIndex, DYNAMIC);
            } else {
                if (total % known != 0) {
                    throw new IrException("reshape cannot infer extent: " + total + " elements into " + newShape);
                }
                shape.set(inferIndex, (int) (total / known));
            }
        } else if (total != DYNAMIC && total != known) {
            throw new IrException(String.format("reshape element count mismatch: %s has %d elements, %s has %d",
                    type.toIrString(), total, newShape, known));
        }
        return new Call("reshape", List.of(x), attrs("newshape", newShape), type.withShape(shape));
    }

    public static Call batchFlatten(Expr x) {
        TensorType type = x.tensorType();
        if (type.rank() < 1) {
            throw new IrException("batch_flatten needs rank >= 1, got " + type.toIrString());
        }
        long rest = 1;
        for (int i = 1; i < type.rank(); i++) {
            int d = type.dim(i);
            if (d == DYNAMIC) {
                rest = DYNAMIC;
                break;
            }
            rest *= d;
        }
        return new Call("nn.batch_flatten", List.of(x), Map.of(),
                type.withShape(List.of(type.dim(0), (int) rest)));
    }

    /**
     * Removes the given unit axes, or every unit axis when {@code axes} is empty.
     */
    public static Call squeeze(Expr x, List<Integer> axes) {
        TensorType type = x.tensorType();
        Set<Integer> drop = new HashSet<>();
        if (axes.isEmpty()) {
            for (int i = 0; i < type.rank(); i++) {
                if (type.dim(i) == 1) {
                    drop.add(i);
                }
            }
        } else {
            for (int axis : axes) {
                int a = normalizeAxis("squeeze", axis, type.rank());
                if (type.dim(a) != 1 && type.dim(a) != DYNAMIC) {
                    throw new IrException("squeeze axis " + axis + " has extent " + type.dim(a));
                }
                drop.add(a);
            }
        }
        List<Integer> shape = new ArrayList<>();
        for (int i = 0; i < type.rank(); i++) {
            if (!drop.contains(i)) {
                shape.add(type.dim(i));
            }
        }
        List<Integer> sortedAxes = drop.stream().sorted().toList();
        return new Call("squeeze", List.of(x), attrs("axis", sortedAxes), type.withShape(shape));
    }

    /**
     * Permutes axes; an empty permutation reverses them.
     */
    public static Call transpose(Expr x, List<Integer> perm) {
        TensorType type = x.tensorType();
        List<Integer> axes = new ArrayList<>();
        if (perm.isEmpty()) {
            for (int i = type.rank() - 1; i >= 0; i--) {
                axes.add(i);
            }
        } else {
            if (perm.size() != type.rank()) {
                throw new IrException(String.format("transpose permutation length %d doesn't match rank %d",
                        perm.size(), type.rank()));
            }
            Set<Integer> seen = new HashSet<>();
            for (int p : perm) {
                int a = normalizeAxis("transpose", p, type.rank());
                if (!seen.add(a)) {
                    throw new IrException("transpose permutation has duplicate axis " + p);
                }
                axes.add(a);
            }
        }
        List<Integer> shape = new ArrayList<>();
        for (int a : axes) {
            shape.add(type.dim(a));
        }
        return new Call("transpose", List.of(x), attrs("axes", axes), type.withShape(shape));
    }

    public static Call broadcastTo(Expr x, List<Integer> shape) {
        TensorType type = x.tensorType();
        List<Integer> result = broadcastShape("broadcast_to", type.shape(), shape);
        if (!result.equals(shape)) {
            throw new IrException("broadcast_to cannot expand " + type.toIrString() + " to " + shape);
        }
        return new Call("broadcast_to", List.of(x), attrs("shape", shape), type.withShape(result));
    }

    public static Call concatenate(List<Expr> xs, int axis) {
        if (xs.isEmpty()) {
            throw new IrException("concatenate needs at least one operand");
        }
        TensorType first = xs.get(0).tensorType();
        int a = normalizeAxis("concatenate", axis, first.rank());
        List<Integer> shape = new ArrayList<>(first.shape());
        int extent = 0;
        for (Expr x : xs) {
            TensorType t = x.tensorType();
            if (t.rank() != first.rank() || !t.elementType().equals(first.elementType())) {
                throw new IrException("concatenate operands disagree: " + first.toIrString() + " vs " + t.toIrString());
            }
            for (int i = 0; i < t.rank(); i++) {
                if (i != a && t.dim(i) != first.dim(i) && t.dim(i) != DYNAMIC && first.dim(i) != DYNAMIC) {
                    throw new IrException(String.format("concatenate operand extent %d differs on axis %d: %s vs %s",
                            t.dim(i), i, first.toIrString(), t.toIrString()));
                }
            }
            if (extent != DYNAMIC) {
                extent = t.dim(a) == DYNAMIC ? DYNAMIC : extent + t.dim(a);
            }
        }
        shape.set(a, extent);
        return new Call("concatenate", xs, attrs("axis", a), first.withShape(shape));
    }

    /**
     * Splits along {@code axis} into pieces of the given extents; the result is tuple typed.
     */
    public static Call split(Expr x, List<Integer> sections, int axis) {
        TensorType type = x.tensorType();
        int a = normalizeAxis("split", axis, type.rank());
        int total = 0;
        List<Type> fields = new ArrayList<>();
        List<Integer> indices = new ArrayList<>();
        for (int i = 0; i < sections.size(); i++) {
            int s = sections.get(i);
            if (s <= 0) {
                throw new IrException("split section extents must be positive: " + sections);
            }
            total += s;
            if (i < sections.size() - 1) {
                indices.add(total);
            }
            List<Integer> shape = new ArrayList<>(type.shape());
            shape.set(a, s);
            fields.add(type.withShape(shape));
        }
        if (type.dim(a) != DYNAMIC && total != type.dim(a)) {
            throw new IrException(String.format("split sections %s do not cover extent %d of axis %d",
                    sections, type.dim(a), a));
        }
        return new Call("split", List.of(x), attrs("indices_or_sections", indices, "axis", a),
                new TensorIr.TupleType(fields));
    }

    /**
     * Slices every axis with begin/end/step; ends are clamped to the extent.
     */
    public static Call stridedSlice(Expr x, List<Integer> begin, List<Integer> end, List<Integer> strides) {
        TensorType type = x.tensorType();
        if (begin.size() != end.size() || begin.size() != strides.size() || begin.size() > type.rank()) {
            throw new IrException(String.format("strided_slice begin %s, end %s, strides %s don't fit %s",
                    begin, end, strides, type.toIrString()));
        }
        List<Integer> shape = new ArrayList<>(type.shape());
        for (int i = 0; i < begin.size(); i++) {
            int dim = type.dim(i);
            int step = strides.get(i);
            if (step <= 0) {
                throw new IrException("strided_slice supports positive steps only: " + strides);
            }
            if (dim == DYNAMIC) {
                shape.set(i, DYNAMIC);
                continue;
            }
            int b = clamp(begin.get(i) < 0 ? begin.get(i) + dim : begin.get(i), dim);
            int e = clamp(end.get(i) < 0 ? end.get(i) + dim : end.get(i), dim);
            shape.set(i, e <= b ? 0 : (e - b + step - 1) / step);
        }
        return new Call("strided_slice", List.of(x),
                attrs("begin", begin, "end", end, "strides", strides), type.withShape(shape));
    }

    public static Call cast(Expr x, ScalarType dtype) {
        return new Call("cast", List.of(x), attrs("dtype", dtype.name()), x.tensorType().withElementType(dtype));
    }

    public static Call shapeOf(Expr x) {
        return new Call("shape_of", List.of(x), attrs("dtype", ScalarType.I64.name()),
                TensorType.of(ScalarType.I64, x.tensorType().rank()));
    }

    public static Call oneHot(Expr indices, Expr onValue, Expr offValue, int depth, int axis, ScalarType dtype) {
        TensorType type = indices.tensorType();
        if (!type.elementType().isInteger()) {
            throw new IrException("one_hot indices must be integers, got " + type.toIrString());
        }
        if (depth <= 0) {
            throw new IrException("one_hot depth must be positive: " + depth);
        }
        int a = axis < 0 ? axis + type.rank() + 1 : axis;
        List<Integer> shape = new ArrayList<>(type.shape());
        shape.add(a, depth);
        return new Call("one_hot", List.of(indices, onValue, offValue),
                attrs("depth", depth, "axis", a, "dtype", dtype.name()),
                new TensorType(shape, dtype));
    }

    // ==================== Padding ====================

    /**
     * Constant-width padding; {@code padWidth} holds one (before, after) pair per axis.
     */
    public static Call pad(Expr x, List<List<Integer>> padWidth, Number padValue) {
        TensorType type = x.tensorType();
        if (padWidth.size() != type.rank()) {
            throw new IrException(String.format("nn.pad needs %d pad pairs, got %d", type.rank(), padWidth.size()));
        }
        List<Integer> shape = new ArrayList<>();
        List<Attr> widths = new ArrayList<>();
        for (int i = 0; i < type.rank(); i++) {
            List<Integer> pair = padWidth.get(i);
            int d = type.dim(i);
            shape.add(d == DYNAMIC ? DYNAMIC : d + pair.get(0) + pair.get(1));
            widths.add(ArrayAttr.ofInts(pair));
        }
        Map<String, Attr> attrs = new LinkedHashMap<>();
        attrs.put("pad_width", new ArrayAttr(widths));
        attrs.put("pad_mode", new StringAttr("constant"));
        Constant value = Constant.scalar(padValue, type.elementType());
        return new Call("nn.pad", List.of(x, value), attrs, type.withShape(shape));
    }

    /**
     * Padding whose widths are computed at run time as a {@code [rank, 2]} int64 tensor.
     * The first {@code fixedAxes} axes keep their extent.
     */
    public static Call dynamicPad(Expr x, Expr padWidth, Number padValue, int fixedAxes) {
        TensorType type = x.tensorType();
        TensorType widthType = padWidth.tensorType();
        if (widthType.rank() != 2 || (widthType.dim(0) != DYNAMIC && widthType.dim(0) != type.rank())) {
            throw new IrException("nn.pad width tensor must be [" + type.rank() + ", 2], got " + widthType.toIrString());
        }
        List<Integer> shape = new ArrayList<>();
        for (int i = 0; i < type.rank(); i++) {
            shape.add(i < fixedAxes ? type.dim(i) : DYNAMIC);
        }
        Constant value = Constant.scalar(padValue, type.elementType());
        return new Call("nn.pad", List.of(x, padWidth, value), attrs("pad_mode", "constant"), type.withShape(shape));
    }

    // ==================== Neural network ====================

    /**
     * 2-D convolution over NCHW data with an OIHW kernel.
     *
     * @param padding four extents: top, left, bottom, right
     */
    public static Call conv2d(Expr data, Expr weight, List<Integer> strides, List<Integer> padding,
                              List<Integer> dilation, int groups) {
        TensorType in = data.tensorType();
        TensorType kernel = weight.tensorType();
        if (in.rank() != 4 || kernel.rank() != 4) {
            throw new IrException("nn.conv2d needs rank-4 data and kernel, got "
                    + in.toIrString() + " and " + kernel.toIrString());
        }
        checkLength("nn.conv2d strides", strides, 2);
        checkLength("nn.conv2d padding", padding, 4);
        checkLength("nn.conv2d dilation", dilation, 2);
        if (groups <= 0) {
            throw new IrException("nn.conv2d groups must be positive: " + groups);
        }
        int channels = in.dim(1);
        if (channels != DYNAMIC && kernel.dim(1) != DYNAMIC && channels != kernel.dim(1) * groups) {
            throw new IrException(String.format("nn.conv2d input channels %d don't match kernel %s with groups=%d",
                    channels, kernel.toIrString(), groups));
        }
        List<Integer> shape = new ArrayList<>();
        shape.add(in.dim(0));
        shape.add(kernel.dim(0));
        for (int i = 0; i < 2; i++) {
            int effective = kernel.dim(2 + i) == DYNAMIC ? DYNAMIC
                    : (kernel.dim(2 + i) - 1) * dilation.get(i) + 1;
            shape.add(windowOutput(in.dim(2 + i), effective, strides.get(i),
                    padding.get(i), padding.get(2 + i), false));
        }
        Map<String, Attr> attrs = attrs(
                "strides", strides,
                "padding", padding,
                "dilation", dilation,
                "groups", groups,
                "channels", kernel.dim(0),
                "kernel_size", List.of(kernel.dim(2), kernel.dim(3)),
                "data_layout", "NCHW",
                "kernel_layout", "OIHW");
        return new Call("nn.conv2d", List.of(data, weight), attrs, in.withShape(shape));
    }

    /**
     * Max or average pooling over NC + spatial axes.
     *
     * @param op        "nn.max_pool1d", "nn.max_pool2d", "nn.avg_pool2d", ...
     * @param padding   all "before" extents followed by all "after" extents
     */
    public static Call pool(String op, Expr data, List<Integer> poolSize, List<Integer> strides,
                            List<Integer> padding, boolean ceilMode, boolean countIncludePad) {
        TensorType in = data.tensorType();
        int spatial = poolSize.size();
        if (in.rank() != spatial + 2) {
            throw new IrException(String.format("%s with %d-D window needs rank %d data, got %s",
                    op, spatial, spatial + 2, in.toIrString()));
        }
        checkLength(op + " strides", strides, spatial);
        checkLength(op + " padding", padding, 2 * spatial);
        List<Integer> shape = new ArrayList<>();
        shape.add(in.dim(0));
        shape.add(in.dim(1));
        for (int i = 0; i < spatial; i++) {
            shape.add(windowOutput(in.dim(2 + i), poolSize.get(i), strides.get(i),
                    padding.get(i), padding.get(spatial + i), ceilMode));
        }
        Map<String, Attr> attrs = attrs(
                "pool_size", poolSize,
                "strides", strides,
                "padding", padding,
                "ceil_mode", ceilMode);
        if (op.contains("avg")) {
            attrs.put("count_include_pad", new BoolAttr(countIncludePad));
        }
        return new Call(op, List.of(data), attrs, in.withShape(shape));
    }

    public static Call upsampling(Expr data, double scaleH, double scaleW, String method, boolean alignCorners) {
        TensorType in = data.tensorType();
        if (in.rank() != 4) {
            throw new IrException("nn.upsampling needs NCHW data, got " + in.toIrString());
        }
        List<Integer> shape = new ArrayList<>(in.shape());
        shape.set(2, in.dim(2) == DYNAMIC ? DYNAMIC : (int) Math.floor(in.dim(2) * scaleH));
        shape.set(3, in.dim(3) == DYNAMIC ? DYNAMIC : (int) Math.floor(in.dim(3) * scaleW));
        Map<String, Attr> attrs = attrs(
                "scale_h", scaleH,
                "scale_w", scaleW,
                "layout", "NCHW",
                "method", method,
                "align_corners", alignCorners);
        return new Call("nn.upsampling", List.of(data), attrs, in.withShape(shape));
    }

    /**
     * Dense layer: data {@code (..., K)} times weight {@code (units, K)} transposed.
     */
    public static Call dense(Expr data, Expr weight) {
        TensorType in = data.tensorType();
        TensorType w = weight.tensorType();
        if (w.rank() != 2 || in.rank() < 1) {
            throw new IrException("nn.dense needs data of rank >= 1 and a rank-2 weight, got "
                    + in.toIrString() + " and " + w.toIrString());
        }
        int k = in.dim(in.rank() - 1);
        if (k != DYNAMIC && w.dim(1) != DYNAMIC && k != w.dim(1)) {
            throw new IrException(String.format("nn.dense reduction extent mismatch: %s vs %s",
                    in.toIrString(), w.toIrString()));
        }
        List<Integer> shape = new ArrayList<>(in.shape());
        shape.set(shape.size() - 1, w.dim(0));
        return new Call("nn.dense", List.of(data, weight), attrs("units", w.dim(0)), in.withShape(shape));
    }

    /**
     * Batch normalization; the result is the tuple (out, mean, variance).
     */
    public static Call batchNorm(Expr data, Expr gamma, Expr beta, Expr movingMean, Expr movingVar,
                                 int axis, double epsilon) {
        TensorType in = data.tensorType();
        int a = normalizeAxis("nn.batch_norm", axis, in.rank());
        for (Expr stat : List.of(gamma, beta, movingMean, movingVar)) {
            TensorType t = stat.tensorType();
            if (t.rank() != 1 || (t.dim(0) != in.dim(a) && t.dim(0) != DYNAMIC && in.dim(a) != DYNAMIC)) {
                throw new IrException(String.format("nn.batch_norm statistic %s doesn't match axis %d of %s",
                        t.toIrString(), a, in.toIrString()));
            }
        }
        TensorType stat = TensorType.of(in.elementType(), in.dim(a));
        return new Call("nn.batch_norm", List.of(data, gamma, beta, movingMean, movingVar),
                attrs("axis", a, "epsilon", epsilon, "center", true, "scale", true),
                new TensorIr.TupleType(List.of(in, stat, stat)));
    }

    public static Call layerNorm(Expr data, Expr gamma, Expr beta, int axis, double epsilon) {
        TensorType in = data.tensorType();
        int a = normalizeAxis("nn.layer_norm", axis, in.rank());
        return new Call("nn.layer_norm", List.of(data, gamma, beta),
                attrs("axis", a, "epsilon", epsilon, "center", true, "scale", true), in);
    }

    public static Call softmax(Expr x, int axis) {
        TensorType in = x.tensorType();
        return new Call("nn.softmax", List.of(x), attrs("axis", normalizeAxis("nn.softmax", axis, in.rank())), in);
    }

    public static Call logSoftmax(Expr x, int axis) {
        TensorType in = x.tensorType();
        return new Call("nn.log_softmax", List.of(x),
                attrs("axis", normalizeAxis("nn.log_softmax", axis, in.rank())), in);
    }

    /**
     * Dropout; the result is the tuple (out, mask).
     */
    public static Call dropout(Expr x, double rate) {
        TensorType in = x.tensorType();
        return new Call("nn.dropout", List.of(x), attrs("rate", rate), new TensorIr.TupleType(List.of(in, in)));
    }

    // ==================== Reductions ====================

    /**
     * Reduction over {@code axes}; an empty list reduces every axis.
     *
     * @param op one of "sum", "max", "min", "mean"
     */
    public static Call reduce(String op, Expr x, List<Integer> axes, boolean keepDims) {
        if (!Set.of("sum", "max", "min", "mean").contains(op)) {
            throw new IrException("Unknown reduction: " + op);
        }
        TensorType in = x.tensorType();
        Set<Integer> reduced = new HashSet<>();
        if (axes.isEmpty()) {
            for (int i = 0; i < in.rank(); i++) {
                reduced.add(i);
            }
        } else {
            for (int axis : axes) {
                reduced.add(normalizeAxis(op, axis, in.rank()));
            }
        }
        List<Integer> shape = new ArrayList<>();
        for (int i = 0; i < in.rank(); i++) {
            if (!reduced.contains(i)) {
                shape.add(in.dim(i));
            } else if (keepDims) {
                shape.add(1);
            }
        }
        List<Integer> sortedAxes = reduced.stream().sorted().toList();
        return new Call(op, List.of(x), attrs("axis", sortedAxes, "keepdims", keepDims), in.withShape(shape));
    }

    // ==================== Helpers ====================

    /**
     * Output extent of a sliding window, or {@link TensorType#DYNAMIC} when the input is dynamic.
     */
    public static int windowOutput(int input, int window, int stride, int padBefore, int padAfter,
                                   boolean ceilMode) {
        if (input == DYNAMIC || window == DYNAMIC) {
            return DYNAMIC;
        }
        if (stride <= 0) {
            throw new IrException("Window stride must be positive: " + stride);
        }
        int span = input + padBefore + padAfter - window;
        if (span < 0) {
            throw new IrException(String.format("Window %d exceeds padded extent %d",
                    window, input + padBefore + padAfter));
        }
        int steps = ceilMode ? (span + stride - 1) / stride : span / stride;
        return steps + 1;
    }

    public static int normalizeAxis(String op, int axis, int rank) {
        int a = axis < 0 ? axis + rank : axis;
        if (a < 0 || a >= rank) {
            throw new IrException(op + " axis " + axis + " out of range for rank " + rank);
        }
        return a;
    }

    private static int clamp(int value, int dim) {
        return Math.max(0, Math.min(value, dim));
    }

    private static void checkLength(String what, List<Integer> values, int expected) {
        if (values.size() != expected) {
            throw new IrException(what + " needs " + expected + " values, got " + values);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Attr> attrs(Object... keyValues) {
        Map<String, Attr> attrs = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            String key = (String) keyValues[i];
            Object value = keyValues[i + 1];
            Attr attr;
            if (value instanceof Attr a) {
                attr = a;
            } else if (value instanceof Integer || value instanceof Long) {
                attr = new IntAttr(((Number) value).longValue());
            } else if (value instanceof Double || value instanceof Float) {
                attr = new FloatAttr(((Number) value).doubleValue());
            } else if (value instanceof Boolean b) {
                attr = new BoolAttr(b);
            } else if (value instanceof String s) {
                attr = new StringAttr(s);
            } else if (value instanceof List<?> list) {
                attr = ArrayAttr.ofInts((List<Integer>) list);
            } else {
                throw new IrException("Unsupported attribute value for " + key + ": " + value);
            }
            attrs.put(key, attr);
        }
        return attrs;
    }
}
