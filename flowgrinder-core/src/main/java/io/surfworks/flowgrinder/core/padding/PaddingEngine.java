package io.surfworks.flowgrinder.core.padding;

import io.surfworks.flowgrinder.core.ConversionException;
import io.surfworks.flowgrinder.ir.Ops;
import io.surfworks.flowgrinder.ir.TensorIr.Constant;
import io.surfworks.flowgrinder.ir.TensorIr.Expr;
import io.surfworks.flowgrinder.ir.TensorIr.ScalarType;
import io.surfworks.flowgrinder.ir.TensorIr.TensorType;

import java.util.ArrayList;
import java.util.List;

import static io.surfworks.flowgrinder.ir.TensorIr.TensorType.DYNAMIC;

/**
 * Padding arithmetic for convolution and pooling.
 *
 * <p>For "same" padding the total is {@code max(k - s, 0)} when the input
 * divides the stride, else {@code max(k - input % s, 0)}. SAME_UPPER puts the
 * odd element after, SAME_LOWER before.
 *
 * <p>When the spatial extents are only known at run time, {@link #autopad}
 * computes the widths as an IR expression instead of folding them.
 */
public final class PaddingEngine {

    private PaddingEngine() {}

    /**
     * Padding of one axis.
     *
     * @param input  input extent, static
     * @param kernel effective (dilated) kernel extent
     * @param stride stride, positive
     */
    public static PadPair explicitPad(int input, int kernel, int stride, PaddingMode mode) {
        if (stride <= 0) {
            throw new ConversionException("Stride must be positive: " + stride);
        }
        if (input == DYNAMIC) {
            throw new ConversionException("Cannot fold padding for a dynamic extent");
        }
        return switch (mode) {
            case VALID -> PadPair.NONE;
            case SAME_UPPER, SAME_LOWER -> {
                int total = input % stride == 0
                        ? Math.max(kernel - stride, 0)
                        : Math.max(kernel - input % stride, 0);
                int before = total / 2;
                PadPair pair = new PadPair(before, total - before);
                yield mode == PaddingMode.SAME_LOWER ? pair.swap() : pair;
            }
            case CUSTOMIZED -> throw new ConversionException(
                    "Customized padding comes from padding_before/padding_after, not from shapes");
        };
    }

    public static int dilatedKernel(int kernel, int dilation) {
        return (kernel - 1) * dilation + 1;
    }

    /**
     * Per-axis padding for the spatial extents.
     */
    public static List<PadPair> explicitPads(List<Integer> spatialShape, List<Integer> kernel,
                                             List<Integer> strides, List<Integer> dilations, PaddingMode mode) {
        int n = spatialShape.size();
        if (kernel.size() != n || strides.size() != n || dilations.size() != n) {
            throw new ConversionException(String.format(
                    "Spatial rank %d disagrees with kernel %s, strides %s, dilations %s",
                    n, kernel, strides, dilations));
        }
        List<PadPair> pads = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            pads.add(explicitPad(spatialShape.get(i), dilatedKernel(kernel.get(i), dilations.get(i)),
                    strides.get(i), mode));
        }
        return pads;
    }

    /**
     * Flattens pairs as all befores followed by all afters, the IR's pool layout.
     * For 2-D this is (top, left, bottom, right), the conv layout.
     */
    public static List<Integer> beforesThenAfters(List<PadPair> pads) {
        List<Integer> flat = new ArrayList<>(pads.size() * 2);
        for (PadPair p : pads) {
            flat.add(p.before());
        }
        for (PadPair p : pads) {
            flat.add(p.after());
        }
        return flat;
    }

    /**
     * Pairs from explicit before/after lists, as given by a customized-padding node.
     */
    public static List<PadPair> customized(List<Integer> before, List<Integer> after, int spatialRank) {
        if (before.size() != spatialRank || after.size() != spatialRank) {
            throw new ConversionException(String.format(
                    "padding_before %s and padding_after %s need %d entries", before, after, spatialRank));
        }
        List<PadPair> pads = new ArrayList<>(spatialRank);
        for (int i = 0; i < spatialRank; i++) {
            pads.add(new PadPair(before.get(i), after.get(i)));
        }
        return pads;
    }

    /**
     * Pads NC + spatial data so a window with VALID padding yields "same" output.
     * N and C are never padded.
     *
     * @param padValue fill value, e.g. {@link ScalarType#lowest()} for max pooling
     * @return {@code data} itself for VALID, else an {@code nn.pad} call
     */
    public static Expr autopad(Expr data, List<Integer> strides, List<Integer> kernel,
                               List<Integer> dilations, PaddingMode mode, Number padValue) {
        if (mode == PaddingMode.VALID) {
            return data;
        }
        if (!mode.isSame()) {
            throw new ConversionException("autopad supports same_upper and same_lower, got " + mode);
        }
        TensorType type = data.tensorType();
        List<Integer> spatial = type.shape().subList(2, type.rank());
        if (!spatial.contains(DYNAMIC)) {
            List<List<Integer>> widths = new ArrayList<>();
            widths.add(List.of(0, 0));
            widths.add(List.of(0, 0));
            for (PadPair p : explicitPads(spatial, kernel, strides, dilations, mode)) {
                widths.add(List.of(p.before(), p.after()));
            }
            return Ops.pad(data, widths, padValue);
        }
        return Ops.dynamicPad(data, dynamicPadWidth(data, strides, kernel, dilations, mode), padValue, 2);
    }

    /**
     * {@code [rank, 2]} int64 pad widths computed from the run-time shape.
     */
    private static Expr dynamicPadWidth(Expr data, List<Integer> strides, List<Integer> kernel,
                                        List<Integer> dilations, PaddingMode mode) {
        int rank = data.tensorType().rank();
        int n = rank - 2;
        List<Long> stride = new ArrayList<>(n);
        List<Long> effective = new ArrayList<>(n);
        List<Long> divisible = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            long k = dilatedKernel(kernel.get(i), dilations.get(i));
            stride.add((long) strides.get(i));
            effective.add(k);
            divisible.add(Math.max(k - strides.get(i), 0));
        }
        Constant zero = Constant.scalar(0L, ScalarType.I64);

        Expr inShape = Ops.stridedSlice(Ops.shapeOf(data), List.of(2), List.of(rank), List.of(1));
        Expr remainder = Ops.mod(inShape, Constant.ofLongs(stride));
        Expr total = Ops.where(
                Ops.equal(remainder, zero),
                Constant.ofLongs(divisible),
                Ops.maximum(Ops.subtract(Constant.ofLongs(effective), remainder), zero));
        Expr half = Ops.floorDivide(total, Constant.scalar(2L, ScalarType.I64));
        Expr rest = Ops.subtract(total, half);
        Expr before = mode == PaddingMode.SAME_LOWER ? rest : half;
        Expr after = mode == PaddingMode.SAME_LOWER ? half : rest;

        Expr spatialPads = Ops.concatenate(
                List.of(Ops.expandDims(before, 1, 1), Ops.expandDims(after, 1, 1)), 1);
        Expr batchChannel = Constant.filled(0L, TensorType.of(ScalarType.I64, 2, 2));
        return Ops.concatenate(List.of(batchChannel, spatialPads), 0);
    }
}
