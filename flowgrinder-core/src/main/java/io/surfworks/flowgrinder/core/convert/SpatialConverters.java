package io.surfworks.flowgrinder.core.convert;

import io.surfworks.flowgrinder.core.ConversionException;
import io.surfworks.flowgrinder.core.attr.Attribute.Int32ListAttr;
import io.surfworks.flowgrinder.core.attr.AttributeMap;
import io.surfworks.flowgrinder.core.checkpoint.ParameterStore;
import io.surfworks.flowgrinder.core.graph.OperandRole;
import io.surfworks.flowgrinder.core.padding.PadPair;
import io.surfworks.flowgrinder.core.padding.PaddingEngine;
import io.surfworks.flowgrinder.core.padding.PaddingMode;
import io.surfworks.flowgrinder.ir.Ops;
import io.surfworks.flowgrinder.ir.TensorIr.Expr;
import io.surfworks.flowgrinder.ir.TensorIr.TensorType;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static io.surfworks.flowgrinder.ir.TensorIr.TensorType.DYNAMIC;

/**
 * Convolution, pooling and upsampling over channels-first data.
 *
 * <p>With static spatial extents the padding is folded into the operator's
 * own padding attribute. With dynamic extents the data is padded by an
 * explicit {@code nn.pad} whose widths are computed at run time, and the
 * operator itself runs unpadded. Max pooling always pads explicitly, filling
 * with the element type's lowest value.
 */
final class SpatialConverters {

    private SpatialConverters() {}

    static void registerAll(ConverterRegistry.Builder b) {
        b.register("conv2d", SpatialConverters::conv2d);
        b.register("conv1d", SpatialConverters::conv1d);
        b.register("max_pool_2d", (in, a, p) -> maxPool(in, a, "nn.max_pool2d", 2));
        b.register("max_pool_1d", (in, a, p) -> maxPool(in, a, "nn.max_pool1d", 1));
        b.register("avg_pool_2d", SpatialConverters::avgPool2d);
        b.register("upsample_nearest_2d", SpatialConverters::upsample);
        b.register("upsample", SpatialConverters::upsample);
    }

    // ==================== Convolution ====================

    static List<Expr> conv2d(OperatorInputs inputs, AttributeMap attributes, ParameterStore parameters) {
        checkChannelsFirst(inputs, attributes);
        Expr data = inputs.data();
        Expr weight = inputs.require(OperandRole.WEIGHT);
        Expr out = convolve(data, weight, attributes,
                attributes.getInts("strides", List.of(1, 1)),
                attributes.getInts("dilation_rate", List.of(1, 1)));
        return List.of(addBias(inputs, out));
    }

    /**
     * 1-D convolution lifted to 2-D: a unit height axis is inserted into data
     * and kernel, then squeezed out of the result.
     */
    static List<Expr> conv1d(OperatorInputs inputs, AttributeMap attributes, ParameterStore parameters) {
        checkChannelsFirst(inputs, attributes);
        Expr data = inputs.data();
        Expr weight = inputs.require(OperandRole.WEIGHT);
        if (data.tensorType().rank() != 3 || weight.tensorType().rank() != 3) {
            throw new ConversionException(String.format("conv1d node '%s' needs NCW data and OIW kernel, got %s and %s",
                    inputs.nodeName(), data.tensorType().toIrString(), weight.tensorType().toIrString()));
        }
        List<Integer> strides = List.of(1, attributes.getInts("strides", List.of(1)).get(0));
        List<Integer> dilation = List.of(1, attributes.getInts("dilation_rate", List.of(1)).get(0));

        AttributeMap lifted = attributes;
        if (attributes.has("kernel_size")) {
            lifted = lifted.with("kernel_size", new Int32ListAttr(
                    List.of(1, attributes.getInts("kernel_size").get(0))));
        }
        // Each side lifts on its own; an absent side defaults to zero in customizedPads.
        for (String key : List.of("padding_before", "padding_after")) {
            if (attributes.has(key)) {
                lifted = lifted.with(key, new Int32ListAttr(List.of(0, attributes.getInts(key).get(0))));
            }
        }
        Expr out = convolve(Ops.expandDims(data, 2, 1), Ops.expandDims(weight, 2, 1),
                lifted, strides, dilation);
        return List.of(addBias(inputs, Ops.squeeze(out, List.of(2))));
    }

    private static Expr convolve(Expr data, Expr weight, AttributeMap attributes,
                                 List<Integer> strides, List<Integer> dilation) {
        TensorType in = data.tensorType();
        TensorType kernelType = weight.tensorType();
        List<Integer> kernel = attributes.getInts("kernel_size",
                List.of(kernelType.dim(2), kernelType.dim(3)));
        int groups = attributes.getInt("groups", 1);
        PaddingMode mode = PaddingMode.parse(attributes.getString("padding", "valid"));

        List<Integer> spatial = in.shape().subList(2, in.rank());
        List<Integer> padding;
        Expr padded = data;
        if (mode == PaddingMode.CUSTOMIZED) {
            padding = PaddingEngine.beforesThenAfters(customizedPads(attributes, 2));
        } else if (!spatial.contains(DYNAMIC)) {
            padding = PaddingEngine.beforesThenAfters(
                    PaddingEngine.explicitPads(spatial, kernel, strides, dilation, mode));
        } else {
            padded = PaddingEngine.autopad(data, strides, kernel, dilation, mode, 0.0);
            padding = ConverterSupport.repeat(0, 4);
        }
        return Ops.conv2d(padded, weight, strides, padding, dilation, groups);
    }

    private static Expr addBias(OperatorInputs inputs, Expr out) {
        Optional<Expr> bias = inputs.byRole(OperandRole.BIAS);
        if (bias.isEmpty()) {
            return out;
        }
        int rank = out.tensorType().rank();
        return Ops.add(out, ConverterSupport.placeOnAxis(bias.get(), 1, rank));
    }

    // ==================== Pooling ====================

    private static List<Expr> maxPool(OperatorInputs inputs, AttributeMap attributes, String op, int spatialRank) {
        checkChannelsFirst(inputs, attributes);
        Expr data = inputs.data();
        List<Integer> poolSize = poolSize(attributes, spatialRank);
        List<Integer> strides = attributes.getInts("strides", poolSize);
        PaddingMode mode = PaddingMode.parse(attributes.getString("padding", "valid"));
        boolean ceilMode = attributes.getBool("ceil_mode", false);

        List<Integer> padding = ConverterSupport.repeat(0, 2 * spatialRank);
        Expr padded = data;
        if (mode == PaddingMode.CUSTOMIZED) {
            padding = PaddingEngine.beforesThenAfters(customizedPads(attributes, spatialRank));
        } else {
            Number lowest = data.tensorType().elementType().lowest();
            padded = PaddingEngine.autopad(data, strides, poolSize,
                    ConverterSupport.repeat(1, spatialRank), mode, lowest);
        }
        return List.of(Ops.pool(op, padded, poolSize, strides, padding, ceilMode, false));
    }

    static List<Expr> avgPool2d(OperatorInputs inputs, AttributeMap attributes, ParameterStore parameters) {
        checkChannelsFirst(inputs, attributes);
        Expr data = inputs.data();
        TensorType in = data.tensorType();
        List<Integer> poolSize = poolSize(attributes, 2);
        List<Integer> strides = attributes.getInts("strides", poolSize);
        PaddingMode mode = PaddingMode.parse(attributes.getString("padding", "valid"));
        boolean ceilMode = attributes.getBool("ceil_mode", false);
        List<Integer> spatial = in.shape().subList(2, in.rank());

        List<Integer> padding;
        Expr padded = data;
        if (mode == PaddingMode.CUSTOMIZED) {
            padding = PaddingEngine.beforesThenAfters(customizedPads(attributes, 2));
        } else if (!spatial.contains(DYNAMIC)) {
            padding = PaddingEngine.beforesThenAfters(
                    PaddingEngine.explicitPads(spatial, poolSize, strides, List.of(1, 1), mode));
        } else {
            padded = PaddingEngine.autopad(data, strides, poolSize, List.of(1, 1), mode, 0.0);
            padding = ConverterSupport.repeat(0, 4);
        }
        return List.of(Ops.pool("nn.avg_pool2d", padded, poolSize, strides, padding, ceilMode, false));
    }

    private static List<Integer> poolSize(AttributeMap attributes, int spatialRank) {
        List<Integer> size = attributes.has("pool_size")
                ? attributes.getInts("pool_size")
                : attributes.getInts("kernel_size");
        if (size.size() != spatialRank) {
            throw new ConversionException("Pool window " + size + " needs " + spatialRank + " extents");
        }
        return size;
    }

    // ==================== Upsampling ====================

    static List<Expr> upsample(OperatorInputs inputs, AttributeMap attributes, ParameterStore parameters) {
        checkChannelsFirst(inputs, attributes);
        String interpolation = attributes.getString("interpolation", "nearest").toLowerCase(Locale.ROOT);
        String method = switch (interpolation) {
            case "nearest" -> "nearest_neighbor";
            case "bilinear" -> "bilinear";
            default -> throw new ConversionException("Unsupported interpolation '" + interpolation
                    + "' in node '" + inputs.nodeName() + "'");
        };
        double scaleH = attributes.getDouble("height_scale", 1.0);
        double scaleW = attributes.getDouble("width_scale", 1.0);
        return List.of(Ops.upsampling(inputs.data(), scaleH, scaleW, method,
                attributes.getBool("align_corners", false)));
    }

    // ==================== Helpers ====================

    private static List<PadPair> customizedPads(AttributeMap attributes, int spatialRank) {
        return PaddingEngine.customized(
                attributes.getInts("padding_before", ConverterSupport.repeat(0, spatialRank)),
                attributes.getInts("padding_after", ConverterSupport.repeat(0, spatialRank)),
                spatialRank);
    }

    private static void checkChannelsFirst(OperatorInputs inputs, AttributeMap attributes) {
        String format = attributes.getString("data_format", "channels_first");
        if (!format.equals("channels_first")) {
            throw new ConversionException(String.format("%s node '%s': data_format '%s' is not supported",
                    inputs.opType(), inputs.nodeName(), format));
        }
    }
}
