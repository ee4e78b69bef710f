package io.surfworks.flowgrinder.core.convert;

import io.surfworks.flowgrinder.core.ConversionException;
import io.surfworks.flowgrinder.core.InvalidPaddingModeException;
import io.surfworks.flowgrinder.core.attr.Attribute;
import io.surfworks.flowgrinder.core.attr.AttributeMap;
import io.surfworks.flowgrinder.core.checkpoint.ParameterStore;
import io.surfworks.flowgrinder.core.convert.OperatorInputs.ResolvedInput;
import io.surfworks.flowgrinder.core.graph.OperandRole;
import io.surfworks.flowgrinder.ir.TensorIr.ArrayAttr;
import io.surfworks.flowgrinder.ir.TensorIr.BoolAttr;
import io.surfworks.flowgrinder.ir.TensorIr.Call;
import io.surfworks.flowgrinder.ir.TensorIr.Expr;
import io.surfworks.flowgrinder.ir.TensorIr.ScalarType;
import io.surfworks.flowgrinder.ir.TensorIr.TensorType;
import io.surfworks.flowgrinder.ir.TensorIr.TupleGetItem;
import io.surfworks.flowgrinder.ir.TensorIr.Var;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.surfworks.flowgrinder.ir.TensorIr.TensorType.DYNAMIC;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("Operator converters")
class ConvertersTest {

    private static Var var(String name, int... dims) {
        return new Var(name, TensorType.of(ScalarType.F32, dims));
    }

    private static ResolvedInput in(String slot, OperandRole role, Expr value) {
        return new ResolvedInput(slot, role, value);
    }

    private static ResolvedInput data(Expr value) {
        return in("in", OperandRole.DATA, value);
    }

    private static Map<String, Attribute> attrs(Object... keyValues) {
        Map<String, Attribute> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], (Attribute) keyValues[i + 1]);
        }
        return map;
    }

    private static Attribute ints(Integer... values) {
        return new Attribute.Int32ListAttr(List.of(values));
    }

    private static Attribute str(String value) {
        return new Attribute.StringAttr(value);
    }

    private static List<Expr> convert(String opType, int declared, Map<String, Attribute> attributes,
                                      ResolvedInput... inputs) {
        OperatorInputs operands = new OperatorInputs("node", opType, List.of(inputs), declared);
        return ConverterRegistry.standard().get(opType).orElseThrow()
                .convert(operands, new AttributeMap(attributes), ParameterStore.empty());
    }

    private static Call single(List<Expr> out) {
        assertEquals(1, out.size());
        return assertInstanceOf(Call.class, out.get(0));
    }

    private static List<Integer> intAttr(Call call, String name) {
        return ((ArrayAttr) call.attr(name)).asIntList();
    }

    @Nested
    @DisplayName("convolution")
    class Convolution {

        @Test
        void sameUpperFoldsPaddingIntoTheCall() {
            Call conv = single(convert("conv2d", 1,
                    attrs("padding", str("same_upper"), "kernel_size", ints(3, 3), "strides", ints(1, 1)),
                    data(var("x", 1, 3, 32, 32)), in("weight", OperandRole.WEIGHT, var("w", 16, 3, 3, 3))));

            assertEquals("nn.conv2d", conv.op());
            assertEquals(List.of(1, 1, 1, 1), intAttr(conv, "padding"));
            assertEquals(List.of(1, 16, 32, 32), conv.tensorType().shape());
        }

        @Test
        void sameLowerPutsOddPaddingBefore() {
            Call conv = single(convert("conv2d", 1,
                    attrs("padding", str("same_lower"), "strides", ints(2, 2)),
                    data(var("x", 1, 3, 32, 32)), in("weight", OperandRole.WEIGHT, var("w", 8, 3, 4, 4))));
            // total 2 per axis, even split
            assertEquals(List.of(1, 1, 1, 1), intAttr(conv, "padding"));
            assertEquals(List.of(1, 8, 16, 16), conv.tensorType().shape());
        }

        @Test
        void customizedPaddingComesFromBeforeAndAfter() {
            Call conv = single(convert("conv2d", 1,
                    attrs("padding", str("customized"),
                            "padding_before", ints(0, 1), "padding_after", ints(2, 3)),
                    data(var("x", 1, 3, 8, 8)), in("weight", OperandRole.WEIGHT, var("w", 4, 3, 3, 3))));
            assertEquals(List.of(0, 1, 2, 3), intAttr(conv, "padding"));
        }

        @Test
        void biasIsBroadcastOverChannels() {
            Call out = single(convert("conv2d", 1, attrs(),
                    data(var("x", 1, 3, 8, 8)),
                    in("weight", OperandRole.WEIGHT, var("w", 4, 3, 3, 3)),
                    in("bias", OperandRole.BIAS, var("b", 4))));
            assertEquals("add", out.op());
            assertEquals(List.of(1, 4, 6, 6), out.tensorType().shape());
        }

        @Test
        void dynamicExtentsPadExplicitly() {
            Call conv = single(convert("conv2d", 1, attrs("padding", str("same_upper")),
                    data(var("x", 1, 3, DYNAMIC, DYNAMIC)), in("weight", OperandRole.WEIGHT, var("w", 4, 3, 3, 3))));
            assertEquals(List.of(0, 0, 0, 0), intAttr(conv, "padding"));
            assertEquals("nn.pad", ((Call) conv.arg(0)).op());
        }

        @Test
        void conv1dLiftsToTwoDimensions() {
            Call out = single(convert("conv1d", 1, attrs("padding", str("same_upper"), "kernel_size", ints(3)),
                    data(var("x", 1, 4, 10)), in("weight", OperandRole.WEIGHT, var("w", 8, 4, 3))));
            assertEquals("squeeze", out.op());
            assertEquals(List.of(1, 8, 10), out.tensorType().shape());
        }

        @Test
        void conv1dWithOnlyPaddingBefore() {
            Call out = single(convert("conv1d", 1,
                    attrs("padding", str("customized"), "kernel_size", ints(3), "padding_before", ints(2)),
                    data(var("x", 1, 4, 10)), in("weight", OperandRole.WEIGHT, var("w", 8, 4, 3))));
            Call conv = assertInstanceOf(Call.class, out.arg(0));
            assertEquals(List.of(0, 2, 0, 0), intAttr(conv, "padding"));
            assertEquals(List.of(1, 8, 9), out.tensorType().shape());
        }

        @Test
        void conv1dWithOnlyPaddingAfter() {
            Call out = single(convert("conv1d", 1,
                    attrs("padding", str("customized"), "kernel_size", ints(3), "padding_after", ints(1)),
                    data(var("x", 1, 4, 10)), in("weight", OperandRole.WEIGHT, var("w", 8, 4, 3))));
            Call conv = assertInstanceOf(Call.class, out.arg(0));
            assertEquals(List.of(0, 0, 0, 1), intAttr(conv, "padding"));
            assertEquals(List.of(1, 8, 9), out.tensorType().shape());
        }

        @Test
        void invalidPaddingMode() {
            assertThrows(InvalidPaddingModeException.class, () -> convert("conv2d", 1,
                    attrs("padding", str("reflect")),
                    data(var("x", 1, 3, 8, 8)), in("weight", OperandRole.WEIGHT, var("w", 4, 3, 3, 3))));
        }

        @Test
        void channelsLastRejected() {
            assertThrows(ConversionException.class, () -> convert("conv2d", 1,
                    attrs("data_format", str("channels_last")),
                    data(var("x", 1, 8, 8, 3)), in("weight", OperandRole.WEIGHT, var("w", 4, 3, 3, 3))));
        }
    }

    @Nested
    @DisplayName("pooling")
    class Pooling {

        @Test
        void maxPoolPadsWithLowestValue() {
            Call pool = single(convert("max_pool_2d", 1,
                    attrs("padding", str("same_upper"), "pool_size", ints(3, 3), "strides", ints(2, 2)),
                    data(var("x", 1, 3, 7, 7))));
            assertEquals("nn.max_pool2d", pool.op());
            Call pad = assertInstanceOf(Call.class, pool.arg(0));
            assertEquals("nn.pad", pad.op());
            assertEquals(List.of(1, 3, 4, 4), pool.tensorType().shape());
        }

        @Test
        void avgPoolFoldsStaticPaddingWithoutCountingIt() {
            Call pool = single(convert("avg_pool_2d", 1,
                    attrs("padding", str("same_upper"), "pool_size", ints(2, 2), "strides", ints(2, 2)),
                    data(var("x", 1, 3, 7, 7))));
            assertEquals(List.of(0, 0, 1, 1), intAttr(pool, "padding"));
            assertEquals(new BoolAttr(false), pool.attr("count_include_pad"));
            assertEquals(List.of(1, 3, 4, 4), pool.tensorType().shape());
        }

        @Test
        void validMaxPool1d() {
            Call pool = single(convert("max_pool_1d", 1, attrs("pool_size", ints(2)), data(var("x", 1, 3, 8))));
            assertEquals(List.of(1, 3, 4), pool.tensorType().shape());
        }
    }

    @Nested
    @DisplayName("elementwise")
    class Elementwise {

        @Test
        void broadcastAddAlignsRanks() {
            Call add = single(convert("broadcast_add", 1, attrs(),
                    in("x", OperandRole.DATA, var("a", 2, 3, 4)), in("y", OperandRole.OPERAND, var("b", 4))));
            assertEquals(List.of(2, 3, 4), add.tensorType().shape());
        }

        @Test
        void dataOperandIsLeftHandSideWhateverTheSlotOrder() {
            Var x = var("x", 2, 3);
            Var y = var("y", 2, 3);
            Call sub = single(convert("broadcast_sub", 1, attrs(),
                    in("y", OperandRole.OPERAND, y), in("x", OperandRole.DATA, x)));
            assertEquals("subtract", sub.op());
            assertSame(x, sub.arg(0));
            assertSame(y, sub.arg(1));
        }

        @Test
        void biasAddTargetsAxis() {
            Call add = single(convert("bias_add", 1, attrs("axis", new Attribute.Int32Attr(1)),
                    in("a", OperandRole.DATA, var("x", 1, 4, 8, 8)), in("b", OperandRole.OPERAND, var("b", 4))));
            Call bias = assertInstanceOf(Call.class, add.arg(1));
            assertEquals(List.of(4, 1, 1), bias.tensorType().shape());
        }

        @Test
        void biasAddDeclaredBiasFirst() {
            Var x = var("x", 1, 4, 8, 8);
            Call add = single(convert("bias_add", 1, attrs("axis", new Attribute.Int32Attr(1)),
                    in("b", OperandRole.OPERAND, var("b", 4)), in("a", OperandRole.DATA, x)));
            assertSame(x, add.arg(0));
            assertEquals(List.of(1, 4, 8, 8), add.tensorType().shape());
            assertEquals(List.of(4, 1, 1), add.arg(1).tensorType().shape());
        }

        @Test
        void scalarMulUsesFloatOperand() {
            Call mul = single(convert("scalar_mul", 1,
                    attrs("has_float_operand", new Attribute.BoolAttr(true),
                            "float_operand", new Attribute.Float64Attr(2.0)),
                    data(var("x", 3))));
            assertEquals("multiply", mul.op());
        }

        @Test
        void binaryNeedsTwoOperands() {
            assertThrows(ConversionException.class,
                    () -> convert("broadcast_mul", 1, attrs(), data(var("x", 3))));
        }

        @Test
        void addNFoldsEveryOperand() {
            Call sum = single(convert("add_n", 1, attrs(),
                    in("in", OperandRole.DATA, var("a", 3)),
                    in("in", OperandRole.DATA, var("b", 3)),
                    in("in", OperandRole.DATA, var("c", 3))));
            assertEquals("add", sum.op());
            assertEquals("add", ((Call) sum.arg(0)).op());
        }
    }

    @Nested
    @DisplayName("normalization")
    class Normalization {

        @Test
        void batchNormTrimsToDeclaredOutputs() {
            List<Expr> out = convert("normalization", 1, attrs("epsilon", new Attribute.Float32Attr(1e-3f)),
                    data(var("x", 1, 4, 8, 8)),
                    in("moving_mean", OperandRole.MOVING_MEAN, var("mm", 4)),
                    in("moving_variance", OperandRole.MOVING_VARIANCE, var("mv", 4)));
            assertEquals(1, out.size());
            TupleGetItem y = assertInstanceOf(TupleGetItem.class, out.get(0));
            assertEquals(0, y.index());
            assertEquals(List.of(1, 4, 8, 8), y.tensorType().shape());
        }

        @Test
        void batchNormOperandsFollowRolesNotSlotOrder() {
            Var x = var("x", 1, 4, 8, 8);
            Var gamma = var("g", 4);
            Var beta = var("b", 4);
            Var mean = var("mm", 4);
            Var variance = var("mv", 4);
            List<Expr> out = convert("normalization", 1, attrs(),
                    in("moving_variance", OperandRole.MOVING_VARIANCE, variance),
                    in("beta", OperandRole.BETA, beta),
                    in("x", OperandRole.DATA, x),
                    in("moving_mean", OperandRole.MOVING_MEAN, mean),
                    in("gamma", OperandRole.GAMMA, gamma));
            TupleGetItem y = assertInstanceOf(TupleGetItem.class, out.get(0));
            Call bn = assertInstanceOf(Call.class, y.tuple());
            assertEquals("nn.batch_norm", bn.op());
            assertEquals(List.of(x, gamma, beta, mean, variance), bn.args());
        }

        @Test
        void batchNormNeedsMovingStatistics() {
            assertThrows(ConversionException.class, () -> convert("normalization", 1, attrs(),
                    data(var("x", 1, 4, 8, 8)), in("moving_mean", OperandRole.MOVING_MEAN, var("mm", 4))));
        }

        @Test
        void layerNormOnLastAxisProducesStatistics() {
            List<Expr> out = convert("layer_norm", 3,
                    attrs("begin_norm_axis", new Attribute.Int64Attr(-1),
                            "begin_params_axis", new Attribute.Int64Attr(-1)),
                    data(var("x", 2, 5, 16)),
                    in("gamma", OperandRole.GAMMA, var("g", 16)),
                    in("beta", OperandRole.BETA, var("b", 16)));
            assertEquals(3, out.size());
            assertEquals("nn.layer_norm", ((Call) out.get(0)).op());
            assertEquals(List.of(2, 5), out.get(1).tensorType().shape());
            assertEquals(List.of(2, 5), out.get(2).tensorType().shape());
        }
    }

    @Nested
    @DisplayName("shape rewrites")
    class Shapes {

        @Test
        void splitYieldsOneValuePerSection() {
            List<Expr> out = convert("split", 2, attrs("axis", new Attribute.Int32Attr(1), "sections", ints(2, 4)),
                    data(var("x", 4, 6)));
            assertEquals(2, out.size());
            assertEquals(List.of(4, 2), out.get(0).tensorType().shape());
            assertEquals(List.of(4, 4), out.get(1).tensorType().shape());
        }

        @Test
        void flattenCollapsesFromStartDim() {
            Call flat = single(convert("flatten", 1, attrs("start_dim", new Attribute.Int32Attr(1)),
                    data(var("x", 2, 3, 4, 5))));
            assertEquals(List.of(2, 60), flat.tensorType().shape());
        }

        @Test
        void concatAlongAxis() {
            Call cat = single(convert("concat", 1, attrs("axis", new Attribute.Int64Attr(1)),
                    in("in", OperandRole.DATA, var("a", 2, 3)), in("in", OperandRole.DATA, var("b", 2, 5))));
            assertEquals(List.of(2, 8), cat.tensorType().shape());
        }

        @Test
        void oneHotAppendsDepthAxis() {
            Var indices = new Var("idx", TensorType.of(ScalarType.I64, 5));
            Call hot = single(convert("one_hot", 1,
                    attrs("depth", new Attribute.Int64Attr(10), "dtype", str("float32")), data(indices)));
            assertEquals(List.of(5, 10), hot.tensorType().shape());
            assertEquals(ScalarType.F32, hot.tensorType().elementType());
        }

        @Test
        void castToNamedType() {
            Call cast = single(convert("cast", 1, attrs("dtype", str("int32")), data(var("x", 3))));
            assertEquals(ScalarType.I32, cast.tensorType().elementType());
        }
    }

    @Nested
    @DisplayName("dense and activations")
    class Dense {

        @Test
        void matmulTransposesWeightUnlessAsked() {
            Call dense = single(convert("matmul", 1, attrs(),
                    in("a", OperandRole.DATA, var("a", 2, 4)), in("b", OperandRole.OPERAND, var("b", 4, 3))));
            assertEquals("nn.dense", dense.op());
            assertEquals("transpose", ((Call) dense.arg(1)).op());
            assertEquals(List.of(2, 3), dense.tensorType().shape());
        }

        @Test
        void matmulPicksDataOperandByRole() {
            Var a = var("a", 2, 3);
            Call dense = single(convert("matmul", 1, attrs(),
                    in("b", OperandRole.OPERAND, var("b", 3, 5)), in("a", OperandRole.DATA, a)));
            assertSame(a, dense.arg(0));
            assertEquals(List.of(2, 5), dense.tensorType().shape());
        }

        @Test
        void matmulAddendFollowsB() {
            Call out = single(convert("matmul", 1, attrs(),
                    in("b", OperandRole.OPERAND, var("b", 3, 5)),
                    in("_add_to_output", OperandRole.OPERAND, var("c", 2, 5)),
                    in("a", OperandRole.DATA, var("a", 2, 3))));
            assertEquals("add", out.op());
            assertEquals("nn.dense", ((Call) out.arg(0)).op());
            assertEquals(List.of(2, 5), out.tensorType().shape());
        }

        @Test
        void matmulWithTransposedWeightAndAlpha() {
            Call out = single(convert("matmul", 1,
                    attrs("transpose_b", new Attribute.BoolAttr(true), "alpha", new Attribute.Float64Attr(0.5)),
                    in("a", OperandRole.DATA, var("a", 2, 4)), in("b", OperandRole.OPERAND, var("b", 3, 4))));
            assertEquals("multiply", out.op());
            assertEquals(List.of(2, 3), out.tensorType().shape());
        }

        @Test
        void dropoutKeepsDeclaredOutputsOnly() {
            assertEquals(1, convert("dropout", 1, attrs(), data(var("x", 2, 3))).size());
            assertEquals(2, convert("dropout", 2, attrs(), data(var("x", 2, 3))).size());
        }

        @Test
        void reductionDropsAxes() {
            Call sum = single(convert("reduce_sum", 1, attrs("axis", ints(1)), data(var("x", 2, 3, 4))));
            assertEquals(List.of(2, 4), sum.tensorType().shape());
        }

        @Test
        void softmaxDefaultsToLastAxis() {
            Call softmax = single(convert("softmax", 1, attrs(), data(var("x", 2, 10))));
            assertEquals("nn.softmax", softmax.op());
        }
    }

    @Test
    void convertedValuesAreIndependentOfInputListMutation() {
        List<ResolvedInput> list = new ArrayList<>(List.of(data(var("x", 2))));
        OperatorInputs inputs = new OperatorInputs("n", "identity", list, 1);
        list.clear();
        assertEquals(1, inputs.size());
    }
}
