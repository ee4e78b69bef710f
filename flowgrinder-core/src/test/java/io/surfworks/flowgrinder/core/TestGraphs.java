package io.surfworks.flowgrinder.core;

import io.surfworks.flowgrinder.core.attr.RawAttribute;
import io.surfworks.flowgrinder.core.checkpoint.ParameterRecord;
import io.surfworks.flowgrinder.core.checkpoint.ParameterStore;
import io.surfworks.flowgrinder.core.checkpoint.TensorBuffer;
import io.surfworks.flowgrinder.core.graph.BlobPath;
import io.surfworks.flowgrinder.core.graph.OperandRole;
import io.surfworks.flowgrinder.core.graph.RawNode.InputNode;
import io.surfworks.flowgrinder.core.graph.RawNode.OperatorNode;
import io.surfworks.flowgrinder.core.graph.RawNode.OutputNode;
import io.surfworks.flowgrinder.core.graph.RawNode.ParameterNode;
import io.surfworks.flowgrinder.ir.TensorIr.ScalarType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builders for small hand-written graphs.
 */
public final class TestGraphs {

    private TestGraphs() {}

    public static List<Integer> dims(int... dims) {
        return Arrays.stream(dims).boxed().toList();
    }

    public static InputNode input(String name, int... dims) {
        return new InputNode(name, BlobPath.of(name + "/out"), dims(dims), ScalarType.F32, false);
    }

    public static InputNode primaryInput(String name, int... dims) {
        return new InputNode(name, BlobPath.of(name + "/out"), dims(dims), ScalarType.F32, true);
    }

    public static ParameterNode variable(String name, int... dims) {
        return new ParameterNode(name, BlobPath.of(name + "/out"), dims(dims), ScalarType.F32);
    }

    public static OutputNode output(String name, String path) {
        return new OutputNode(name, BlobPath.of(path));
    }

    public static OpBuilder op(String name, String opType) {
        return new OpBuilder(name, opType);
    }

    /**
     * A zero-filled float parameter stored at {@code <name>/out}.
     */
    public static ParameterRecord parameter(String name, int... dims) {
        return new ParameterRecord(name, BlobPath.of(name + "/out"), TensorBuffer.zeros(ScalarType.F32, dims(dims)));
    }

    public static ParameterStore parameters(ParameterRecord... records) {
        return ParameterStore.of(List.of(records));
    }

    public static final class OpBuilder {
        private final String name;
        private final String opType;
        private final Map<String, List<BlobPath>> inputs = new LinkedHashMap<>();
        private final Map<String, OperandRole> roles = new LinkedHashMap<>();
        private final Map<String, List<BlobPath>> outputs = new LinkedHashMap<>();
        private final Map<String, RawAttribute> attributes = new LinkedHashMap<>();

        private OpBuilder(String name, String opType) {
            this.name = name;
            this.opType = opType;
        }

        public OpBuilder in(String slot, String... paths) {
            inputs.put(slot, paths(paths));
            return this;
        }

        public OpBuilder in(String slot, OperandRole role, String... paths) {
            roles.put(slot, role);
            return in(slot, paths);
        }

        public OpBuilder out(String slot, String... paths) {
            outputs.put(slot, paths(paths));
            return this;
        }

        /**
         * Single output {@code <name>/out_0}.
         */
        public OpBuilder out() {
            return out("out", name + "/out_0");
        }

        public OpBuilder attr(String key, String tag, Object payload) {
            attributes.put(key, new RawAttribute(tag, payload));
            return this;
        }

        public OperatorNode build() {
            return new OperatorNode(name, opType, inputs, roles, outputs, attributes);
        }

        private static List<BlobPath> paths(String... paths) {
            List<BlobPath> list = new ArrayList<>();
            for (String p : paths) {
                list.add(BlobPath.of(p));
            }
            return list;
        }
    }
}
