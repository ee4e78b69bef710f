package io.surfworks.flowgrinder.core.graph;

import io.surfworks.flowgrinder.core.attr.RawAttribute;
import io.surfworks.flowgrinder.ir.TensorIr.ScalarType;
import io.surfworks.flowgrinder.ir.TensorIr.TensorType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A decoded node of the exported graph.
 *
 * <p>One record per role; the role is the record type itself, so
 * classification is a type test rather than a string comparison.
 */
public sealed interface RawNode permits RawNode.InputNode, RawNode.ParameterNode,
        RawNode.OperatorNode, RawNode.OutputNode {

    String name();

    /**
     * Graph input fed at run time.
     *
     * @param outputPath path consumers use to reference this input
     * @param primary    whether this is the network's primary input
     */
    record InputNode(String name, BlobPath outputPath, List<Integer> shape, ScalarType dtype,
                     boolean primary) implements RawNode {
        public InputNode {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(outputPath, "outputPath");
            Objects.requireNonNull(dtype, "dtype");
            shape = List.copyOf(shape);
        }

        public TensorType tensorType() {
            return new TensorType(shape, dtype);
        }
    }

    /**
     * Variable declaration; its tensor comes from the checkpoint at {@code outputPath}.
     */
    record ParameterNode(String name, BlobPath outputPath, List<Integer> shape, ScalarType dtype)
            implements RawNode {
        public ParameterNode {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(outputPath, "outputPath");
            shape = List.copyOf(shape);
        }
    }

    /**
     * A user operator. Slot maps keep declaration order.
     *
     * @param inputs      input slot name to the paths it reads
     * @param inputRoles  input slot name to its operand role
     * @param outputs     output slot name to the paths it writes
     * @param attributes  raw tagged attributes
     */
    record OperatorNode(String name, String opType,
                        Map<String, List<BlobPath>> inputs,
                        Map<String, OperandRole> inputRoles,
                        Map<String, List<BlobPath>> outputs,
                        Map<String, RawAttribute> attributes) implements RawNode {
        public OperatorNode {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(opType, "opType");
            inputs = copySlots(inputs);
            outputs = copySlots(outputs);
            inputRoles = Collections.unmodifiableMap(new LinkedHashMap<>(inputRoles));
            attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        }

        /**
         * Role of an input slot: the explicit one when given, else the schema default.
         */
        public OperandRole roleOf(String slot) {
            OperandRole role = inputRoles.get(slot);
            return role != null ? role : OperandRole.forSlot(slot);
        }

        /**
         * Number of values this node declares it produces.
         */
        public int declaredOutputCount() {
            int count = 0;
            for (List<BlobPath> paths : outputs.values()) {
                count += paths.size();
            }
            return count;
        }

        /**
         * Every path this node reads, in slot order.
         */
        public List<BlobPath> inputPaths() {
            List<BlobPath> all = new ArrayList<>();
            inputs.values().forEach(all::addAll);
            return all;
        }

        /**
         * Every path this node writes, in slot order.
         */
        public List<BlobPath> outputPaths() {
            List<BlobPath> all = new ArrayList<>();
            outputs.values().forEach(all::addAll);
            return all;
        }

        private static Map<String, List<BlobPath>> copySlots(Map<String, List<BlobPath>> slots) {
            Map<String, List<BlobPath>> copy = new LinkedHashMap<>();
            slots.forEach((slot, paths) -> copy.put(slot, List.copyOf(paths)));
            return Collections.unmodifiableMap(copy);
        }
    }

    /**
     * Graph output returning the value stored at {@code inputPath}.
     */
    record OutputNode(String name, BlobPath inputPath) implements RawNode {
        public OutputNode {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(inputPath, "inputPath");
        }
    }
}
