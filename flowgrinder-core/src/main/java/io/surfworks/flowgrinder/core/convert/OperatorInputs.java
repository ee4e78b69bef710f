package io.surfworks.flowgrinder.core.convert;

import io.surfworks.flowgrinder.core.ConversionException;
import io.surfworks.flowgrinder.core.graph.OperandRole;
import io.surfworks.flowgrinder.ir.TensorIr.Expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolved operands of one operator node.
 *
 * @param nodeName        the node being converted
 * @param opType          its operator type
 * @param inputs          one entry per input path, slot order then path order
 * @param declaredOutputs number of output paths the node declares
 */
public record OperatorInputs(String nodeName, String opType, List<ResolvedInput> inputs, int declaredOutputs) {

    /**
     * One resolved input path.
     */
    public record ResolvedInput(String slot, OperandRole role, Expr value) {}

    public OperatorInputs {
        inputs = List.copyOf(inputs);
    }

    public int size() {
        return inputs.size();
    }

    public Expr get(int index) {
        if (index >= inputs.size()) {
            throw new ConversionException(String.format("%s node '%s' needs at least %d inputs, has %d",
                    opType, nodeName, index + 1, inputs.size()));
        }
        return inputs.get(index).value();
    }

    public List<Expr> values() {
        List<Expr> values = new ArrayList<>(inputs.size());
        for (ResolvedInput input : inputs) {
            values.add(input.value());
        }
        return values;
    }

    /**
     * The data operand: the first input tagged DATA, else the first input.
     */
    public Expr data() {
        return byRole(OperandRole.DATA).orElseGet(() -> get(0));
    }

    /**
     * Every input except the data operand, in order.
     */
    public List<Expr> others() {
        Expr data = data();
        List<Expr> rest = new ArrayList<>();
        boolean skipped = false;
        for (ResolvedInput input : inputs) {
            if (!skipped && input.value() == data) {
                skipped = true;
                continue;
            }
            rest.add(input.value());
        }
        return rest;
    }

    public Optional<Expr> byRole(OperandRole role) {
        for (ResolvedInput input : inputs) {
            if (input.role() == role) {
                return Optional.of(input.value());
            }
        }
        return Optional.empty();
    }

    public Expr require(OperandRole role) {
        return byRole(role).orElseThrow(() -> new ConversionException(String.format(
                "%s node '%s' has no %s operand", opType, nodeName, role)));
    }

    /**
     * Every value of the named slot.
     */
    public List<Expr> slot(String slot) {
        List<Expr> values = new ArrayList<>();
        for (ResolvedInput input : inputs) {
            if (input.slot().equals(slot)) {
                values.add(input.value());
            }
        }
        return values;
    }
}
