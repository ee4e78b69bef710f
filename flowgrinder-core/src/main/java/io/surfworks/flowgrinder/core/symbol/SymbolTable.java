package io.surfworks.flowgrinder.core.symbol;

import io.surfworks.flowgrinder.core.DuplicateBindingException;
import io.surfworks.flowgrinder.core.UnboundReferenceException;
import io.surfworks.flowgrinder.core.checkpoint.ParameterRecord;
import io.surfworks.flowgrinder.core.checkpoint.ParameterStore;
import io.surfworks.flowgrinder.core.graph.BlobPath;
import io.surfworks.flowgrinder.core.graph.RawNode.OperatorNode;
import io.surfworks.flowgrinder.ir.TensorIr.Expr;
import io.surfworks.flowgrinder.ir.TensorIr.Var;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Binds storage paths to IR values for one conversion run.
 *
 * <p>Producers and consumers name the same tensor differently: a producer
 * writes {@code conv1/out_0}, a consumer reads it through its slot
 * {@code relu1-x}. The table reconciles the two by scanning every consumer
 * once up front, so a value is always named the way the first consumer (in
 * conversion order) refers to it. Local names are {@code <node>-<slot>}, with
 * an {@code _<i>} suffix for slots holding more than one path.
 *
 * <p>Checkpoint parameters are materialized lazily as variables the first time
 * a consumer reads them, so parameters nobody uses never reach the function
 * signature.
 *
 * <p>The table only grows: a bound path never changes value.
 */
public final class SymbolTable {

    private static final Logger LOG = Logger.getLogger(SymbolTable.class.getName());

    private final ParameterStore parameters;
    private final Map<BlobPath, String> expectedNames = new HashMap<>();
    private final Map<BlobPath, SymbolEntry> bindings = new LinkedHashMap<>();
    private final Map<Var, ParameterRecord> parameterVars = new LinkedHashMap<>();

    /**
     * @param operators  operator nodes in conversion order
     * @param parameters checkpoint parameters, indexed by path
     */
    public SymbolTable(List<OperatorNode> operators, ParameterStore parameters) {
        this.parameters = parameters;
        for (OperatorNode node : operators) {
            node.inputs().forEach((slot, paths) -> {
                for (int i = 0; i < paths.size(); i++) {
                    expectedNames.putIfAbsent(paths.get(i), localName(node.name(), slot, i, paths.size()));
                }
            });
        }
    }

    /**
     * The symbol name a slot's i-th path gets when nothing else names it.
     */
    public static String localName(String nodeName, String slot, int index, int pathCount) {
        String base = nodeName + "-" + slot;
        return pathCount > 1 ? base + "_" + index : base;
    }

    /**
     * Name the first consumer gives to {@code path}, if any operator reads it.
     */
    public Optional<String> expectedName(BlobPath path) {
        return Optional.ofNullable(expectedNames.get(path));
    }

    /**
     * Binds {@code path} to {@code value} under {@code name}.
     *
     * @return the entry now bound to the path
     * @throws DuplicateBindingException if the path is already bound to another name or value
     */
    public SymbolEntry bind(BlobPath path, String name, Expr value) {
        SymbolEntry existing = bindings.get(path);
        if (existing != null) {
            if (existing.name().equals(name) && existing.value().equals(value)) {
                return existing;
            }
            throw new DuplicateBindingException(path, existing.name(), name);
        }
        SymbolEntry entry = SymbolEntry.of(name, value);
        bindings.put(path, entry);
        return entry;
    }

    /**
     * Resolves every path of an input slot, in path order.
     *
     * @throws UnboundReferenceException if a path has no producer, input or parameter
     */
    public List<Expr> resolveInput(OperatorNode node, String slot) {
        List<BlobPath> paths = node.inputs().get(slot);
        if (paths == null) {
            throw new IllegalArgumentException("Node '" + node.name() + "' has no input slot '" + slot + "'");
        }
        List<Expr> values = new ArrayList<>(paths.size());
        for (BlobPath path : paths) {
            values.add(resolve(path, "Node '" + node.name() + "' slot '" + slot + "'"));
        }
        return values;
    }

    /**
     * Resolves a single path on behalf of {@code referrer}.
     */
    public Expr resolve(BlobPath path, String referrer) {
        SymbolEntry entry = bindings.get(path);
        if (entry != null) {
            return entry.value();
        }
        Optional<ParameterRecord> record = parameters.lookup(path);
        if (record.isPresent()) {
            return materialize(path, record.get()).value();
        }
        throw new UnboundReferenceException(path, referrer);
    }

    /**
     * Binds the node's declared output paths, slot order then path order, to the produced values.
     * The caller has already checked that the counts agree.
     */
    public void recordOutputs(OperatorNode node, List<Expr> produced) {
        int index = 0;
        for (Map.Entry<String, List<BlobPath>> slot : node.outputs().entrySet()) {
            List<BlobPath> paths = slot.getValue();
            for (int i = 0; i < paths.size(); i++) {
                BlobPath path = paths.get(i);
                String name = expectedNames.get(path);
                if (name == null) {
                    name = localName(node.name(), slot.getKey(), i, paths.size());
                    String unused = name;
                    LOG.fine(() -> "Output " + path + " of node " + node.name() + " has no consumer; bound as " + unused);
                }
                bind(path, name, produced.get(index++));
            }
        }
    }

    public Optional<SymbolEntry> lookup(BlobPath path) {
        return Optional.ofNullable(bindings.get(path));
    }

    public boolean isBound(BlobPath path) {
        return bindings.containsKey(path);
    }

    /**
     * Parameter variables materialized so far, in materialization order.
     */
    public Map<Var, ParameterRecord> parameterVariables() {
        return Collections.unmodifiableMap(parameterVars);
    }

    public Map<BlobPath, SymbolEntry> entries() {
        return Collections.unmodifiableMap(bindings);
    }

    private SymbolEntry materialize(BlobPath path, ParameterRecord record) {
        String name = expectedNames.getOrDefault(path, record.name());
        Var var = new Var(name, record.buffer().tensorType());
        parameterVars.put(var, record);
        LOG.fine(() -> "Materialized parameter " + record.name() + " as %" + var.name());
        return bind(path, name, var);
    }
}
