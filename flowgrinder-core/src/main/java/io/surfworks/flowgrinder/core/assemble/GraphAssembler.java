package io.surfworks.flowgrinder.core.assemble;

import io.surfworks.flowgrinder.core.ConversionException;
import io.surfworks.flowgrinder.core.MalformedGraphException;
import io.surfworks.flowgrinder.core.OutputCountMismatchException;
import io.surfworks.flowgrinder.core.UnboundReferenceException;
import io.surfworks.flowgrinder.core.UnsupportedOperatorException;
import io.surfworks.flowgrinder.core.attr.AttributeMap;
import io.surfworks.flowgrinder.core.attr.AttributeParser;
import io.surfworks.flowgrinder.core.checkpoint.ParameterRecord;
import io.surfworks.flowgrinder.core.checkpoint.ParameterStore;
import io.surfworks.flowgrinder.core.checkpoint.TensorBuffer;
import io.surfworks.flowgrinder.core.config.ConversionOptions;
import io.surfworks.flowgrinder.core.config.InputOverride;
import io.surfworks.flowgrinder.core.convert.ConverterRegistry;
import io.surfworks.flowgrinder.core.convert.OpConverter;
import io.surfworks.flowgrinder.core.convert.OperatorInputs;
import io.surfworks.flowgrinder.core.convert.OperatorInputs.ResolvedInput;
import io.surfworks.flowgrinder.core.graph.RawGraph;
import io.surfworks.flowgrinder.core.graph.RawNode.InputNode;
import io.surfworks.flowgrinder.core.graph.RawNode.OperatorNode;
import io.surfworks.flowgrinder.core.graph.RawNode.OutputNode;
import io.surfworks.flowgrinder.core.graph.RawNode.ParameterNode;
import io.surfworks.flowgrinder.core.symbol.SymbolTable;
import io.surfworks.flowgrinder.ir.FreeVariables;
import io.surfworks.flowgrinder.ir.TensorIr.Expr;
import io.surfworks.flowgrinder.ir.TensorIr.Function;
import io.surfworks.flowgrinder.ir.TensorIr.Module;
import io.surfworks.flowgrinder.ir.TensorIr.TensorType;
import io.surfworks.flowgrinder.ir.TensorIr.Tuple;
import io.surfworks.flowgrinder.ir.TensorIr.TupleGetItem;
import io.surfworks.flowgrinder.ir.TensorIr.TupleType;
import io.surfworks.flowgrinder.ir.TensorIr.Var;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Builds the IR function for a decoded graph.
 *
 * <p>Stages run strictly in order:
 * <ol>
 *   <li>CollectDeclaredInputs: order the operators, bind every graph input to a variable</li>
 *   <li>ValidateOperatorCoverage: reject the graph if any operator type is unsupported</li>
 *   <li>ConvertOperators: convert each operator and bind its outputs</li>
 *   <li>CollectGraphOutputs: gather the returned values</li>
 *   <li>ComputeFreeVariables: check the body only uses inputs and parameters</li>
 *   <li>OrderInputsAndBuildFunction: fix the signature, primary input first</li>
 * </ol>
 *
 * <p>A run holds all of its state in a fresh {@link Run}, so one assembler
 * can convert many graphs.
 */
public final class GraphAssembler {

    private static final Logger LOG = Logger.getLogger(GraphAssembler.class.getName());

    private final ConverterRegistry registry;
    private final ConversionOptions options;

    public GraphAssembler(ConverterRegistry registry, ConversionOptions options) {
        this.registry = registry;
        this.options = options;
    }

    public GraphAssembler() {
        this(ConverterRegistry.standard(), ConversionOptions.defaults());
    }

    /**
     * Converts a graph.
     *
     * @param graph      decoded nodes
     * @param parameters trained parameters the graph's variables refer to
     * @return the IR module and the parameters its signature uses
     * @throws ConversionException on any failure; the message names the stage
     */
    public ConversionResult assemble(RawGraph graph, ParameterStore parameters) {
        return new Run(graph, parameters).execute();
    }

    /**
     * State of one conversion.
     */
    private final class Run {
        private final RawGraph graph;
        private final ParameterStore parameters;

        private ConversionStage stage;
        private SymbolTable symbols;
        private List<OperatorNode> order;
        private final List<Var> declaredInputs = new ArrayList<>();
        private final Set<Var> primaryInputs = new LinkedHashSet<>();
        private Expr body;
        private List<Var> freeVars;

        Run(RawGraph graph, ParameterStore parameters) {
            this.graph = graph;
            this.parameters = parameters;
        }

        ConversionResult execute() {
            try {
                enter(ConversionStage.COLLECT_DECLARED_INPUTS);
                collectDeclaredInputs();

                enter(ConversionStage.VALIDATE_OPERATOR_COVERAGE);
                validateOperatorCoverage();

                enter(ConversionStage.CONVERT_OPERATORS);
                convertOperators();

                enter(ConversionStage.COLLECT_GRAPH_OUTPUTS);
                collectGraphOutputs();

                enter(ConversionStage.COMPUTE_FREE_VARIABLES);
                computeFreeVariables();

                enter(ConversionStage.ORDER_INPUTS_AND_BUILD_FUNCTION);
                return orderInputsAndBuildFunction();
            } catch (ConversionException e) {
                throw e.inStage(stage.displayName());
            }
        }

        private void enter(ConversionStage next) {
            stage = next;
            LOG.info(() -> "[" + graph.name() + "] " + next.displayName());
        }

        // ==================== Stages ====================

        private void collectDeclaredInputs() {
            order = ConversionOrder.of(graph.operators(), options.ordering());
            symbols = new SymbolTable(order, parameters);

            List<InputNode> inputs = graph.inputs();
            InputNode overridden = overrideTarget(inputs);
            for (InputNode input : inputs) {
                Var var = input == overridden
                        ? overriddenVar(input, options.primaryInput())
                        : new Var(input.name(), input.tensorType());
                symbols.bind(input.outputPath(), var.name(), var);
                declaredInputs.add(var);
                if (input.primary()) {
                    primaryInputs.add(var);
                }
                LOG.fine(() -> "Input " + var);
            }

            for (ParameterNode variable : graph.parameters()) {
                if (!parameters.contains(variable.outputPath())) {
                    LOG.warning("Variable '" + variable.name() + "' has no checkpoint entry at "
                            + variable.outputPath());
                }
            }
            LOG.info(() -> String.format("%d inputs, %d parameters, %d operators",
                    declaredInputs.size(), parameters.size(), order.size()));
        }

        private void validateOperatorCoverage() {
            Set<String> opTypes = new LinkedHashSet<>();
            for (OperatorNode node : order) {
                opTypes.add(node.opType());
            }
            SortedSet<String> missing = registry.unsupported(opTypes);
            if (!missing.isEmpty()) {
                throw new UnsupportedOperatorException(missing);
            }
        }

        private void convertOperators() {
            for (OperatorNode node : order) {
                List<Expr> produced = convert(node);
                int declared = node.declaredOutputCount();
                if (produced.size() != declared) {
                    throw new OutputCountMismatchException(node.opType(), node.name(), declared, produced.size());
                }
                symbols.recordOutputs(node, produced);
                LOG.fine(() -> "Converted " + node.opType() + " node " + node.name());
            }
        }

        private List<Expr> convert(OperatorNode node) {
            try {
                List<ResolvedInput> resolved = new ArrayList<>();
                for (String slot : node.inputs().keySet()) {
                    for (Expr value : symbols.resolveInput(node, slot)) {
                        resolved.add(new ResolvedInput(slot, node.roleOf(slot), value));
                    }
                }
                OperatorInputs inputs = new OperatorInputs(node.name(), node.opType(), resolved,
                        node.declaredOutputCount());
                AttributeMap attributes = AttributeParser.parse(node.attributes());
                OpConverter converter = registry.get(node.opType())
                        .orElseThrow(() -> new UnsupportedOperatorException(
                                new TreeSet<>(List.of(node.opType()))));
                return unpackSingleTuple(converter.convert(inputs, attributes, parameters), node);
            } catch (ConversionException e) {
                if (e.getClass() != ConversionException.class) {
                    throw e;
                }
                throw wrap(node, e);
            } catch (RuntimeException e) {
                throw wrap(node, e);
            }
        }

        private List<Expr> unpackSingleTuple(List<Expr> produced, OperatorNode node) {
            if (produced.size() == 1 && produced.get(0).type() instanceof TupleType tuple
                    && tuple.size() == node.declaredOutputCount()) {
                List<Expr> fields = new ArrayList<>(tuple.size());
                for (int i = 0; i < tuple.size(); i++) {
                    fields.add(TupleGetItem.of(produced.get(0), i));
                }
                return fields;
            }
            return produced;
        }

        private void collectGraphOutputs() {
            List<Expr> values = new ArrayList<>();
            for (OutputNode output : graph.outputs()) {
                Optional<Expr> value = resolveOutput(output);
                if (value.isPresent()) {
                    values.add(value.get());
                } else if (options.strictOutputs()) {
                    throw new UnboundReferenceException(output.inputPath(), "Output '" + output.name() + "'");
                } else {
                    LOG.warning("Output '" + output.name() + "' reads " + output.inputPath()
                            + ", which nothing produces; dropping it");
                }
            }
            if (values.isEmpty()) {
                throw new MalformedGraphException("Graph '" + graph.name() + "' has no outputs");
            }
            body = values.size() == 1 ? values.get(0) : Tuple.of(values);
        }

        private Optional<Expr> resolveOutput(OutputNode output) {
            try {
                return Optional.of(symbols.resolve(output.inputPath(), "Output '" + output.name() + "'"));
            } catch (UnboundReferenceException e) {
                return Optional.empty();
            }
        }

        private void computeFreeVariables() {
            freeVars = FreeVariables.of(body);
            Set<Var> allowed = new LinkedHashSet<>(declaredInputs);
            allowed.addAll(symbols.parameterVariables().keySet());
            List<String> unknown = new ArrayList<>();
            for (Var var : freeVars) {
                if (!allowed.contains(var)) {
                    unknown.add(var.name());
                }
            }
            if (!unknown.isEmpty()) {
                throw new MalformedGraphException("Function body uses variables that are neither inputs "
                        + "nor parameters: " + String.join(", ", unknown));
            }
        }

        private ConversionResult orderInputsAndBuildFunction() {
            if (primaryInputs.size() > 1) {
                List<String> names = new ArrayList<>();
                primaryInputs.forEach(v -> names.add(v.name()));
                throw new MalformedGraphException("More than one primary input: " + String.join(", ", names));
            }

            List<Var> params = new ArrayList<>(freeVars);
            for (Var input : declaredInputs) {
                if (!params.contains(input)) {
                    LOG.fine(() -> "Input " + input.name() + " is never read; keeping it in the signature");
                    params.add(input);
                }
            }
            if (!primaryInputs.isEmpty()) {
                Var primary = primaryInputs.iterator().next();
                params.remove(primary);
                params.add(0, primary);
            }

            Map<Var, ParameterRecord> materialized = symbols.parameterVariables();
            Map<String, TensorBuffer> buffers = new LinkedHashMap<>();
            for (Var param : params) {
                ParameterRecord record = materialized.get(param);
                if (record != null) {
                    buffers.put(param.name(), record.buffer());
                }
            }

            Module module = new Module(options.moduleName(), new Function(params, body));
            LOG.info(() -> String.format("[%s] Built function with %d parameters (%d checkpoint tensors)",
                    graph.name(), params.size(), buffers.size()));
            return new ConversionResult(module, buffers);
        }

        // ==================== Helpers ====================

        /**
         * The input the user override applies to: the primary one, else the
         * one the override names, else the first.
         */
        private InputNode overrideTarget(List<InputNode> inputs) {
            InputOverride override = options.primaryInput();
            if (override == null || inputs.isEmpty()) {
                return null;
            }
            for (InputNode input : inputs) {
                if (input.primary()) {
                    return input;
                }
            }
            for (InputNode input : inputs) {
                if (input.name().equals(override.name())) {
                    return input;
                }
            }
            return inputs.get(0);
        }

        private Var overriddenVar(InputNode input, InputOverride override) {
            String name = override.name() != null ? override.name() : input.name();
            List<Integer> shape = override.shape() != null ? override.shape() : input.shape();
            TensorType type = new TensorType(shape,
                    override.dtype() != null ? override.dtype() : input.dtype());
            LOG.info(() -> "Overriding input " + input.name() + " as %" + name + ": " + type.toIrString());
            return new Var(name, type);
        }

        private ConversionException wrap(OperatorNode node, RuntimeException e) {
            return new ConversionException(String.format("Failed to convert %s node '%s': %s",
                    node.opType(), node.name(), e.getMessage()), e);
        }
    }
}
