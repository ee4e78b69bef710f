package io.surfworks.flowgrinder.core;

import io.surfworks.flowgrinder.core.assemble.ConversionResult;
import io.surfworks.flowgrinder.core.assemble.GraphAssembler;
import io.surfworks.flowgrinder.core.checkpoint.CheckpointDirectory;
import io.surfworks.flowgrinder.core.checkpoint.ParameterStore;
import io.surfworks.flowgrinder.core.config.ConversionOptions;
import io.surfworks.flowgrinder.core.convert.ConverterRegistry;
import io.surfworks.flowgrinder.core.format.GraphJsonReader;
import io.surfworks.flowgrinder.core.graph.RawGraph;

import java.io.IOException;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Entry point: reads a graph description and a checkpoint snapshot from disk
 * and converts them into an IR module.
 *
 * <pre>{@code
 * ConversionResult result = FlowGrinder.convert(
 *         Path.of("model/graph.json"), Path.of("model/snapshot"),
 *         ConversionOptionsLoader.load(Path.of("flowgrinder.json")));
 * System.out.println(result.print());
 * }</pre>
 */
public final class FlowGrinder {

    private static final Logger LOG = Logger.getLogger(FlowGrinder.class.getName());

    private FlowGrinder() {
    }

    public static ConversionResult convert(Path graphFile, Path checkpointRoot) throws IOException {
        return convert(graphFile, checkpointRoot, ConversionOptions.defaults());
    }

    /**
     * @throws IOException         if either input cannot be read
     * @throws ConversionException if the graph cannot be converted
     */
    public static ConversionResult convert(Path graphFile, Path checkpointRoot, ConversionOptions options)
            throws IOException {
        RawGraph graph = GraphJsonReader.read(graphFile);
        ParameterStore parameters = CheckpointDirectory.load(checkpointRoot, options.checkpointThreads());
        LOG.info(() -> String.format("Converting %s with %d checkpoint parameters",
                graph.name(), parameters.size()));
        return new GraphAssembler(ConverterRegistry.standard(), options).assemble(graph, parameters);
    }
}
