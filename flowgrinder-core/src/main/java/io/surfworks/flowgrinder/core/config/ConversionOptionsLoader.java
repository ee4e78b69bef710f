package io.surfworks.flowgrinder.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.surfworks.flowgrinder.ir.IrException;
import io.surfworks.flowgrinder.ir.TensorIr.ScalarType;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Loads and saves {@link ConversionOptions}.
 *
 * <p>Sources, in order of precedence:
 * <ol>
 *   <li>System properties ({@code flowgrinder.strictOutputs},
 *       {@code flowgrinder.ordering}, {@code flowgrinder.checkpointThreads})</li>
 *   <li>Options file, e.g.
 *   <pre>
 *   {
 *     "moduleName": "resnet18",
 *     "strictOutputs": false,
 *     "ordering": "topological",
 *     "checkpointThreads": 8,
 *     "input": {"name": "data", "shape": [1, 3, 224, 224], "dtype": "float32"}
 *   }
 *   </pre></li>
 *   <li>Defaults</li>
 * </ol>
 */
public final class ConversionOptionsLoader {

    private static final Logger LOG = Logger.getLogger(ConversionOptionsLoader.class.getName());

    private static final ObjectMapper JSON = new ObjectMapper();

    /** System property: fail on unmatched outputs */
    public static final String PROP_STRICT_OUTPUTS = "flowgrinder.strictOutputs";

    /** System property: operator ordering policy */
    public static final String PROP_ORDERING = "flowgrinder.ordering";

    /** System property: checkpoint reader threads */
    public static final String PROP_CHECKPOINT_THREADS = "flowgrinder.checkpointThreads";

    private ConversionOptionsLoader() {
    }

    /**
     * Defaults with system-property overrides applied.
     */
    public static ConversionOptions load() {
        return applySystemProperties(ConversionOptions.defaults(), System.getProperties());
    }

    /**
     * Loads options from a file, then applies system-property overrides.
     * A missing file yields the defaults.
     *
     * @throws IOException if the file exists but cannot be read or holds invalid values
     */
    public static ConversionOptions load(Path optionsFile) throws IOException {
        ConversionOptions options = ConversionOptions.defaults();
        if (Files.exists(optionsFile)) {
            options = loadFromFile(optionsFile, options);
        } else {
            LOG.fine(() -> "No options file at " + optionsFile + "; using defaults");
        }
        return applySystemProperties(options, System.getProperties());
    }

    /**
     * Writes options as JSON.
     */
    public static void save(ConversionOptions options, Path optionsFile) throws IOException {
        if (optionsFile.getParent() != null) {
            Files.createDirectories(optionsFile.getParent());
        }
        ObjectNode root = JSON.createObjectNode();
        root.put("moduleName", options.moduleName());
        root.put("strictOutputs", options.strictOutputs());
        root.put("ordering", options.ordering().name().toLowerCase(Locale.ROOT));
        root.put("checkpointThreads", options.checkpointThreads());

        InputOverride input = options.primaryInput();
        if (input != null) {
            ObjectNode node = root.putObject("input");
            if (input.name() != null) {
                node.put("name", input.name());
            }
            if (input.shape() != null) {
                ArrayNode shape = node.putArray("shape");
                input.shape().forEach(shape::add);
            }
            if (input.dtype() != null) {
                node.put("dtype", input.dtype().name());
            }
        }
        JSON.writerWithDefaultPrettyPrinter().writeValue(optionsFile.toFile(), root);
    }

    static ConversionOptions loadFromFile(Path optionsFile, ConversionOptions base) throws IOException {
        JsonNode root = JSON.readTree(optionsFile.toFile());
        if (root == null || !root.isObject()) {
            throw new IOException("Options file must hold a JSON object: " + optionsFile);
        }
        try {
            ConversionOptions options = base
                    .withModuleName(getStringOrDefault(root, "moduleName", base.moduleName()))
                    .withStrictOutputs(root.has("strictOutputs")
                            ? root.get("strictOutputs").asBoolean() : base.strictOutputs())
                    .withOrdering(root.has("ordering")
                            ? OrderingPolicy.parse(root.get("ordering").asText()) : base.ordering())
                    .withCheckpointThreads(root.has("checkpointThreads")
                            ? root.get("checkpointThreads").asInt() : base.checkpointThreads());

            if (root.has("input")) {
                options = options.withPrimaryInput(parseInput(root.get("input")));
            }
            return options;
        } catch (IllegalArgumentException | IrException e) {
            throw new IOException("Invalid options in " + optionsFile + ": " + e.getMessage(), e);
        }
    }

    static ConversionOptions applySystemProperties(ConversionOptions options, Properties props) {
        String strict = props.getProperty(PROP_STRICT_OUTPUTS);
        if (strict != null) {
            options = options.withStrictOutputs(Boolean.parseBoolean(strict.trim()));
        }
        String ordering = props.getProperty(PROP_ORDERING);
        if (ordering != null) {
            options = options.withOrdering(OrderingPolicy.parse(ordering));
        }
        String threads = props.getProperty(PROP_CHECKPOINT_THREADS);
        if (threads != null) {
            try {
                options = options.withCheckpointThreads(Integer.parseInt(threads.trim()));
            } catch (NumberFormatException e) {
                LOG.warning("Ignoring " + PROP_CHECKPOINT_THREADS + "=" + threads + ": not a number");
            }
        }
        return options;
    }

    private static InputOverride parseInput(JsonNode node) {
        String name = node.has("name") ? node.get("name").asText() : null;
        List<Integer> shape = null;
        if (node.has("shape")) {
            shape = new ArrayList<>();
            for (JsonNode dim : node.get("shape")) {
                shape.add(dim.asInt());
            }
        }
        ScalarType dtype = node.has("dtype") ? ScalarType.of(node.get("dtype").asText()) : null;
        return new InputOverride(name, shape, dtype);
    }

    private static String getStringOrDefault(JsonNode node, String field, String defaultValue) {
        if (node.has(field)) {
            return node.get(field).asText();
        }
        return defaultValue;
    }
}
