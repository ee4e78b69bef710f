package io.surfworks.flowgrinder.core.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.surfworks.flowgrinder.core.attr.RawAttribute;
import io.surfworks.flowgrinder.core.graph.BlobDesc;
import io.surfworks.flowgrinder.core.graph.BlobPath;
import io.surfworks.flowgrinder.core.graph.FlowDataType;
import io.surfworks.flowgrinder.core.graph.OperandRole;
import io.surfworks.flowgrinder.core.graph.RawGraph;
import io.surfworks.flowgrinder.core.graph.RawNode;
import io.surfworks.flowgrinder.ir.IrException;
import io.surfworks.flowgrinder.ir.TensorIr.ScalarType;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Reads a decoded job graph from JSON.
 *
 * <pre>
 * {
 *   "name": "lenet",
 *   "nodes": [
 *     {"name": "Input_0", "kind": "input", "out": "Input_0/out",
 *      "shape": [1, 1, 28, 28], "data_type": 2, "primary": true},
 *     {"name": "conv1-weight", "kind": "variable", "out": "conv1-weight/out",
 *      "shape": [6, 1, 5, 5], "data_type": 2},
 *     {"name": "conv1", "kind": "user", "op_type": "conv2d",
 *      "inputs": {"in": ["Input_0/out"], "weight": ["conv1-weight/out"]},
 *      "input_roles": {"weight": "weight"},
 *      "outputs": {"out": ["conv1/out_0"]},
 *      "attributes": {"padding": {"at_string": "same_upper"}}},
 *     {"name": "Return_0", "kind": "return", "in": "conv1/out_0"}
 *   ],
 *   "blobs": {"conv1/out_0": {"shape": [1, 6, 28, 28], "data_type": 2}}
 * }
 * </pre>
 *
 * <p>{@code data_type} is the framework's numeric code or an IR type name.
 * Attribute tags are kept verbatim.
 */
public final class GraphJsonReader {

    private static final Logger LOG = Logger.getLogger(GraphJsonReader.class.getName());

    private static final ObjectMapper JSON = new ObjectMapper();

    private GraphJsonReader() {
    }

    public static RawGraph read(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            String fallbackName = file.getFileName().toString().replaceFirst("\\.json$", "");
            return read(in, fallbackName);
        }
    }

    public static RawGraph read(InputStream in, String fallbackName) throws IOException {
        return parse(JSON.readTree(in), fallbackName);
    }

    public static RawGraph parse(String json) throws IOException {
        try {
            return parse(JSON.readTree(json), "graph");
        } catch (JsonProcessingException e) {
            throw new IOException("Malformed graph JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static RawGraph parse(JsonNode root, String fallbackName) throws IOException {
        if (root == null || !root.isObject()) {
            throw new IOException("Graph description must be a JSON object");
        }
        JsonNode nodesNode = root.get("nodes");
        if (nodesNode == null || !nodesNode.isArray()) {
            throw new IOException("Graph description needs a 'nodes' array");
        }
        String name = root.has("name") ? root.get("name").asText() : fallbackName;

        List<RawNode> nodes = new ArrayList<>();
        for (JsonNode node : nodesNode) {
            nodes.add(parseNode(node));
        }

        Map<BlobPath, BlobDesc> blobs = new LinkedHashMap<>();
        JsonNode blobsNode = root.get("blobs");
        if (blobsNode != null) {
            Iterator<Map.Entry<String, JsonNode>> fields = blobsNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode desc = field.getValue();
                blobs.put(BlobPath.of(field.getKey()),
                        new BlobDesc(shape(desc, field.getKey()), dataType(desc, field.getKey())));
            }
        }

        try {
            RawGraph graph = new RawGraph(name, nodes, blobs);
            LOG.fine(() -> String.format("Read graph %s: %d nodes, %d blob descriptors",
                    graph.name(), graph.nodes().size(), graph.blobs().size()));
            return graph;
        } catch (IllegalArgumentException e) {
            throw new IOException(e.getMessage(), e);
        }
    }

    private static RawNode parseNode(JsonNode node) throws IOException {
        String name = requireText(node, "name", "node");
        String kind = requireText(node, "kind", name);
        try {
            return switch (kind) {
                case "input" -> new RawNode.InputNode(name, path(node, "out", name),
                        shape(node, name), dataType(node, name),
                        node.path("primary").asBoolean(false));
                case "variable" -> new RawNode.ParameterNode(name, path(node, "out", name),
                        shape(node, name), dataType(node, name));
                case "user" -> new RawNode.OperatorNode(name, requireText(node, "op_type", name),
                        slots(node.get("inputs"), name), roles(node.get("input_roles")),
                        slots(node.get("outputs"), name), attributes(node.get("attributes")));
                case "return" -> new RawNode.OutputNode(name, path(node, "in", name));
                default -> throw new IOException("Node '" + name + "' has unknown kind '" + kind + "'");
            };
        } catch (IllegalArgumentException e) {
            throw new IOException("Node '" + name + "': " + e.getMessage(), e);
        }
    }

    private static Map<String, List<BlobPath>> slots(JsonNode node, String owner) throws IOException {
        Map<String, List<BlobPath>> slots = new LinkedHashMap<>();
        if (node == null) {
            return slots;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isArray()) {
                throw new IOException("Slot '" + field.getKey() + "' of node '" + owner + "' must be a path array");
            }
            List<BlobPath> paths = new ArrayList<>();
            for (JsonNode p : field.getValue()) {
                paths.add(BlobPath.of(p.asText()));
            }
            slots.put(field.getKey(), paths);
        }
        return slots;
    }

    private static Map<String, OperandRole> roles(JsonNode node) {
        Map<String, OperandRole> roles = new LinkedHashMap<>();
        if (node == null) {
            return roles;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            roles.put(field.getKey(), OperandRole.parse(field.getValue().asText()));
        }
        return roles;
    }

    private static Map<String, RawAttribute> attributes(JsonNode node) throws IOException {
        Map<String, RawAttribute> attributes = new LinkedHashMap<>();
        if (node == null) {
            return attributes;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode tagged = field.getValue();
            if (!tagged.isObject() || tagged.size() != 1) {
                throw new IOException("Attribute '" + field.getKey() + "' must be a single {\"<tag>\": value} entry");
            }
            Map.Entry<String, JsonNode> entry = tagged.fields().next();
            Object payload = JSON.treeToValue(entry.getValue(), Object.class);
            attributes.put(field.getKey(), new RawAttribute(entry.getKey(), payload));
        }
        return attributes;
    }

    private static BlobPath path(JsonNode node, String field, String owner) throws IOException {
        return BlobPath.of(requireText(node, field, owner));
    }

    private static List<Integer> shape(JsonNode node, String owner) throws IOException {
        JsonNode shape = node.get("shape");
        if (shape == null || !shape.isArray()) {
            throw new IOException("'" + owner + "' needs a 'shape' array");
        }
        List<Integer> dims = new ArrayList<>();
        for (JsonNode dim : shape) {
            dims.add(dim.asInt());
        }
        return dims;
    }

    private static ScalarType dataType(JsonNode node, String owner) throws IOException {
        JsonNode type = node.get("data_type");
        if (type == null) {
            throw new IOException("'" + owner + "' needs a 'data_type'");
        }
        try {
            return type.isNumber()
                    ? FlowDataType.fromCode(type.asInt()).scalarType()
                    : ScalarType.of(type.asText());
        } catch (IllegalArgumentException | IrException e) {
            throw new IOException("'" + owner + "': " + e.getMessage(), e);
        }
    }

    private static String requireText(JsonNode node, String field, String owner) throws IOException {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new IOException("'" + owner + "' needs a '" + field + "' string");
        }
        return value.asText();
    }
}
