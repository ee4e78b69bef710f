package io.surfworks.flowgrinder.core.graph;

import io.surfworks.flowgrinder.core.graph.RawNode.InputNode;
import io.surfworks.flowgrinder.core.graph.RawNode.OperatorNode;
import io.surfworks.flowgrinder.core.graph.RawNode.OutputNode;
import io.surfworks.flowgrinder.core.graph.RawNode.ParameterNode;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The complete decoded graph: nodes in declaration order plus the blob
 * descriptors the exporter recorded.
 */
public record RawGraph(String name, List<RawNode> nodes, Map<BlobPath, BlobDesc> blobs) {

    public RawGraph {
        nodes = List.copyOf(nodes);
        blobs = Collections.unmodifiableMap(new LinkedHashMap<>(blobs));
        Set<String> names = new HashSet<>();
        for (RawNode node : nodes) {
            if (!names.add(node.name())) {
                throw new IllegalArgumentException("Duplicate node name: " + node.name());
            }
        }
    }

    public RawGraph(String name, List<RawNode> nodes) {
        this(name, nodes, Map.of());
    }

    public List<InputNode> inputs() {
        return ofRole(NodeRole.INPUT, InputNode.class);
    }

    public List<ParameterNode> parameters() {
        return ofRole(NodeRole.PARAMETER, ParameterNode.class);
    }

    public List<OperatorNode> operators() {
        return ofRole(NodeRole.OPERATOR, OperatorNode.class);
    }

    public List<OutputNode> outputs() {
        return ofRole(NodeRole.OUTPUT, OutputNode.class);
    }

    public Optional<RawNode> node(String nodeName) {
        return nodes.stream().filter(n -> n.name().equals(nodeName)).findFirst();
    }

    public Optional<BlobDesc> blob(BlobPath path) {
        return Optional.ofNullable(blobs.get(path));
    }

    private <T extends RawNode> List<T> ofRole(NodeRole role, Class<T> type) {
        return nodes.stream()
                .filter(n -> NodeClassifier.classify(n) == role)
                .map(type::cast)
                .toList();
    }
}
