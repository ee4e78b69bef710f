package io.surfworks.flowgrinder.core.graph;

/**
 * Projects a node onto its role.
 */
public final class NodeClassifier {

    private NodeClassifier() {}

    public static NodeRole classify(RawNode node) {
        if (node instanceof RawNode.InputNode) {
            return NodeRole.INPUT;
        } else if (node instanceof RawNode.ParameterNode) {
            return NodeRole.PARAMETER;
        } else if (node instanceof RawNode.OperatorNode) {
            return NodeRole.OPERATOR;
        } else if (node instanceof RawNode.OutputNode) {
            return NodeRole.OUTPUT;
        }
        // unreachable: RawNode is sealed
        throw new IllegalStateException("Unknown node kind: " + node.getClass().getName());
    }

    public static boolean isInput(RawNode node) {
        return classify(node) == NodeRole.INPUT;
    }

    public static boolean isParameter(RawNode node) {
        return classify(node) == NodeRole.PARAMETER;
    }

    public static boolean isOperator(RawNode node) {
        return classify(node) == NodeRole.OPERATOR;
    }

    public static boolean isOutput(RawNode node) {
        return classify(node) == NodeRole.OUTPUT;
    }
}
