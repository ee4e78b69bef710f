package io.surfworks.flowgrinder.core.graph;

/**
 * Role of a node within the exported graph.
 */
public enum NodeRole {
    INPUT,
    PARAMETER,
    OPERATOR,
    OUTPUT
}
