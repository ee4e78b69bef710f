package io.surfworks.flowgrinder.core.assemble;

import io.surfworks.flowgrinder.core.MalformedGraphException;
import io.surfworks.flowgrinder.core.config.OrderingPolicy;
import io.surfworks.flowgrinder.core.graph.RawNode.OperatorNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.surfworks.flowgrinder.core.TestGraphs.op;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("ConversionOrder")
class ConversionOrderTest {

    private static List<String> names(List<OperatorNode> nodes) {
        return nodes.stream().map(OperatorNode::name).toList();
    }

    @Test
    void orderedGraphKeepsDeclarationOrder() {
        List<OperatorNode> ops = List.of(
                op("a", "relu").in("x", "x/out").out().build(),
                op("b", "relu").in("x", "x/out").out().build(),
                op("c", "broadcast_add").in("x", "a/out_0").in("y", "b/out_0").out().build());
        assertEquals(List.of("a", "b", "c"), names(ConversionOrder.of(ops, OrderingPolicy.TOPOLOGICAL)));
    }

    @Test
    void producersMoveAheadOfConsumers() {
        List<OperatorNode> ops = List.of(
                op("c", "broadcast_add").in("x", "a/out_0").in("y", "b/out_0").out().build(),
                op("b", "relu").in("x", "a/out_0").out().build(),
                op("a", "relu").in("x", "x/out").out().build());
        assertEquals(List.of("a", "b", "c"), names(ConversionOrder.topological(ops)));
    }

    @Test
    void declarationPolicyDoesNotReorder() {
        List<OperatorNode> ops = List.of(
                op("b", "relu").in("x", "a/out_0").out().build(),
                op("a", "relu").in("x", "x/out").out().build());
        assertEquals(List.of("b", "a"), names(ConversionOrder.of(ops, OrderingPolicy.DECLARATION)));
    }

    @Test
    void cycleNamesTheStuckOperators() {
        List<OperatorNode> ops = List.of(
                op("free", "relu").in("x", "x/out").out().build(),
                op("p", "relu").in("x", "q/out_0").out().build(),
                op("q", "relu").in("x", "p/out_0").out().build());
        MalformedGraphException e = assertThrows(MalformedGraphException.class, () -> ConversionOrder.topological(ops));
        assertTrue(e.getMessage().contains("p, q"));
    }

    @Test
    void policyNamesParse() {
        assertEquals(OrderingPolicy.DECLARATION, OrderingPolicy.parse("declaration"));
        assertThrows(IllegalArgumentException.class, () -> OrderingPolicy.parse("random"));
    }
}
