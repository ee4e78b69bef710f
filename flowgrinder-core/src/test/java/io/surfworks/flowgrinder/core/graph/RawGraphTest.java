package io.surfworks.flowgrinder.core.graph;

import io.surfworks.flowgrinder.core.graph.RawNode.OperatorNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.surfworks.flowgrinder.core.TestGraphs.input;
import static io.surfworks.flowgrinder.core.TestGraphs.op;
import static io.surfworks.flowgrinder.core.TestGraphs.output;
import static io.surfworks.flowgrinder.core.TestGraphs.variable;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Raw graph model")
class RawGraphTest {

    @Nested
    @DisplayName("NodeClassifier")
    class Classification {

        @Test
        void everyKindHasItsRole() {
            assertEquals(NodeRole.INPUT, NodeClassifier.classify(input("Input_0", 1, 3)));
            assertEquals(NodeRole.PARAMETER, NodeClassifier.classify(variable("w", 3)));
            assertEquals(NodeRole.OPERATOR, NodeClassifier.classify(op("relu1", "relu").build()));
            assertEquals(NodeRole.OUTPUT, NodeClassifier.classify(output("Return_0", "relu1/out_0")));
            assertTrue(NodeClassifier.isOperator(op("relu1", "relu").build()));
        }

        @Test
        void graphSplitsNodesByRoleInDeclarationOrder() {
            RawGraph graph = new RawGraph("g", List.of(
                    input("Input_0", 1, 3),
                    variable("w", 3),
                    op("a", "relu").in("x", "Input_0/out").out().build(),
                    op("b", "relu").in("x", "a/out_0").out().build(),
                    output("Return_0", "b/out_0")));

            assertEquals(1, graph.inputs().size());
            assertEquals(1, graph.parameters().size());
            assertEquals(List.of("a", "b"), graph.operators().stream().map(OperatorNode::name).toList());
            assertEquals(1, graph.outputs().size());
            assertTrue(graph.node("b").isPresent());
        }

        @Test
        void duplicateNodeNamesRejected() {
            assertThrows(IllegalArgumentException.class, () -> new RawGraph("g", List.of(
                    input("x", 1), op("x", "relu").build())));
        }
    }

    @Nested
    @DisplayName("BlobPath")
    class Paths {

        @Test
        void spellingsNormalizeToOnePath() {
            assertEquals(BlobPath.of("conv1/out_0"), BlobPath.of("./conv1//out_0/"));
            assertEquals(BlobPath.of("conv1/out_0"), BlobPath.of("conv1\\out_0"));
        }

        @Test
        void opNameIsFirstSegment() {
            assertEquals("conv1", BlobPath.of("conv1/out_0").opName());
            assertEquals("Input_0", BlobPath.of("Input_0").opName());
        }

        @Test
        void emptyRejected() {
            assertThrows(IllegalArgumentException.class, () -> BlobPath.of("//"));
        }
    }

    @Nested
    @DisplayName("operand roles")
    class Roles {

        @Test
        void explicitRoleWinsOverSlotDefault() {
            OperatorNode node = op("n", "normalization")
                    .in("x", "a/out")
                    .in("moving_mean", "mm/out")
                    .in("stat", OperandRole.MOVING_VARIANCE, "mv/out")
                    .build();
            assertEquals(OperandRole.DATA, node.roleOf("x"));
            assertEquals(OperandRole.MOVING_MEAN, node.roleOf("moving_mean"));
            assertEquals(OperandRole.MOVING_VARIANCE, node.roleOf("stat"));
            assertEquals(OperandRole.OPERAND, node.roleOf("unknown"));
        }

        @Test
        void declaredOutputCountSumsSlots() {
            OperatorNode node = op("s", "split").out("out", "s/out_0", "s/out_1").out("extra", "s/extra_0").build();
            assertEquals(3, node.declaredOutputCount());
        }

        @Test
        void dataTypeCodesRoundTrip() {
            for (FlowDataType type : FlowDataType.values()) {
                assertEquals(type, FlowDataType.fromCode(type.code()));
                assertEquals(type, FlowDataType.fromScalarType(type.scalarType()));
            }
            assertThrows(IllegalArgumentException.class, () -> FlowDataType.fromCode(42));
        }
    }
}
