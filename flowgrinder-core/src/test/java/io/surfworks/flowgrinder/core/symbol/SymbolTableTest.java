package io.surfworks.flowgrinder.core.symbol;

import io.surfworks.flowgrinder.core.DuplicateBindingException;
import io.surfworks.flowgrinder.core.UnboundReferenceException;
import io.surfworks.flowgrinder.core.checkpoint.ParameterStore;
import io.surfworks.flowgrinder.core.graph.BlobPath;
import io.surfworks.flowgrinder.core.graph.RawNode.OperatorNode;
import io.surfworks.flowgrinder.ir.Ops;
import io.surfworks.flowgrinder.ir.TensorIr.Expr;
import io.surfworks.flowgrinder.ir.TensorIr.ScalarType;
import io.surfworks.flowgrinder.ir.TensorIr.TensorType;
import io.surfworks.flowgrinder.ir.TensorIr.Var;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.surfworks.flowgrinder.core.TestGraphs.op;
import static io.surfworks.flowgrinder.core.TestGraphs.parameter;
import static io.surfworks.flowgrinder.core.TestGraphs.parameters;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("SymbolTable")
class SymbolTableTest {

    private static final BlobPath INPUT = BlobPath.of("Input_0/out");

    private static Var var(String name) {
        return new Var(name, TensorType.of(ScalarType.F32, 1, 4));
    }

    @Nested
    @DisplayName("binding")
    class Binding {

        @Test
        void rebindingSameNameAndValueIsIdempotent() {
            SymbolTable table = new SymbolTable(List.of(), ParameterStore.empty());
            Var x = var("x");
            SymbolEntry first = table.bind(INPUT, "x", x);
            SymbolEntry second = table.bind(INPUT, "x", x);
            assertSame(first, second);
            assertEquals(1, table.entries().size());
        }

        @Test
        void bindingAnotherNameFails() {
            SymbolTable table = new SymbolTable(List.of(), ParameterStore.empty());
            table.bind(INPUT, "x", var("x"));
            DuplicateBindingException e = assertThrows(DuplicateBindingException.class,
                    () -> table.bind(INPUT, "y", var("y")));
            assertEquals(INPUT, e.getPath());
        }

        @Test
        void bindingAnotherValueUnderSameNameFails() {
            SymbolTable table = new SymbolTable(List.of(), ParameterStore.empty());
            table.bind(INPUT, "x", var("x"));
            Var other = new Var("x", TensorType.of(ScalarType.F32, 2, 4));
            assertThrows(DuplicateBindingException.class, () -> table.bind(INPUT, "x", other));
        }

        @Test
        void unknownPathIsUnbound() {
            SymbolTable table = new SymbolTable(List.of(), ParameterStore.empty());
            UnboundReferenceException e = assertThrows(UnboundReferenceException.class,
                    () -> table.resolve(BlobPath.of("ghost/out"), "Node 'relu1'"));
            assertEquals(BlobPath.of("ghost/out"), e.getPath());
            assertTrue(e.getMessage().contains("relu1"));
        }
    }

    @Nested
    @DisplayName("consumer naming")
    class ConsumerNaming {

        @Test
        void firstConsumerNamesTheValue() {
            OperatorNode producer = op("conv1", "conv2d").in("in", "Input_0/out").out().build();
            OperatorNode first = op("relu1", "relu").in("x", "conv1/out_0").out().build();
            OperatorNode second = op("add1", "broadcast_add").in("x", "conv1/out_0").in("y", "relu1/out_0").out().build();

            SymbolTable table = new SymbolTable(List.of(producer, first, second), ParameterStore.empty());

            assertEquals("relu1-x", table.expectedName(BlobPath.of("conv1/out_0")).orElseThrow());
            table.recordOutputs(producer, List.of(Ops.unary("relu", var("Input_0"))));
            assertEquals("relu1-x", table.lookup(BlobPath.of("conv1/out_0")).orElseThrow().name());
        }

        @Test
        void multiPathSlotsGetIndexSuffix() {
            assertEquals("cat-in", SymbolTable.localName("cat", "in", 0, 1));
            assertEquals("cat-in_1", SymbolTable.localName("cat", "in", 1, 2));

            OperatorNode concat = op("cat", "concat").in("in", "a/out_0", "b/out_0").out().build();
            SymbolTable table = new SymbolTable(List.of(concat), ParameterStore.empty());
            assertEquals("cat-in_0", table.expectedName(BlobPath.of("a/out_0")).orElseThrow());
            assertEquals("cat-in_1", table.expectedName(BlobPath.of("b/out_0")).orElseThrow());
        }

        @Test
        void unconsumedOutputsUseProducerSlotName() {
            OperatorNode split = op("split1", "split").in("in", "Input_0/out")
                    .out("out", "split1/out_0", "split1/out_1").build();
            SymbolTable table = new SymbolTable(List.of(split), ParameterStore.empty());
            table.recordOutputs(split, List.of(var("a"), var("b")));
            assertEquals("split1-out_0", table.lookup(BlobPath.of("split1/out_0")).orElseThrow().name());
            assertEquals("split1-out_1", table.lookup(BlobPath.of("split1/out_1")).orElseThrow().name());
        }
    }

    @Nested
    @DisplayName("parameters")
    class Parameters {

        @Test
        void materializedOnFirstReadUnderConsumerName() {
            OperatorNode conv = op("conv1", "conv2d").in("in", "Input_0/out").in("weight", "conv1-weight/out").out().build();
            SymbolTable table = new SymbolTable(List.of(conv),
                    parameters(parameter("conv1-weight", 8, 3, 3, 3), parameter("unused", 2)));

            assertTrue(table.parameterVariables().isEmpty());
            Expr weight = table.resolveInput(conv, "weight").get(0);

            Var var = assertInstanceOf(Var.class, weight);
            assertEquals("conv1-weight", var.name());
            assertEquals(List.of(8, 3, 3, 3), var.type().shape());
            assertEquals(1, table.parameterVariables().size());
            assertFalse(table.isBound(BlobPath.of("unused/out")));
        }

        @Test
        void secondReadReturnsSameVariable() {
            OperatorNode a = op("a", "broadcast_mul").in("x", "Input_0/out").in("y", "scale/out").out().build();
            SymbolTable table = new SymbolTable(List.of(a), parameters(parameter("scale", 4)));
            Expr first = table.resolve(BlobPath.of("scale/out"), "a");
            Expr second = table.resolve(BlobPath.of("scale/out"), "b");
            assertSame(first, second);
            assertEquals("a-y", ((Var) first).name());
        }
    }
}
