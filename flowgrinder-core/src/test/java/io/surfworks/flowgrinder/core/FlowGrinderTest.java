package io.surfworks.flowgrinder.core;

import io.surfworks.flowgrinder.core.assemble.ConversionResult;
import io.surfworks.flowgrinder.core.checkpoint.CheckpointDirectory;
import io.surfworks.flowgrinder.core.config.ConversionOptions;
import io.surfworks.flowgrinder.ir.TensorIr.Call;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("FlowGrinder from disk")
class FlowGrinderTest {

    private static final String GRAPH = """
            {
              "name": "tiny_cnn",
              "nodes": [
                {"name": "Input_0", "kind": "input", "out": "Input_0/out",
                 "shape": [1, 3, 32, 32], "data_type": 2, "primary": true},
                {"name": "conv1-weight", "kind": "variable", "out": "conv1-weight/out",
                 "shape": [8, 3, 3, 3], "data_type": 2},
                {"name": "conv1", "kind": "user", "op_type": "conv2d",
                 "inputs": {"in": ["Input_0/out"], "weight": ["conv1-weight/out"]},
                 "outputs": {"out": ["conv1/out_0"]},
                 "attributes": {
                   "padding": {"at_string": "same_upper"},
                   "kernel_size": {"at_list_int32": [3, 3]},
                   "strides": {"at_list_int32": [1, 1]},
                   "dilation_rate": {"at_list_int32": [1, 1]},
                   "data_format": {"at_string": "channels_first"}
                 }},
                {"name": "relu1", "kind": "user", "op_type": "relu",
                 "inputs": {"x": ["conv1/out_0"]},
                 "outputs": {"y": ["relu1/y_0"]}},
                {"name": "Return_0", "kind": "return", "in": "relu1/y_0"}
              ]
            }
            """;

    @TempDir
    Path dir;

    private Path writeCheckpoint(boolean done) throws IOException {
        Path snapshot = Files.createDirectories(dir.resolve("snapshot"));
        Path weight = Files.createDirectories(snapshot.resolve("conv1-weight"));
        Files.writeString(weight.resolve(CheckpointDirectory.META_FILE), "{\"shape\": [8, 3, 3, 3], \"data_type\": 2}");
        Files.write(weight.resolve(CheckpointDirectory.DATA_FILE), new byte[8 * 3 * 3 * 3 * 4]);
        if (done) {
            Files.createFile(snapshot.resolve(CheckpointDirectory.SNAPSHOT_DONE));
        }
        return snapshot;
    }

    @Test
    void convertsGraphAndCheckpoint() throws IOException {
        Path graph = Files.writeString(dir.resolve("graph.json"), GRAPH);
        Path snapshot = writeCheckpoint(true);

        ConversionResult result = FlowGrinder.convert(graph, snapshot,
                ConversionOptions.defaults().withModuleName("tiny_cnn"));

        assertEquals(List.of("Input_0", "conv1-weight"), result.module().main().paramNames());
        Call relu = assertInstanceOf(Call.class, result.module().main().body());
        assertEquals(List.of(1, 8, 32, 32), relu.tensorType().shape());
        assertEquals(8 * 3 * 3 * 3, result.params().get("conv1-weight").elementCount());
        assertTrue(result.print().startsWith("// module @tiny_cnn"));
    }

    @Test
    void incompleteSnapshotStopsBeforeConversion() throws IOException {
        Path graph = Files.writeString(dir.resolve("graph.json"), GRAPH);
        Path snapshot = writeCheckpoint(false);
        assertThrows(IOException.class, () -> FlowGrinder.convert(graph, snapshot));
    }
}
