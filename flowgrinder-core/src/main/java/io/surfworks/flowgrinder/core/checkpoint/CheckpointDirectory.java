package io.surfworks.flowgrinder.core.checkpoint;

import io.surfworks.flowgrinder.core.graph.BlobPath;
import io.surfworks.flowgrinder.core.graph.FlowDataType;
import io.surfworks.flowgrinder.ir.TensorIr.ScalarType;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Reader for snapshot checkpoint directories.
 *
 * <p>Layout:
 * <pre>
 * model_dir/
 *   snapshot_done              marker written when the snapshot is complete
 *   conv1-weight/
 *     out                      raw little-endian tensor bytes
 *     meta.json                {"shape": [16, 3, 3, 3], "data_type": 2}
 *   conv1-bias/
 *     out
 *     meta.json
 * </pre>
 *
 * <p>Each variable directory becomes one {@link ParameterRecord} whose blob
 * path is {@code <variable>/out}, relative to the snapshot root; variables may
 * be nested. Files are independent, so they are read on a small thread pool.
 */
public final class CheckpointDirectory {

    private static final Logger LOG = Logger.getLogger(CheckpointDirectory.class.getName());

    /** Marker file a completed snapshot contains */
    public static final String SNAPSHOT_DONE = "snapshot_done";

    /** Tensor payload file name inside a variable directory */
    public static final String DATA_FILE = "out";

    /** Metadata file name inside a variable directory */
    public static final String META_FILE = "meta.json";

    private static final Gson GSON = new Gson();

    private CheckpointDirectory() {}

    /**
     * Loads every parameter below {@code root} using one thread per available processor.
     */
    public static ParameterStore load(Path root) throws IOException {
        return load(root, Runtime.getRuntime().availableProcessors());
    }

    /**
     * Loads every parameter below {@code root}.
     *
     * @param root    snapshot directory
     * @param threads number of reader threads, at least 1
     * @return the parameters, ordered by blob path
     * @throws IOException if the snapshot is incomplete or a file is unreadable or malformed
     */
    public static ParameterStore load(Path root, int threads) throws IOException {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1: " + threads);
        }
        if (!Files.isDirectory(root)) {
            throw new IOException("Checkpoint directory does not exist: " + root);
        }
        if (!Files.exists(root.resolve(SNAPSHOT_DONE))) {
            throw new IOException("'" + SNAPSHOT_DONE + "' is not in " + root
                    + "; the snapshot is incomplete or the model has not been trained");
        }

        List<Path> variableDirs = findVariables(root);
        LOG.info(() -> String.format("Loading %d parameters from %s on %d threads",
                variableDirs.size(), root, threads));

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(threads, Math.max(1, variableDirs.size())));
        try {
            List<Future<ParameterRecord>> futures = new ArrayList<>();
            for (Path dir : variableDirs) {
                futures.add(pool.submit(() -> readVariable(root, dir)));
            }
            List<ParameterRecord> records = new ArrayList<>(futures.size());
            for (Future<ParameterRecord> future : futures) {
                records.add(await(future));
            }
            return ParameterStore.of(records);
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * Reads a single variable directory.
     */
    public static ParameterRecord readVariable(Path root, Path dir) throws IOException {
        String name = root.relativize(dir).toString().replace('\\', '/');
        Path meta = dir.resolve(META_FILE);
        Path data = dir.resolve(DATA_FILE);
        if (!Files.exists(meta)) {
            throw new IOException("Parameter '" + name + "' has no " + META_FILE);
        }

        JsonObject json;
        try (Reader reader = Files.newBufferedReader(meta, StandardCharsets.UTF_8)) {
            json = GSON.fromJson(reader, JsonObject.class);
        } catch (JsonParseException e) {
            throw new IOException("Malformed " + META_FILE + " for parameter '" + name + "'", e);
        }
        if (json == null || !json.has("shape") || !json.has("data_type")) {
            throw new IOException(META_FILE + " for parameter '" + name + "' needs 'shape' and 'data_type'");
        }

        List<Integer> shape = new ArrayList<>();
        JsonArray dims = json.getAsJsonArray("shape");
        for (JsonElement dim : dims) {
            shape.add(dim.getAsInt());
        }
        ScalarType dtype;
        try {
            dtype = FlowDataType.fromCode(json.get("data_type").getAsInt()).scalarType();
        } catch (IllegalArgumentException e) {
            throw new IOException("Parameter '" + name + "': " + e.getMessage(), e);
        }

        byte[] bytes = Files.readAllBytes(data);
        TensorBuffer buffer;
        try {
            buffer = new TensorBuffer(dtype, shape, bytes);
        } catch (IllegalArgumentException e) {
            throw new IOException("Parameter '" + name + "' is corrupt: " + e.getMessage(), e);
        }
        LOG.fine(() -> "Loaded parameter " + name + " " + dtype + " " + shape);
        return new ParameterRecord(name, BlobPath.of(name + "/" + DATA_FILE), buffer);
    }

    private static List<Path> findVariables(Path root) throws IOException {
        try (Stream<Path> files = Files.walk(root)) {
            return files
                    .filter(p -> p.getFileName() != null && p.getFileName().toString().equals(DATA_FILE))
                    .filter(Files::isRegularFile)
                    .map(Path::getParent)
                    .filter(dir -> !dir.equals(root))
                    .sorted()
                    .toList();
        }
    }

    private static ParameterRecord await(Future<ParameterRecord> future) throws IOException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while loading checkpoint", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException io) {
                throw io;
            }
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new IOException("Failed loading parameter", cause);
        }
    }
}
