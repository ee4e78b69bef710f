package io.surfworks.flowgrinder.core.graph;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Logical storage location of a tensor, e.g. {@code "conv1-weight/out"}.
 *
 * <p>Paths are normalized on construction (forward slashes, no leading
 * {@code ./} or {@code /}, no empty segments), so two references to the same
 * tensor compare equal however the exporter spelled them.
 */
public record BlobPath(String value) implements Comparable<BlobPath> {

    public BlobPath {
        Objects.requireNonNull(value, "value");
        value = normalize(value);
        if (value.isEmpty()) {
            throw new IllegalArgumentException("Blob path must not be empty");
        }
    }

    public static BlobPath of(String value) {
        return new BlobPath(value);
    }

    /**
     * The producing operator's part of the path, before the first separator.
     */
    public String opName() {
        int slash = value.indexOf('/');
        return slash < 0 ? value : value.substring(0, slash);
    }

    /**
     * Resolves this path to a file below a checkpoint root.
     */
    public Path under(Path root) {
        return root.resolve(value);
    }

    @Override
    public int compareTo(BlobPath other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }

    private static String normalize(String raw) {
        String s = raw.trim().replace('\\', '/');
        while (s.startsWith("./")) {
            s = s.substring(2);
        }
        while (s.startsWith("/")) {
            s = s.substring(1);
        }
        while (s.contains("//")) {
            s = s.replace("//", "/");
        }
        while (s.endsWith("/")) {
            s = s.substring(0, s.length() - 1);
        }
        return s;
    }
}
