package io.surfworks.flowgrinder.core.checkpoint;

import io.surfworks.flowgrinder.core.DuplicateBindingException;
import io.surfworks.flowgrinder.core.graph.BlobPath;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable lookup from blob path to trained parameter.
 */
public final class ParameterStore {

    private static final ParameterStore EMPTY = new ParameterStore(Map.of());

    private final Map<BlobPath, ParameterRecord> records;

    private ParameterStore(Map<BlobPath, ParameterRecord> records) {
        this.records = Collections.unmodifiableMap(records);
    }

    public static ParameterStore empty() {
        return EMPTY;
    }

    /**
     * Indexes records by path; two records on one path are rejected.
     */
    public static ParameterStore of(Collection<ParameterRecord> records) {
        Map<BlobPath, ParameterRecord> byPath = new LinkedHashMap<>();
        for (ParameterRecord record : records) {
            ParameterRecord previous = byPath.putIfAbsent(record.path(), record);
            if (previous != null) {
                throw new DuplicateBindingException(record.path(), previous.name(), record.name());
            }
        }
        return new ParameterStore(byPath);
    }

    public Optional<ParameterRecord> lookup(BlobPath path) {
        return Optional.ofNullable(records.get(path));
    }

    public boolean contains(BlobPath path) {
        return records.containsKey(path);
    }

    public List<ParameterRecord> records() {
        return List.copyOf(records.values());
    }

    public int size() {
        return records.size();
    }
}
