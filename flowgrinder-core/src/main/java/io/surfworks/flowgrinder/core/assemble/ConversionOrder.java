package io.surfworks.flowgrinder.core.assemble;

import io.surfworks.flowgrinder.core.MalformedGraphException;
import io.surfworks.flowgrinder.core.config.OrderingPolicy;
import io.surfworks.flowgrinder.core.graph.BlobPath;
import io.surfworks.flowgrinder.core.graph.RawNode.OperatorNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeSet;

/**
 * Order in which operators are converted.
 *
 * <p>Topological order runs every producer before its consumers, breaking
 * ties by declaration position so an already-ordered graph keeps its order.
 */
public final class ConversionOrder {

    private ConversionOrder() {}

    public static List<OperatorNode> of(List<OperatorNode> operators, OrderingPolicy policy) {
        return switch (policy) {
            case TOPOLOGICAL -> topological(operators);
            case DECLARATION -> List.copyOf(operators);
        };
    }

    /**
     * Kahn's algorithm over path dependencies.
     *
     * @throws MalformedGraphException if the operators form a cycle
     */
    public static List<OperatorNode> topological(List<OperatorNode> operators) {
        int n = operators.size();
        Map<BlobPath, Integer> producers = new HashMap<>();
        for (int i = 0; i < n; i++) {
            for (BlobPath path : operators.get(i).outputPaths()) {
                producers.putIfAbsent(path, i);
            }
        }

        List<Set<Integer>> consumers = new ArrayList<>(n);
        int[] pending = new int[n];
        for (int i = 0; i < n; i++) {
            consumers.add(new TreeSet<>());
        }
        for (int i = 0; i < n; i++) {
            Set<Integer> deps = new TreeSet<>();
            for (BlobPath path : operators.get(i).inputPaths()) {
                Integer producer = producers.get(path);
                if (producer != null && producer != i) {
                    deps.add(producer);
                }
            }
            pending[i] = deps.size();
            for (int dep : deps) {
                consumers.get(dep).add(i);
            }
        }

        PriorityQueue<Integer> ready = new PriorityQueue<>();
        for (int i = 0; i < n; i++) {
            if (pending[i] == 0) {
                ready.add(i);
            }
        }
        List<OperatorNode> order = new ArrayList<>(n);
        while (!ready.isEmpty()) {
            int next = ready.poll();
            order.add(operators.get(next));
            for (int consumer : consumers.get(next)) {
                if (--pending[consumer] == 0) {
                    ready.add(consumer);
                }
            }
        }

        if (order.size() != n) {
            List<String> stuck = new ArrayList<>();
            for (int i = 0; i < n; i++) {
                if (pending[i] > 0) {
                    stuck.add(operators.get(i).name());
                }
            }
            throw new MalformedGraphException("Operators form a dependency cycle: " + String.join(", ", stuck));
        }
        return order;
    }
}
