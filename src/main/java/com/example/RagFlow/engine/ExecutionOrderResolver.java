package com.example.RagFlow.engine;

import com.example.RagFlow.exception.CycleDetectedException;
import com.example.RagFlow.model.Connection;
import com.example.RagFlow.model.WorkflowComponent;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Orders components with Kahn's algorithm. Nodes that become ready at the same time keep
 * FIFO order, so the result is deterministic for a given component order.
 */
public class ExecutionOrderResolver {

    /**
     * @return component ids such that every edge source precedes its target
     * @throws CycleDetectedException naming every component that could not be placed
     */
    public List<String> resolve(List<WorkflowComponent> components, List<Connection> connections) {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        Map<String, List<String>> outgoing = new LinkedHashMap<>();
        for (WorkflowComponent component : components) {
            inDegree.put(component.id(), 0);
            outgoing.put(component.id(), new ArrayList<>());
        }

        for (Connection connection : connections) {
            String source = connection.source();
            String target = connection.target();
            if (!inDegree.containsKey(source) || !inDegree.containsKey(target)) {
                throw new IllegalArgumentException(
                        "Connection " + source + " -> " + target + " references an unknown component");
            }
            outgoing.get(source).add(target);
            inDegree.merge(target, 1, Integer::sum);
        }

        Deque<String> ready = new ArrayDeque<>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) {
                ready.addLast(id);
            }
        });

        List<String> order = new ArrayList<>(inDegree.size());
        while (!ready.isEmpty()) {
            String current = ready.pollFirst();
            order.add(current);
            for (String next : outgoing.get(current)) {
                int remaining = inDegree.merge(next, -1, Integer::sum);
                if (remaining == 0) {
                    ready.addLast(next);
                }
            }
        }

        if (order.size() != inDegree.size()) {
            List<String> unresolved = inDegree.entrySet().stream()
                    .filter(e -> e.getValue() > 0)
                    .map(Map.Entry::getKey)
                    .toList();
            throw new CycleDetectedException(unresolved);
        }
        return order;
    }
}
