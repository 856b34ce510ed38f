package com.example.RagFlow.engine;

import com.example.RagFlow.exception.CycleDetectedException;
import com.example.RagFlow.model.ComponentType;
import com.example.RagFlow.model.Connection;
import com.example.RagFlow.model.ValidationResult;
import com.example.RagFlow.model.WorkflowComponent;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural checks on a workflow graph.
 * <p>
 * The default mode is lenient so half-built graphs can still be saved and inspected: it requires a
 * user query and an output component and that every connection points at a known component.
 * Strict mode additionally rejects cycles and graphs where no output is reachable from a user query.
 */
public class GraphValidator {

    private final Set<String> supportedTypes;
    private final ExecutionOrderResolver orderResolver;
    private final boolean strict;

    public GraphValidator(Set<String> supportedTypes, ExecutionOrderResolver orderResolver, boolean strict) {
        this.supportedTypes = Set.copyOf(supportedTypes);
        this.orderResolver = orderResolver;
        this.strict = strict;
    }

    public ValidationResult validate(List<WorkflowComponent> components, List<Connection> connections) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (components.stream().noneMatch(c -> ComponentType.USER_QUERY.matches(c.type()))) {
            errors.add("Workflow must have a User Query component");
        }
        if (components.stream().noneMatch(c -> ComponentType.OUTPUT.matches(c.type()))) {
            errors.add("Workflow must have an Output component");
        }
        if (components.stream().noneMatch(c -> ComponentType.LLM_ENGINE.matches(c.type()))) {
            warnings.add("Workflow should have an LLM Engine component for processing");
        }

        Set<String> componentIds = new LinkedHashSet<>();
        for (WorkflowComponent component : components) {
            if (component.id() == null || component.id().isBlank()) {
                errors.add("Component id must not be blank");
            } else if (!componentIds.add(component.id())) {
                errors.add("Duplicate component id '" + component.id() + "'");
            }
            if (component.type() == null || component.type().isBlank()) {
                errors.add("Component '" + component.id() + "' has no type");
            } else if (!supportedTypes.contains(component.type())) {
                warnings.add("Component '" + component.id() + "' has unsupported type '" + component.type()
                        + "' and will be skipped");
            }
        }

        Set<String> connected = new HashSet<>();
        for (Connection connection : connections) {
            if (!componentIds.contains(connection.source())) {
                errors.add("Connection source '" + connection.source() + "' not found in components");
            }
            if (!componentIds.contains(connection.target())) {
                errors.add("Connection target '" + connection.target() + "' not found in components");
            }
            connected.add(connection.source());
            connected.add(connection.target());
        }

        List<String> disconnected = componentIds.stream()
                .filter(id -> !connected.contains(id))
                .toList();
        if (!disconnected.isEmpty()) {
            warnings.add("Disconnected components: " + disconnected);
        }

        if (strict && errors.isEmpty()) {
            strictChecks(components, connections, errors);
        }

        return new ValidationResult(errors, warnings);
    }

    private void strictChecks(List<WorkflowComponent> components, List<Connection> connections, List<String> errors) {
        try {
            orderResolver.resolve(components, connections);
        } catch (CycleDetectedException ex) {
            errors.add("Workflow contains a cycle through components " + ex.getUnresolvedIds());
            return;
        }

        Map<String, List<String>> outgoing = new HashMap<>();
        for (Connection connection : connections) {
            outgoing.computeIfAbsent(connection.source(), k -> new ArrayList<>()).add(connection.target());
        }
        Map<String, String> typeById = new HashMap<>();
        Deque<String> frontier = new ArrayDeque<>();
        for (WorkflowComponent component : components) {
            typeById.put(component.id(), component.type());
            if (ComponentType.USER_QUERY.matches(component.type())) {
                frontier.add(component.id());
            }
        }

        Set<String> visited = new HashSet<>(frontier);
        while (!frontier.isEmpty()) {
            String current = frontier.poll();
            if (ComponentType.OUTPUT.matches(typeById.get(current))) {
                return;
            }
            for (String next : outgoing.getOrDefault(current, List.of())) {
                if (visited.add(next)) {
                    frontier.add(next);
                }
            }
        }
        errors.add("No path from a User Query component to an Output component");
    }
}
