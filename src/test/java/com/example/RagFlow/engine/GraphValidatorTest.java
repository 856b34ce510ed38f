package com.example.RagFlow.engine;

import com.example.RagFlow.model.Connection;
import com.example.RagFlow.model.ValidationResult;
import com.example.RagFlow.model.WorkflowComponent;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class GraphValidatorTest {

    private static final Set<String> TYPES = Set.of("user_query", "knowledge_base", "llm_engine", "output");

    private final GraphValidator lenient = new GraphValidator(TYPES, new ExecutionOrderResolver(), false);
    private final GraphValidator strict = new GraphValidator(TYPES, new ExecutionOrderResolver(), true);

    private static List<WorkflowComponent> pipeline() {
        return List.of(
                WorkflowComponent.of("q", "user_query"),
                WorkflowComponent.of("kb", "knowledge_base"),
                WorkflowComponent.of("llm", "llm_engine"),
                WorkflowComponent.of("out", "output")
        );
    }

    private static List<Connection> pipelineConnections() {
        return List.of(Connection.of("q", "kb"), Connection.of("kb", "llm"), Connection.of("llm", "out"));
    }

    @Test
    void acceptsCompletePipeline() {
        ValidationResult result = lenient.validate(pipeline(), pipelineConnections());

        assertThat(result.isValid()).isTrue();
        assertThat(result.errors()).isEmpty();
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void requiresUserQueryAndOutput() {
        ValidationResult result = lenient.validate(
                List.of(WorkflowComponent.of("llm", "llm_engine")), List.of());

        assertThat(result.isValid()).isFalse();
        assertThat(result.errors()).containsExactly(
                "Workflow must have a User Query component",
                "Workflow must have an Output component");
    }

    @Test
    void missingLlmEngineIsOnlyAWarning() {
        ValidationResult result = lenient.validate(
                List.of(WorkflowComponent.of("q", "user_query"), WorkflowComponent.of("out", "output")),
                List.of(Connection.of("q", "out")));

        assertThat(result.isValid()).isTrue();
        assertThat(result.warnings()).contains("Workflow should have an LLM Engine component for processing");
    }

    @Test
    void reportsDanglingConnectionEndpoints() {
        ValidationResult result = lenient.validate(pipeline(), List.of(
                Connection.of("q", "kb"),
                Connection.of("kb", "llm"),
                Connection.of("llm", "out"),
                Connection.of("ghost", "out"),
                Connection.of("llm", "nowhere")));

        assertThat(result.isValid()).isFalse();
        assertThat(result.errors()).containsExactly(
                "Connection source 'ghost' not found in components",
                "Connection target 'nowhere' not found in components");
    }

    @Test
    void danglingConnectionStillReportsUnrelatedDisconnectedComponent() {
        List<WorkflowComponent> components = new ArrayList<>(pipeline());
        components.add(WorkflowComponent.of("notes", "knowledge_base"));
        List<Connection> connections = new ArrayList<>(pipelineConnections());
        connections.add(Connection.of("llm", "nowhere"));

        ValidationResult result = lenient.validate(components, connections);

        assertThat(result.isValid()).isFalse();
        assertThat(result.errors()).containsExactly("Connection target 'nowhere' not found in components");
        assertThat(result.warnings()).contains("Disconnected components: [notes]");
    }

    @Test
    void warnsAboutDisconnectedComponentsInComponentOrder() {
        ValidationResult result = lenient.validate(pipeline(), List.of(Connection.of("q", "out")));

        assertThat(result.isValid()).isTrue();
        assertThat(result.warnings()).contains("Disconnected components: [kb, llm]");
    }

    @Test
    void duplicateIdsAreErrors() {
        ValidationResult result = lenient.validate(List.of(
                WorkflowComponent.of("q", "user_query"),
                WorkflowComponent.of("q", "output")), List.of(Connection.of("q", "q")));

        assertThat(result.errors()).contains("Duplicate component id 'q'");
    }

    @Test
    void unknownTypeIsWarnedAndNotRejected() {
        ValidationResult result = lenient.validate(List.of(
                        WorkflowComponent.of("q", "user_query"),
                        WorkflowComponent.of("web", "web_search"),
                        WorkflowComponent.of("out", "output")),
                List.of(Connection.of("q", "web"), Connection.of("web", "out")));

        assertThat(result.isValid()).isTrue();
        assertThat(result.warnings()).anyMatch(w -> w.contains("'web'") && w.contains("web_search"));
    }

    @Test
    void lenientModeAcceptsCycle() {
        List<Connection> connections = List.of(
                Connection.of("q", "kb"),
                Connection.of("kb", "llm"),
                Connection.of("llm", "kb"),
                Connection.of("llm", "out"));

        assertThat(lenient.validate(pipeline(), connections).isValid()).isTrue();
    }

    @Test
    void strictModeRejectsCycle() {
        List<Connection> connections = List.of(
                Connection.of("q", "kb"),
                Connection.of("kb", "llm"),
                Connection.of("llm", "kb"),
                Connection.of("llm", "out"));

        ValidationResult result = strict.validate(pipeline(), connections);

        assertThat(result.isValid()).isFalse();
        assertThat(result.errors()).singleElement().asString().contains("cycle");
    }

    @Test
    void strictModeRequiresPathFromQueryToOutput() {
        List<Connection> connections = List.of(Connection.of("q", "kb"), Connection.of("llm", "out"));

        ValidationResult result = strict.validate(pipeline(), connections);

        assertThat(result.errors()).containsExactly("No path from a User Query component to an Output component");
    }

    @Test
    void strictModeAcceptsCompletePipeline() {
        assertThat(strict.validate(pipeline(), pipelineConnections()).isValid()).isTrue();
    }
}
