package com.example.RagFlow.engine;

import com.example.RagFlow.config.EngineProperties;
import com.example.RagFlow.engine.handler.KnowledgeBaseHandler;
import com.example.RagFlow.engine.handler.LlmEngineHandler;
import com.example.RagFlow.engine.handler.OutputHandler;
import com.example.RagFlow.engine.handler.UserQueryHandler;
import com.example.RagFlow.exception.CycleDetectedException;
import com.example.RagFlow.exception.ResourceNotFoundException;
import com.example.RagFlow.exception.TurnTimeoutException;
import com.example.RagFlow.exception.UpstreamFailureException;
import com.example.RagFlow.exception.WorkflowValidationException;
import com.example.RagFlow.model.BoundDocument;
import com.example.RagFlow.model.ChatMessage;
import com.example.RagFlow.model.Connection;
import com.example.RagFlow.model.ModelOutput;
import com.example.RagFlow.model.RetrievedChunk;
import com.example.RagFlow.model.WorkflowComponent;
import com.example.RagFlow.model.WorkflowDefinition;
import com.example.RagFlow.model.WorkflowExecuteResponse;
import com.example.RagFlow.service.ChatTurnService;
import com.example.RagFlow.service.DocumentStore;
import com.example.RagFlow.service.LanguageModel;
import com.example.RagFlow.service.VectorIndex;
import com.example.RagFlow.service.WorkflowDefinitionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class WorkflowExecutionServiceTest {

    private static final Long WORKFLOW_ID = 42L;

    private WorkflowDefinitionStore definitionStore;
    private DocumentStore documentStore;
    private VectorIndex vectorIndex;
    private LanguageModel languageModel;
    private InMemoryChatHistoryStore historyStore;
    private EngineProperties properties;
    private WorkflowExecutionService service;

    @BeforeEach
    void setUp() {
        definitionStore = Mockito.mock(WorkflowDefinitionStore.class);
        documentStore = Mockito.mock(DocumentStore.class);
        vectorIndex = Mockito.mock(VectorIndex.class);
        languageModel = Mockito.mock(LanguageModel.class);
        historyStore = new InMemoryChatHistoryStore();
        properties = new EngineProperties();
        service = buildService();
    }

    private WorkflowExecutionService buildService() {
        ComponentHandlerRegistry registry = new ComponentHandlerRegistry(List.of(
                new UserQueryHandler(),
                new KnowledgeBaseHandler(properties),
                new LlmEngineHandler(properties),
                new OutputHandler()));
        ExecutionOrderResolver resolver = new ExecutionOrderResolver();
        return new WorkflowExecutionService(
                definitionStore,
                new GraphValidator(registry.supportedTypes(), resolver, properties.isStrictValidation()),
                resolver,
                registry,
                new ChatTurnService(historyStore),
                new ExecutionCollaborators(documentStore, vectorIndex, languageModel),
                properties);
    }

    private static WorkflowDefinition ragPipeline() {
        return new WorkflowDefinition(WORKFLOW_ID, "support bot",
                List.of(
                        WorkflowComponent.of("out", "output"),
                        WorkflowComponent.of("llm", "llm_engine"),
                        WorkflowComponent.of("kb", "knowledge_base", Map.of("resultCount", 2)),
                        WorkflowComponent.of("q", "user_query")),
                List.of(
                        Connection.of("q", "kb"),
                        Connection.of("kb", "llm"),
                        Connection.of("llm", "out")));
    }

    @Test
    void answersTurnWithSourcesAndPersistsBothMessages() {
        when(definitionStore.get(WORKFLOW_ID)).thenReturn(Optional.of(ragPipeline()));
        when(documentStore.listByWorkflow(WORKFLOW_ID)).thenReturn(List.of(new BoundDocument(5L, "handbook.txt")));
        when(vectorIndex.searchSimilar("How many vacation days?", 2, 5L)).thenReturn(List.of(
                new RetrievedChunk(5L, 0, "Employees get 25 days.", 0.91),
                new RetrievedChunk(5L, 3, "Unused days carry over.", 0.84)));
        when(languageModel.generate(anyString(), anyString(), anyList(), anyDouble()))
                .thenReturn(new ModelOutput("You get 25 days.", "deepseek-chat", "deepseek"));

        WorkflowExecuteResponse response = service.execute(WORKFLOW_ID, "How many vacation days?", null);

        assertThat(response.response()).isEqualTo("You get 25 days.");
        assertThat(response.sessionId()).isNotNull();
        assertThat(response.executionTimeMs()).isGreaterThanOrEqualTo(0);
        assertThat(response.metadata()).containsEntry("sources", List.of("handbook.txt"));

        verify(languageModel).generate(
                eq("You are a helpful AI assistant."),
                eq("Context: Employees get 25 days.\n\nUnused days carry over.\n\nQuestion: How many vacation days?"),
                anyList(),
                eq(0.7));

        List<ChatMessage> messages = historyStore.messages(response.sessionId());
        assertThat(messages).extracting(ChatMessage::getRole).containsExactly("user", "assistant");
        assertThat(messages).extracting(ChatMessage::getContent)
                .containsExactly("How many vacation days?", "You get 25 days.");
        assertThat(historyStore.metadataOf(messages.get(1))).containsKey("modelInfo");
    }

    @Test
    void resumesExistingSession() {
        when(definitionStore.get(WORKFLOW_ID)).thenReturn(Optional.of(ragPipeline()));
        when(documentStore.listByWorkflow(WORKFLOW_ID)).thenReturn(List.of());
        when(languageModel.generate(anyString(), anyString(), anyList(), anyDouble()))
                .thenReturn(new ModelOutput("Hi.", "deepseek-chat", "deepseek"));
        Long sessionId = historyStore.createSession(WORKFLOW_ID);

        WorkflowExecuteResponse first = service.execute(WORKFLOW_ID, "hello", sessionId);
        WorkflowExecuteResponse second = service.execute(WORKFLOW_ID, "again", sessionId);

        assertThat(first.sessionId()).isEqualTo(sessionId);
        assertThat(second.sessionId()).isEqualTo(sessionId);
        assertThat(historyStore.messages(sessionId)).extracting(ChatMessage::getContent)
                .containsExactly("hello", "Hi.", "again", "Hi.");
        assertThat(historyStore.sessionCount()).isEqualTo(1);
    }

    @Test
    void sessionOfAnotherWorkflowIsNotFound() {
        when(definitionStore.get(WORKFLOW_ID)).thenReturn(Optional.of(ragPipeline()));
        Long foreignSession = historyStore.createSession(99L);

        assertThatThrownBy(() -> service.execute(WORKFLOW_ID, "hello", foreignSession))
                .isInstanceOf(ResourceNotFoundException.class);
        assertThat(historyStore.messageCount()).isZero();
    }

    @Test
    void languageModelFailurePersistsUserAndErrorMessages() {
        when(definitionStore.get(WORKFLOW_ID)).thenReturn(Optional.of(ragPipeline()));
        when(documentStore.listByWorkflow(WORKFLOW_ID)).thenReturn(List.of());
        when(languageModel.generate(anyString(), anyString(), anyList(), anyDouble()))
                .thenThrow(new UpstreamFailureException("All model attempts failed. Last error: 503"));

        assertThatThrownBy(() -> service.execute(WORKFLOW_ID, "hello", null))
                .isInstanceOf(UpstreamFailureException.class)
                .hasMessageContaining("503");

        assertThat(historyStore.sessionCount()).isEqualTo(1);
        List<ChatMessage> messages = historyStore.messages(1L);
        assertThat(messages).extracting(ChatMessage::getRole).containsExactly("user", "assistant");
        assertThat(messages.get(1).getContent()).startsWith("Error: ");
        assertThat(historyStore.metadataOf(messages.get(1)))
                .containsEntry("error", true)
                .containsEntry("errorKind", "UPSTREAM_FAILURE");
    }

    @Test
    void expiredDeadlineIsRecordedAsTimeout() {
        properties.setTurnTimeout(Duration.ofMillis(100));
        when(definitionStore.get(WORKFLOW_ID)).thenReturn(Optional.of(ragPipeline()));
        when(documentStore.listByWorkflow(WORKFLOW_ID)).thenReturn(List.of(new BoundDocument(5L, "handbook.txt")));
        when(vectorIndex.searchSimilar(anyString(), anyInt(), anyLong())).thenAnswer(invocation -> {
            Thread.sleep(2_000);
            return List.of();
        });

        assertThatThrownBy(() -> service.execute(WORKFLOW_ID, "slow question", null))
                .isInstanceOf(TurnTimeoutException.class);

        List<ChatMessage> messages = historyStore.messages(1L);
        assertThat(messages).hasSize(2);
        assertThat(historyStore.metadataOf(messages.get(1))).containsEntry("errorKind", "TIMEOUT");
        verify(languageModel, never()).generate(anyString(), anyString(), anyList(), anyDouble());
    }

    @Test
    void invalidWorkflowIsRejectedWithoutSideEffects() {
        WorkflowDefinition noOutput = new WorkflowDefinition(WORKFLOW_ID, "broken",
                List.of(WorkflowComponent.of("q", "user_query"), WorkflowComponent.of("llm", "llm_engine")),
                List.of(Connection.of("q", "llm")));
        when(definitionStore.get(WORKFLOW_ID)).thenReturn(Optional.of(noOutput));

        assertThatThrownBy(() -> service.execute(WORKFLOW_ID, "hello", null))
                .isInstanceOf(WorkflowValidationException.class)
                .satisfies(ex -> assertThat(((WorkflowValidationException) ex).getErrors())
                        .contains("Workflow must have an Output component"));

        assertThat(historyStore.sessionCount()).isZero();
        assertThat(historyStore.messageCount()).isZero();
        verifyNoInteractions(documentStore, vectorIndex, languageModel);
    }

    @Test
    void cyclicWorkflowIsRejectedWithoutSideEffects() {
        WorkflowDefinition cyclic = new WorkflowDefinition(WORKFLOW_ID, "loop",
                List.of(
                        WorkflowComponent.of("q", "user_query"),
                        WorkflowComponent.of("A", "knowledge_base"),
                        WorkflowComponent.of("B", "llm_engine"),
                        WorkflowComponent.of("out", "output")),
                List.of(
                        Connection.of("q", "A"),
                        Connection.of("A", "B"),
                        Connection.of("B", "A"),
                        Connection.of("B", "out")));
        when(definitionStore.get(WORKFLOW_ID)).thenReturn(Optional.of(cyclic));

        assertThatThrownBy(() -> service.execute(WORKFLOW_ID, "hello", null))
                .isInstanceOf(CycleDetectedException.class)
                .satisfies(ex -> assertThat(((CycleDetectedException) ex).getUnresolvedIds()).contains("A", "B"));

        assertThat(historyStore.sessionCount()).isZero();
        verifyNoInteractions(documentStore, vectorIndex, languageModel);
    }

    @Test
    void unknownWorkflowIsNotFound() {
        when(definitionStore.get(WORKFLOW_ID)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.execute(WORKFLOW_ID, "hello", null))
                .isInstanceOf(ResourceNotFoundException.class);
        assertThat(historyStore.sessionCount()).isZero();
    }

    @Test
    void blankQueryIsRejected() {
        assertThatThrownBy(() -> service.execute(WORKFLOW_ID, "   ", null))
                .isInstanceOf(WorkflowValidationException.class);
        verifyNoInteractions(definitionStore);
    }

    @Test
    void outputWithoutLlmReturnsFallbackText() {
        WorkflowDefinition direct = new WorkflowDefinition(WORKFLOW_ID, "echo",
                List.of(WorkflowComponent.of("q", "user_query"), WorkflowComponent.of("out", "output")),
                List.of(Connection.of("q", "out")));
        when(definitionStore.get(WORKFLOW_ID)).thenReturn(Optional.of(direct));

        WorkflowExecuteResponse response = service.execute(WORKFLOW_ID, "hello", null);

        assertThat(response.response()).isEqualTo("Workflow executed but no response generated");
        assertThat(response.metadata()).isEmpty();
    }

    @Test
    void earlyOutputWithoutAnswerDoesNotEndTurn() {
        WorkflowDefinition twoOutputs = new WorkflowDefinition(WORKFLOW_ID, "early output",
                List.of(
                        WorkflowComponent.of("q", "user_query"),
                        WorkflowComponent.of("out1", "output"),
                        WorkflowComponent.of("llm", "llm_engine"),
                        WorkflowComponent.of("out2", "output")),
                List.of(
                        Connection.of("q", "out1"),
                        Connection.of("q", "llm"),
                        Connection.of("llm", "out2")));
        when(definitionStore.get(WORKFLOW_ID)).thenReturn(Optional.of(twoOutputs));
        when(languageModel.generate(anyString(), anyString(), anyList(), anyDouble()))
                .thenReturn(new ModelOutput("real answer", "deepseek-chat", "deepseek"));

        WorkflowExecuteResponse response = service.execute(WORKFLOW_ID, "hello", null);

        assertThat(response.response()).isEqualTo("real answer");
        assertThat(historyStore.messages(response.sessionId()))
                .extracting(ChatMessage::getContent)
                .containsExactly("hello", "real answer");
    }

    @Test
    void componentsAfterAnsweringOutputAreSkipped() {
        WorkflowDefinition twoModels = new WorkflowDefinition(WORKFLOW_ID, "early exit",
                List.of(
                        WorkflowComponent.of("q", "user_query"),
                        WorkflowComponent.of("llm1", "llm_engine"),
                        WorkflowComponent.of("out1", "output"),
                        WorkflowComponent.of("llm2", "llm_engine"),
                        WorkflowComponent.of("out2", "output")),
                List.of(
                        Connection.of("q", "llm1"),
                        Connection.of("llm1", "out1"),
                        Connection.of("out1", "llm2"),
                        Connection.of("llm2", "out2")));
        when(definitionStore.get(WORKFLOW_ID)).thenReturn(Optional.of(twoModels));
        when(languageModel.generate(anyString(), anyString(), anyList(), anyDouble()))
                .thenReturn(new ModelOutput("first answer", "deepseek-chat", "deepseek"))
                .thenReturn(new ModelOutput("second answer", "deepseek-chat", "deepseek"));

        WorkflowExecuteResponse response = service.execute(WORKFLOW_ID, "hello", null);

        assertThat(response.response()).isEqualTo("first answer");
        verify(languageModel, times(1)).generate(anyString(), anyString(), anyList(), anyDouble());
    }

    @Test
    void unsupportedComponentTypeIsSkipped() {
        WorkflowDefinition withPlugin = new WorkflowDefinition(WORKFLOW_ID, "plugin",
                List.of(
                        WorkflowComponent.of("q", "user_query"),
                        WorkflowComponent.of("web", "web_search"),
                        WorkflowComponent.of("llm", "llm_engine"),
                        WorkflowComponent.of("out", "output")),
                List.of(
                        Connection.of("q", "web"),
                        Connection.of("web", "llm"),
                        Connection.of("llm", "out")));
        when(definitionStore.get(WORKFLOW_ID)).thenReturn(Optional.of(withPlugin));
        when(languageModel.generate(anyString(), anyString(), anyList(), anyDouble()))
                .thenReturn(new ModelOutput("ok", "deepseek-chat", "deepseek"));

        WorkflowExecuteResponse response = service.execute(WORKFLOW_ID, "hello", null);

        assertThat(response.response()).isEqualTo("ok");
        assertThat(response.metadata()).doesNotContainKey("sources");
    }
}
