package com.example.RagFlow.engine.handler;

import com.example.RagFlow.config.EngineProperties;
import com.example.RagFlow.engine.ComponentConfig;
import com.example.RagFlow.engine.ComponentHandler;
import com.example.RagFlow.engine.ExecutionCollaborators;
import com.example.RagFlow.engine.ExecutionContext;
import com.example.RagFlow.exception.UpstreamFailureException;
import com.example.RagFlow.exception.WorkflowException;
import com.example.RagFlow.model.BoundDocument;
import com.example.RagFlow.model.ComponentType;
import com.example.RagFlow.model.RetrievedChunk;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Retrieval step:
 * - Lists documents bound to the workflow
 * - Searches each document for the query (bounded parallel fan-out)
 * - Merges all hits, reranks by score and keeps the best {@code resultCount}
 * - Writes the joined chunk text and the source filenames into the context
 */
@Component
@RequiredArgsConstructor
public class KnowledgeBaseHandler implements ComponentHandler {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeBaseHandler.class);

    static final String CHUNK_SEPARATOR = "\n\n";

    private final EngineProperties properties;

    @Override
    public String type() {
        return ComponentType.KNOWLEDGE_BASE.wireName();
    }

    @Override
    public void execute(ExecutionContext context, ComponentConfig config, ExecutionCollaborators collaborators) {
        int resultCount = config.getInt(properties.getDefaultResultCount(), "resultCount", "n_results");
        if (resultCount <= 0) {
            resultCount = properties.getDefaultResultCount();
        }
        boolean passToLlm = config.getBoolean(true, "passToLlm", "pass_to_llm");
        if (!passToLlm) {
            log.debug("Knowledge base disabled for workflow {}", context.getWorkflowId());
            return;
        }

        List<BoundDocument> documents;
        try {
            documents = context.getDeadline().await("document lookup",
                    () -> collaborators.documentStore().listByWorkflow(context.getWorkflowId()));
        } catch (WorkflowException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new UpstreamFailureException("Document lookup failed: " + ex.getMessage(), ex);
        }
        if (documents == null || documents.isEmpty()) {
            context.setRetrievedText("");
            context.setSources(List.of());
            return;
        }

        List<List<RetrievedChunk>> perDocument = search(context, documents, resultCount, collaborators);
        List<RetrievedChunk> kept = mergeTopResults(perDocument, resultCount);

        context.setRetrievedText(kept.stream()
                .map(RetrievedChunk::text)
                .collect(Collectors.joining(CHUNK_SEPARATOR)));
        context.setSources(documents.stream()
                .map(BoundDocument::filename)
                .distinct()
                .toList());

        log.debug("Knowledge base kept {} chunk(s) from {} document(s) for workflow {}",
                kept.size(), documents.size(), context.getWorkflowId());
    }

    /**
     * One lookup per document, at most {@code retrievalConcurrency} in flight. Results come back
     * in document order regardless of completion order.
     */
    private List<List<RetrievedChunk>> search(ExecutionContext context,
                                              List<BoundDocument> documents,
                                              int resultCount,
                                              ExecutionCollaborators collaborators) {
        String query = context.getQuery();
        int concurrency = Math.max(1, properties.getRetrievalConcurrency());

        Mono<List<List<RetrievedChunk>>> lookups = Flux.fromIterable(documents)
                .flatMapSequential(document -> Mono
                                .fromCallable(() -> collaborators.vectorIndex()
                                        .searchSimilar(query, resultCount, document.id()))
                                .subscribeOn(Schedulers.boundedElastic())
                                .defaultIfEmpty(List.of())
                                .onErrorMap(ex -> !(ex instanceof WorkflowException),
                                        ex -> new UpstreamFailureException(
                                                "Retrieval failed for document " + document.id() + ": " + ex.getMessage(), ex)),
                        concurrency)
                .collectList();

        return context.getDeadline().await("retrieval", lookups);
    }

    /**
     * Concatenate per-document hits, sort by score descending and keep the first {@code limit}.
     * The sort is stable, so equal scores keep their retrieval order.
     */
    static List<RetrievedChunk> mergeTopResults(List<List<RetrievedChunk>> perDocument, int limit) {
        List<RetrievedChunk> merged = new ArrayList<>();
        perDocument.forEach(merged::addAll);
        merged.sort(Comparator.comparingDouble(RetrievedChunk::score).reversed());
        return merged.size() > limit ? List.copyOf(merged.subList(0, limit)) : List.copyOf(merged);
    }
}
