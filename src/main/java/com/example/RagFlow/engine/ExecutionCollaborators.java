package com.example.RagFlow.engine;

import com.example.RagFlow.service.DocumentStore;
import com.example.RagFlow.service.LanguageModel;
import com.example.RagFlow.service.VectorIndex;

/**
 * External services a component handler may call during dispatch.
 */
public record ExecutionCollaborators(
        DocumentStore documentStore,
        VectorIndex vectorIndex,
        LanguageModel languageModel
) {
}
