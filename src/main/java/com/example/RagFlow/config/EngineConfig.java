package com.example.RagFlow.config;

import com.example.RagFlow.engine.ComponentHandlerRegistry;
import com.example.RagFlow.engine.ExecutionCollaborators;
import com.example.RagFlow.engine.ExecutionOrderResolver;
import com.example.RagFlow.engine.GraphValidator;
import com.example.RagFlow.service.DocumentStore;
import com.example.RagFlow.service.LanguageModel;
import com.example.RagFlow.service.VectorIndex;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EngineConfig {

    @Bean
    public ExecutionOrderResolver executionOrderResolver() {
        return new ExecutionOrderResolver();
    }

    @Bean
    public GraphValidator graphValidator(ComponentHandlerRegistry handlerRegistry,
                                         ExecutionOrderResolver orderResolver,
                                         EngineProperties properties) {
        return new GraphValidator(handlerRegistry.supportedTypes(), orderResolver, properties.isStrictValidation());
    }

    @Bean
    public ExecutionCollaborators executionCollaborators(DocumentStore documentStore,
                                                         VectorIndex vectorIndex,
                                                         LanguageModel languageModel) {
        return new ExecutionCollaborators(documentStore, vectorIndex, languageModel);
    }
}
