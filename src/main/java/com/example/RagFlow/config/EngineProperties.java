package com.example.RagFlow.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Workflow engine settings, bound from {@code ragflow.engine.*}.
 */
@Data
@ConfigurationProperties(prefix = "ragflow.engine")
public class EngineProperties {

    /** Wall-clock budget for dispatching one turn. */
    private Duration turnTimeout = Duration.ofSeconds(60);

    /** Max in-flight per-document similarity searches inside a knowledge base component. */
    private int retrievalConcurrency = 4;

    private int defaultResultCount = 3;

    private double defaultTemperature = 0.7;

    private String defaultSystemPrompt = "You are a helpful AI assistant.";

    private String fallbackResponse = "Workflow executed but no response generated";

    /**
     * Models tried in order by the LLM engine component, before the model configured on the
     * component itself. Entries are {@code provider:model} or a bare model on {@link #defaultProvider}.
     */
    private List<String> candidateModels = new ArrayList<>(List.of(
            "deepseek:deepseek-chat",
            "deepseek:deepseek-reasoner",
            "openai:gpt-4o-mini"
    ));

    private String defaultProvider = "deepseek";

    /** Also reject cycles and graphs with no path from a user query to an output. */
    private boolean strictValidation = false;

    private SessionLock sessionLock = new SessionLock();

    @Data
    public static class SessionLock {

        /** Serialize turns per chat session through Redis. */
        private boolean enabled = false;

        /** Lock lease; must outlive {@link EngineProperties#turnTimeout}. */
        private Duration ttl = Duration.ofMinutes(2);
    }
}
