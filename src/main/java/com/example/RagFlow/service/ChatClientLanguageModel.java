package com.example.RagFlow.service;

import com.example.RagFlow.config.EngineProperties;
import com.example.RagFlow.exception.UpstreamFailureException;
import com.example.RagFlow.model.ModelOutput;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * {@link LanguageModel} over the Spring AI ChatClient beans.
 * <p>
 * A candidate is either {@code provider:model} or a bare model name on the default provider.
 * Candidates are tried in order; a provider without a client, a failed call or a blank answer
 * moves on to the next one. Only the candidate that actually answered is reported.
 */
@Service
@RequiredArgsConstructor
public class ChatClientLanguageModel implements LanguageModel {

    private static final Logger log = LoggerFactory.getLogger(ChatClientLanguageModel.class);

    private final ProviderChatClients chatClients;
    private final EngineProperties properties;

    @Override
    public ModelOutput generate(String systemPrompt, String userMessage, List<String> candidateModels, double temperature) {
        RuntimeException lastError = null;
        for (String candidate : candidateModels) {
            Candidate resolved = Candidate.parse(candidate, properties.getDefaultProvider());
            Optional<ChatClient> client = chatClients.find(resolved.provider());
            if (client.isEmpty()) {
                lastError = new IllegalStateException("No chat client for provider '" + resolved.provider() + "'");
                log.warn("Skipping model {}:{}: provider not configured", resolved.provider(), resolved.model());
                continue;
            }
            try {
                String answer = client.get().prompt()
                        .system(systemPrompt)
                        .user(userMessage)
                        .options(ChatOptions.builder()
                                .model(resolved.model())
                                .temperature(temperature)
                                .build())
                        .call()
                        .content();
                if (answer != null && !answer.isBlank()) {
                    log.debug("Model {}:{} answered", resolved.provider(), resolved.model());
                    return new ModelOutput(answer, resolved.model(), resolved.provider());
                }
                log.warn("Model {}:{} returned no text", resolved.provider(), resolved.model());
            } catch (RuntimeException ex) {
                lastError = ex;
                log.warn("Model {}:{} failed: {}", resolved.provider(), resolved.model(), ex.getMessage());
            }
        }

        String reason = lastError == null ? "no candidate returned text" : lastError.getMessage();
        throw new UpstreamFailureException("All model attempts failed. Last error: " + reason, lastError);
    }

    record Candidate(String provider, String model) {

        static Candidate parse(String candidate, String defaultProvider) {
            int separator = candidate.indexOf(':');
            if (separator > 0 && separator < candidate.length() - 1) {
                return new Candidate(candidate.substring(0, separator).trim(), candidate.substring(separator + 1).trim());
            }
            return new Candidate(defaultProvider, candidate.trim());
        }
    }
}
