package com.example.RagFlow.service;

import org.springframework.ai.chat.client.ChatClient;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * ChatClients keyed by provider name ("deepseek", "openai"). A provider is present only when
 * its chat model is configured.
 */
public record ProviderChatClients(Map<String, ChatClient> byProvider) {

    public ProviderChatClients {
        byProvider = Map.copyOf(byProvider);
    }

    public Optional<ChatClient> find(String provider) {
        if (provider == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byProvider.get(provider.trim().toLowerCase(Locale.ROOT)));
    }

    public Set<String> providers() {
        return byProvider.keySet();
    }
}
