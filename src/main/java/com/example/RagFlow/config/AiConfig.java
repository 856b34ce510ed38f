package com.example.RagFlow.config;

import com.example.RagFlow.service.ProviderChatClients;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.deepseek.DeepSeekChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds a ChatClient for every chat model that auto-configuration produced. The models are
 * looked up when the bean is created, after auto-configuration has registered them.
 * System prompts are set per request by the LLM engine component, so no default system is configured.
 */
@Configuration
public class AiConfig {

    private static final Logger log = LoggerFactory.getLogger(AiConfig.class);

    @Bean
    public ProviderChatClients providerChatClients(
            ObjectProvider<DeepSeekChatModel> deepSeekProvider,
            ObjectProvider<OpenAiChatModel> openAiProvider
    ) {
        Map<String, ChatClient> clients = new LinkedHashMap<>();
        deepSeekProvider.ifAvailable(model -> clients.put("deepseek", ChatClient.builder(model).build()));
        openAiProvider.ifAvailable(model -> clients.put("openai", ChatClient.builder(model).build()));

        if (clients.isEmpty()) {
            log.warn("No chat model is configured; every LLM engine component will fail");
        } else {
            log.info("Chat clients available for providers {}", clients.keySet());
        }
        return new ProviderChatClients(clients);
    }
}
