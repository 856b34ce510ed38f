package com.example.RagFlow.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
        info = @Info(
                title = "RagFlow API",
                version = "v1",
                description = "Build, validate and run retrieval-augmented chat workflows"
        ),
        tags = {
                @Tag(name = "workflows", description = "Workflow graphs and turn execution"),
                @Tag(name = "chat", description = "Chat sessions and message history"),
                @Tag(name = "documents", description = "Knowledge documents bound to workflows")
        }
)
public class OpenApiConfig {

    @Bean
    public GroupedOpenApi engineApi() {
        return GroupedOpenApi.builder()
                .group("engine")
                .pathsToMatch("/api/workflows/**")
                .build();
    }

    @Bean
    public GroupedOpenApi knowledgeApi() {
        return GroupedOpenApi.builder()
                .group("knowledge")
                .pathsToMatch("/api/chat/**", "/api/documents/**")
                .build();
    }
}
