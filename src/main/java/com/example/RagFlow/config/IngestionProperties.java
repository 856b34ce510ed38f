package com.example.RagFlow.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "ragflow.ingestion")
public class IngestionProperties {

    private int chunkSize = 1000;

    private int chunkOverlap = 200;

    private long maxFileSize = 10 * 1024 * 1024;
}
