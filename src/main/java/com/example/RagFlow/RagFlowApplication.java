package com.example.RagFlow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class RagFlowApplication {

    public static void main(String[] args) {
        SpringApplication.run(RagFlowApplication.class, args);
    }
}
