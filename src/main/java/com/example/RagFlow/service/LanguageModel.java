package com.example.RagFlow.service;

import com.example.RagFlow.model.ModelOutput;

import java.util.List;

public interface LanguageModel {

    /**
     * Try each candidate model in order and return the first non-empty answer.
     *
     * @throws com.example.RagFlow.exception.UpstreamFailureException when every candidate fails
     *                                                                or answers with nothing
     */
    ModelOutput generate(String systemPrompt, String userMessage, List<String> candidateModels, double temperature);
}
