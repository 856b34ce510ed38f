package com.example.RagFlow.model;

/**
 * Result of a language model call.
 *
 * @param text      generated answer
 * @param modelUsed the candidate that produced it
 * @param provider  provider key of the chat client, e.g. "deepseek"
 */
public record ModelOutput(String text, String modelUsed, String provider) {
}
