package com.example.RagFlow.model;

/**
 * Built-in component types. Workflow definitions carry the type as a plain string,
 * so handlers for additional types can be registered without touching this enum.
 */
public enum ComponentType {
    USER_QUERY("user_query"),
    KNOWLEDGE_BASE("knowledge_base"),
    LLM_ENGINE("llm_engine"),
    OUTPUT("output");

    private final String wireName;

    ComponentType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean matches(String type) {
        return wireName.equals(type);
    }
}
