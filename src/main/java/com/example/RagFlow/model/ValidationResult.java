package com.example.RagFlow.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ValidationResult(
        List<String> errors,
        List<String> warnings
) {
    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    /** Warnings never make a workflow invalid. */
    @JsonProperty("isValid")
    public boolean isValid() {
        return errors.isEmpty();
    }
}
