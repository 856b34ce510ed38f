package com.example.RagFlow.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Error body returned by every endpoint.
 *
 * @param code    {@code ErrorKind} name, or {@code BAD_REQUEST} / {@code INTERNAL_ERROR}
 * @param details validation errors or unresolved component ids, when the failure has them
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(
        String code,
        String message,
        Object details
) {
}
