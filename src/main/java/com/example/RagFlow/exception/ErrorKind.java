package com.example.RagFlow.exception;

public enum ErrorKind {
    VALIDATION,
    NOT_FOUND,
    CYCLE_DETECTED,
    UPSTREAM_FAILURE,
    TIMEOUT,
    SESSION_BUSY
}
