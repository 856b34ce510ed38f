package com.example.RagFlow.exception;

public class SessionBusyException extends WorkflowException {

    public SessionBusyException(Long sessionId) {
        super(ErrorKind.SESSION_BUSY, "Chat session " + sessionId + " is already running a turn");
    }
}
