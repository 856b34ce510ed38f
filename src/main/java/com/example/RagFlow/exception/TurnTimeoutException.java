package com.example.RagFlow.exception;

import java.time.Duration;

public class TurnTimeoutException extends WorkflowException {

    public TurnTimeoutException(String stage, Duration budget) {
        super(ErrorKind.TIMEOUT, "Turn exceeded its " + budget.toMillis() + " ms deadline during " + stage);
    }
}
