package com.forge.forge_orchestrator.exception;

public class FlowParseException extends FlowExecutionException {

    public FlowParseException(String message) {
        super(message);
    }

    public FlowParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
