package com.forge.forge_orchestrator.exception;

/**
 * Raised when a flow run has to stop. The message is what observers see in
 * {@code FLOW_FAILED} and in the terminal {@code FAILED} status.
 */
public class FlowExecutionException extends ForgeException {

    public FlowExecutionException(String message) {
        super(message);
    }

    public FlowExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
