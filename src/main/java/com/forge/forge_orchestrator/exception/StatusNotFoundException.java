package com.forge.forge_orchestrator.exception;

public class StatusNotFoundException extends NotFoundException {

    public StatusNotFoundException(long flowId) {
        super("status not found for flow " + flowId);
    }
}
