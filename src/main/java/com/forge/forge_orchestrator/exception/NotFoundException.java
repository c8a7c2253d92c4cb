package com.forge.forge_orchestrator.exception;

public class NotFoundException extends ForgeException {

    public NotFoundException(String message) {
        super(message);
    }
}
