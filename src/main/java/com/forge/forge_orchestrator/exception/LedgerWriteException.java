package com.forge.forge_orchestrator.exception;

public class LedgerWriteException extends ForgeException {

    public LedgerWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
