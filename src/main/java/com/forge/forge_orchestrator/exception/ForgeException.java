package com.forge.forge_orchestrator.exception;

/**
 * Root of every error this service raises on purpose.
 * Unchecked, so callers only catch what they can act on.
 */
public class ForgeException extends RuntimeException {

    public ForgeException(String message) {
        super(message);
    }

    public ForgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
