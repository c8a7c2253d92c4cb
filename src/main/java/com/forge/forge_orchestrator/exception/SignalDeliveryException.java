package com.forge.forge_orchestrator.exception;

/** A status or lifecycle signal could not be delivered on one channel. */
public class SignalDeliveryException extends ForgeException {

    public SignalDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
