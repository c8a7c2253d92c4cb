package com.forge.forge_orchestrator.exception;

public class MissingCredentialException extends FlowExecutionException {

    private final String providerName;

    public MissingCredentialException(String providerName) {
        super("missing API key for provider " + providerName);
        this.providerName = providerName;
    }

    public String getProviderName() {
        return providerName;
    }
}
