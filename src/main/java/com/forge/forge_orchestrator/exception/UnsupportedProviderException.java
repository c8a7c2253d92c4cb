package com.forge.forge_orchestrator.exception;

public class UnsupportedProviderException extends FlowExecutionException {

    private final String providerName;

    public UnsupportedProviderException(String providerName) {
        super("unsupported provider: " + providerName);
        this.providerName = providerName;
    }

    public String getProviderName() {
        return providerName;
    }
}
