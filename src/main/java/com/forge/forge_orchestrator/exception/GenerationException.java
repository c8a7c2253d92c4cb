package com.forge.forge_orchestrator.exception;

/**
 * Failure reported by the generation service. Carries whatever usage the
 * provider billed before failing so it can still be reported and logged.
 */
public class GenerationException extends FlowExecutionException {

    private final int inputTokens;
    private final int outputTokens;
    private final double cost;

    public GenerationException(String message) {
        this(message, 0, 0, 0.0);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
        this.inputTokens = 0;
        this.outputTokens = 0;
        this.cost = 0.0;
    }

    public GenerationException(String message, int inputTokens, int outputTokens, double cost) {
        super(message);
        this.inputTokens = inputTokens;
        this.outputTokens = outputTokens;
        this.cost = cost;
    }

    public int getInputTokens()  { return inputTokens; }
    public int getOutputTokens() { return outputTokens; }
    public double getCost()      { return cost; }
}
