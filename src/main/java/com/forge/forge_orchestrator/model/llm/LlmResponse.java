package com.forge.forge_orchestrator.model.llm;

/**
 * Provider-agnostic response returned by every LlmClient.
 * Token counts are kept on failures too when the provider reported them.
 */
public class LlmResponse {

    private boolean success;
    private String  rawText;       // exact text the model returned
    private String  errorMessage;  // populated if success = false
    private int     inputTokens;
    private int     outputTokens;
    private String  model;         // actual model used (provider may differ from requested)

    private LlmResponse() {}

    public static LlmResponse ok(String rawText, String model, int in, int out) {
        LlmResponse r = new LlmResponse();
        r.success      = true;
        r.rawText      = rawText;
        r.model        = model;
        r.inputTokens  = in;
        r.outputTokens = out;
        return r;
    }

    public static LlmResponse error(String message) {
        LlmResponse r = new LlmResponse();
        r.success      = false;
        r.errorMessage = message;
        return r;
    }

    public static LlmResponse error(String message, int in, int out) {
        LlmResponse r = error(message);
        r.inputTokens  = in;
        r.outputTokens = out;
        return r;
    }

    public boolean isSuccess()           { return success; }
    public String getRawText()           { return rawText; }
    public String getErrorMessage()      { return errorMessage; }
    public int getInputTokens()          { return inputTokens; }
    public int getOutputTokens()         { return outputTokens; }
    public String getModel()             { return model; }
}
