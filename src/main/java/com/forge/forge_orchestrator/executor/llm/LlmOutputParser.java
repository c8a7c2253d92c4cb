package com.forge.forge_orchestrator.executor.llm;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Helpers for turning raw model output into something a downstream node can use. */
public final class LlmOutputParser {

    private static final Pattern ANSI_ESCAPE    = Pattern.compile("\u001B\\[[0-9;]*m");
    private static final Pattern INPUT_TOKENS   = Pattern.compile("(?i)Input Tokens:\\s*(\\d+)");
    private static final Pattern OUTPUT_TOKENS  = Pattern.compile("(?i)Output Tokens:\\s*(\\d+)");

    private LlmOutputParser() {}

    public static String clean(String raw) {
        return raw == null ? "" : ANSI_ESCAPE.matcher(raw).replaceAll("");
    }

    /**
     * Returns the last balanced {@code {...}} block, scanning back from the final
     * closing brace. Braces inside string literals are not special-cased.
     */
    public static Optional<String> extractJson(String text) {
        if (text == null) return Optional.empty();
        int end = text.lastIndexOf('}');
        if (end < 0) return Optional.empty();
        int balance = 0;
        for (int i = end; i >= 0; i--) {
            char c = text.charAt(i);
            if (c == '}') {
                balance++;
            } else if (c == '{') {
                balance--;
            }
            if (balance == 0) {
                return Optional.of(text.substring(i, end + 1));
            }
        }
        return Optional.empty();
    }

    /** Scrapes "Input Tokens: N" / "Output Tokens: N" from text; missing counts are 0. */
    public static int[] scrapeTokenCounts(String text) {
        return new int[]{firstNumber(INPUT_TOKENS, text), firstNumber(OUTPUT_TOKENS, text)};
    }

    private static int firstNumber(Pattern pattern, String text) {
        if (text == null) return 0;
        Matcher m = pattern.matcher(text);
        if (!m.find()) return 0;
        try {
            return Integer.parseInt(m.group(1));
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
