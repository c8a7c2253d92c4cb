package com.forge.forge_orchestrator.executor.llm;

import com.forge.forge_orchestrator.exception.GenerationException;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * System prompts for the four agent roles a node can name.
 * Roles match case-insensitively and accept the informal aliases below.
 */
public final class AgentPrompts {

    public static final String ARCHITECT      = "Architect";
    public static final String IMPLEMENTATION = "Implementation";
    public static final String TEST           = "Test";
    public static final String OPTIMIZER      = "Optimizer";

    public static final List<String> CANONICAL_ROLES = List.of(ARCHITECT, IMPLEMENTATION, TEST, OPTIMIZER);

    private static final Map<String, String> ALIASES = Map.of(
            "planner",   ARCHITECT,
            "coder",     IMPLEMENTATION,
            "developer", IMPLEMENTATION,
            "dev",       IMPLEMENTATION,
            "tester",    TEST,
            "qa",        TEST,
            "auditor",   OPTIMIZER,
            "optimizer", OPTIMIZER
    );

    private static final Map<String, String> PROMPTS = Map.of(
            ARCHITECT, """
                    You are the Forge planning agent. Turn a verbose, high-level goal into a short,
                    ordered, machine-readable JSON contract that worker agents can act on.
                    Keep it token-efficient and sequenced. Do not write code or converse.
                    Output only the JSON contract.
                    """,
            IMPLEMENTATION, """
                    You are the Forge implementation agent. Implement exactly what the contract you
                    are given describes. Comment the code plainly. Any UI change ships with a test
                    that exercises it. Output the changed files and their tests; do not ask questions.
                    If you cannot finish, output a JSON object with a "failure_report" field.
                    """,
            TEST, """
                    You are the Forge test agent. Validate the code and results you are given.
                    Judge user-visible behaviour and functional correctness first. Do not write new
                    code and do not assume success; report concrete defects.
                    """,
            OPTIMIZER, """
                    You are the Forge cost optimizer. Review the execution log you are given
                    (flow id, model, input/output tokens, failure reason) and find token waste.
                    Output a JSON object with a "suggestion" field and an "estimated_savings" field.
                    The suggestion must be a concrete change.
                    """
    );

    private AgentPrompts() {}

    /** Canonical role name, or empty when the role is not recognised. */
    public static Optional<String> resolveRole(String role) {
        if (role == null) return Optional.empty();
        String trimmed = role.trim();
        String alias = ALIASES.get(trimmed.toLowerCase(Locale.ROOT));
        if (alias != null) return Optional.of(alias);
        return CANONICAL_ROLES.stream().filter(r -> r.equalsIgnoreCase(trimmed)).findFirst();
    }

    public static String systemPromptFor(String role) {
        return resolveRole(role)
                .map(PROMPTS::get)
                .orElseThrow(() -> new GenerationException("unknown agent role: " + role));
    }
}
