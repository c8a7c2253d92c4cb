package com.forge.forge_orchestrator.engine;

import com.forge.forge_orchestrator.exception.FlowNotFoundException;
import com.forge.forge_orchestrator.exception.GenerationException;
import com.forge.forge_orchestrator.exception.LedgerWriteException;
import com.forge.forge_orchestrator.exception.UnsupportedProviderException;
import com.forge.forge_orchestrator.executor.llm.GenerationService;
import com.forge.forge_orchestrator.model.domain.LedgerStatus;
import com.forge.forge_orchestrator.model.domain.LlmProvider;
import com.forge.forge_orchestrator.model.domain.TokenLedgerEntry;
import com.forge.forge_orchestrator.model.graph.FlowGraph;
import com.forge.forge_orchestrator.model.graph.FlowGraphNode;
import com.forge.forge_orchestrator.model.graph.NodeData;
import com.forge.forge_orchestrator.model.llm.GenerationResult;
import com.forge.forge_orchestrator.repository.FlowRepository;
import com.forge.forge_orchestrator.service.CredentialService;
import com.forge.forge_orchestrator.service.LedgerService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.concurrent.TimeUnit;

/**
 * Runs a stored flow's agent nodes one after another, in the order they
 * appear in the graph. The first failing node stops the run.
 */
@Slf4j
@Service
public class FlowExecutionEngine {

    private final FlowRepository          flowRepository;
    private final FlowGraphParser         graphParser;
    private final CredentialService       credentialService;
    private final GenerationService       generationService;
    private final LedgerService           ledgerService;
    private final ExecutionEventPublisher eventPublisher;

    public FlowExecutionEngine(FlowRepository flowRepository,
                               FlowGraphParser graphParser,
                               CredentialService credentialService,
                               GenerationService generationService,
                               LedgerService ledgerService,
                               ExecutionEventPublisher eventPublisher) {
        this.flowRepository = flowRepository;
        this.graphParser = graphParser;
        this.credentialService = credentialService;
        this.generationService = generationService;
        this.ledgerService = ledgerService;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Executes the flow on the calling thread.
     *
     * @return totals for a run that completed
     * @throws com.forge.forge_orchestrator.exception.ForgeException whatever aborted the run,
     *         after FLOW_FAILED and the FAILED status have been emitted
     */
    public FlowRunResult execute(long flowId) {
        long startNanos = System.nanoTime();
        log.info("Flow {} started", flowId);
        eventPublisher.flowStarted(flowId);

        String lastNode = null;
        int nodesExecuted = 0;
        double totalCost = 0.0;
        try {
            FlowGraph graph = loadGraph(flowId);

            for (FlowGraphNode node : graph.agentNodes()) {
                lastNode = node.id();
                totalCost += runAgentNode(flowId, node);
                nodesExecuted++;
            }
        } catch (RuntimeException e) {
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("Flow {} failed at node {}: {}", flowId, lastNode, error);
            eventPublisher.flowFailed(flowId, lastNode, error);
            throw e;
        }

        long executionTimeMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        eventPublisher.flowCompleted(flowId, lastNode, executionTimeMs);
        log.info("Flow {} completed: {} agent node(s), ${} in {} ms",
                flowId, nodesExecuted, String.format("%.6f", totalCost), executionTimeMs);
        return new FlowRunResult(flowId, nodesExecuted, totalCost, executionTimeMs);
    }

    private FlowGraph loadGraph(long flowId) {
        String graphJson = flowRepository.findById(flowId)
                .orElseThrow(() -> new FlowNotFoundException(flowId))
                .getGraphJson();
        return graphParser.parse(graphJson);
    }

    /** Returns the node's cost; throws to abort the run. */
    private double runAgentNode(long flowId, FlowGraphNode node) {
        NodeData data = node.data();
        eventPublisher.nodeStarted(flowId, node.id(), data.label());
        log.info("Flow {} node {} ({}) started on {}", flowId, node.id(), data.role(), data.provider());

        String apiKey = credentialService.requireApiKey(data.provider());
        LlmProvider provider = LlmProvider.fromName(data.provider())
                .orElseThrow(() -> new UnsupportedProviderException(data.provider()));

        long callStart = System.nanoTime();
        try {
            GenerationResult result = generationService.execute(data.role(), data.prompt(), apiKey, provider);
            long latencyMs = elapsedMs(callStart);

            eventPublisher.nodeCompleted(flowId, node.id(), result.inputTokens(), result.outputTokens(), result.cost());
            record(TokenLedgerEntry.builder()
                    .flowId(flowId)
                    .provider(provider.getDisplayName())
                    .agentRole(data.role())
                    .promptHash(sha256(data.prompt()))
                    .inputTokens(result.inputTokens())
                    .outputTokens(result.outputTokens())
                    .totalCostUsd(result.cost())
                    .latencyMs(latencyMs)
                    .status(LedgerStatus.SUCCESS)
                    .build());
            log.info("Flow {} node {} completed: {} in / {} out tokens in {} ms",
                    flowId, node.id(), result.inputTokens(), result.outputTokens(), latencyMs);
            return result.cost();
        } catch (GenerationException e) {
            long latencyMs = elapsedMs(callStart);

            // Usage billed before the failure is still reported.
            eventPublisher.nodeCompleted(flowId, node.id(), e.getInputTokens(), e.getOutputTokens(), e.getCost());
            record(TokenLedgerEntry.builder()
                    .flowId(flowId)
                    .provider(provider.getDisplayName())
                    .agentRole(data.role())
                    .promptHash(sha256(data.prompt()))
                    .inputTokens(e.getInputTokens())
                    .outputTokens(e.getOutputTokens())
                    .totalCostUsd(e.getCost())
                    .latencyMs(latencyMs)
                    .status(LedgerStatus.FAILED)
                    .errorMessage(e.getMessage())
                    .build());
            throw e;
        }
    }

    private void record(TokenLedgerEntry entry) {
        try {
            ledgerService.append(entry);
        } catch (LedgerWriteException e) {
            log.warn("Ledger entry for flow {} not recorded: {}", entry.getFlowId(), e.getMessage());
        }
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((text != null ? text : "").getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
