package com.forge.forge_orchestrator.model.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** One row per agent-node attempt. Written once, never updated. */
@Entity
@Table(name = "token_ledger", indexes = @Index(name = "idx_ledger_flow_id", columnList = "flow_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenLedgerEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Builder.Default
    @Column(nullable = false)
    private Instant timestamp = Instant.now();

    @Column(name = "flow_id", nullable = false)
    private Long flowId;

    // Provider name as written on the node
    @Column(nullable = false)
    private String provider;

    @Column(name = "agent_role")
    private String agentRole;

    // SHA-256 of the prompt; the prompt itself is not stored
    @Column(name = "prompt_hash", nullable = false)
    private String promptHash;

    @Column(name = "input_tokens", nullable = false)
    private int inputTokens;

    @Column(name = "output_tokens", nullable = false)
    private int outputTokens;

    @Column(name = "total_cost_usd", nullable = false)
    private double totalCostUsd;

    @Column(name = "latency_ms", nullable = false)
    private long latencyMs;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private LedgerStatus status;

    @Column(name = "error_message", length = 4000)
    private String errorMessage;
}
