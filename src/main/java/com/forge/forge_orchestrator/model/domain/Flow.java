package com.forge.forge_orchestrator.model.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

@Entity
@Table(name = "flows")
@Data
public class Flow {

    public static final String EMPTY_GRAPH = "{\"nodes\":[],\"edges\":[]}";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String name;

    private String description;

    /** Serialized canvas: {"nodes":[...], "edges":[...]}. Exposed as "data" to the editor. */
    @JsonProperty("data")
    @Column(name = "graph_json", nullable = false, length = 1_000_000)
    private String graphJson = EMPTY_GRAPH;

    @Enumerated(EnumType.STRING)
    private FlowDefinitionStatus status = FlowDefinitionStatus.DRAFT;

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at")
    private Instant updatedAt = Instant.now();

    @PreUpdate
    public void onUpdate() {
        updatedAt = Instant.now();
    }
}
