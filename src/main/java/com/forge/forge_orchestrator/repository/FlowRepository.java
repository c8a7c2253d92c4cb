package com.forge.forge_orchestrator.repository;

import com.forge.forge_orchestrator.model.domain.Flow;
import org.springframework.data.jpa.repository.JpaRepository;

public interface FlowRepository extends JpaRepository<Flow, Long> {

    boolean existsByName(String name);
}
