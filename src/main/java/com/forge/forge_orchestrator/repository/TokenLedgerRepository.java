package com.forge.forge_orchestrator.repository;

import com.forge.forge_orchestrator.model.domain.TokenLedgerEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface TokenLedgerRepository extends JpaRepository<TokenLedgerEntry, Long> {

    List<TokenLedgerEntry> findByFlowIdOrderByTimestampAsc(Long flowId);

    List<TokenLedgerEntry> findAllByOrderByTimestampDesc(Pageable pageable);

    @Query("SELECT COALESCE(SUM(e.totalCostUsd), 0.0) FROM TokenLedgerEntry e WHERE e.timestamp >= :since")
    double sumCostSince(@Param("since") Instant since);
}
