package com.ai.screening.repository;

import com.ai.screening.entity.Conversation;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ConversationRepository extends JpaRepository<Conversation, UUID> {

    /** Newest first; callers reverse for chronological order. Insertion time breaks timestamp ties. */
    List<Conversation> findByLead_IdOrderByTimestampDescCreatedAtDesc(UUID leadId, Pageable pageable);

    List<Conversation> findByLead_IdOrderByTimestampAscCreatedAtAsc(UUID leadId);

    long countByLead_Id(UUID leadId);

    @Query("SELECT COALESCE(SUM(c.tokensTotal), 0) FROM Conversation c")
    Long sumTokensTotal();

    @Query("SELECT COALESCE(SUM(c.costCents), 0) FROM Conversation c")
    Long sumCostCents();

    @Query("SELECT COALESCE(AVG(c.latencyMs), 0.0) FROM Conversation c")
    Double averageLatencyMs();
}
