package com.ai.screening.repository;

import com.ai.screening.entity.Lead;
import com.ai.screening.entity.LeadStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface LeadRepository extends JpaRepository<Lead, UUID> {

    Optional<Lead> findByPhone(String phone);

    long countByCreatedAtGreaterThanEqual(Instant since);

    Page<Lead> findByStatus(LeadStatus status, Pageable pageable);

    List<Lead> findByNextFollowUpAtLessThanEqualOrderByNextFollowUpAtAsc(Instant now);

    @Query("SELECT l.status, COUNT(l) FROM Lead l GROUP BY l.status")
    List<Object[]> countGroupedByStatus();
}
