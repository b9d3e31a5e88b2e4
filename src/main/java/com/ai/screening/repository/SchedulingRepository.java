package com.ai.screening.repository;

import com.ai.screening.entity.Scheduling;
import com.ai.screening.entity.SchedulingStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface SchedulingRepository extends JpaRepository<Scheduling, UUID> {

    List<Scheduling> findByLead_IdOrderByMeetingAtAsc(UUID leadId);

    long countByStatusAndMeetingAtAfter(SchedulingStatus status, Instant now);
}
