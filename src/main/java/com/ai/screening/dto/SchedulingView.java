package com.ai.screening.dto;

import com.ai.screening.entity.Scheduling;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.UUID;

@Getter
@Builder
public class SchedulingView {

    private final UUID id;
    private final Instant meetingAt;
    private final String status;
    private final String assignedAgent;
    private final String agentEmail;
    private final String notes;
    private final boolean upcoming;
    private final boolean past;

    public static SchedulingView from(Scheduling s, Instant now) {
        return SchedulingView.builder()
                .id(s.getId())
                .meetingAt(s.getMeetingAt())
                .status(s.getStatus().getCode())
                .assignedAgent(s.getAssignedAgent())
                .agentEmail(s.getAgentEmail())
                .notes(s.getNotes())
                .upcoming(s.isUpcoming(now))
                .past(s.isPast(now))
                .build();
    }
}
