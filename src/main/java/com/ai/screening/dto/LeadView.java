package com.ai.screening.dto;

import com.ai.screening.entity.Lead;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.UUID;

@Getter
@Builder
public class LeadView {

    private final UUID id;
    private final String phone;
    private final String name;
    private final String email;
    private final String region;
    private final String city;
    private final String interest;
    private final String availability;
    private final String status;
    private final Boolean eligible;
    private final int followUpAttempts;
    private final Instant lastFollowUpAt;
    private final Instant nextFollowUpAt;
    private final Instant preferredMeetingAt;
    private final String preferredTime;
    private final Instant firstContactAt;
    private final Instant lastInteractionAt;
    private final Instant createdAt;
    private final Instant updatedAt;

    public static LeadView from(Lead lead) {
        return LeadView.builder()
                .id(lead.getId())
                .phone(lead.getPhone())
                .name(lead.getName())
                .email(lead.getEmail())
                .region(lead.getRegion())
                .city(lead.getCity())
                .interest(lead.getInterest())
                .availability(lead.getAvailability())
                .status(lead.getStatus() != null ? lead.getStatus().getCode() : null)
                .eligible(lead.getEligible())
                .followUpAttempts(lead.getFollowUpAttempts())
                .lastFollowUpAt(lead.getLastFollowUpAt())
                .nextFollowUpAt(lead.getNextFollowUpAt())
                .preferredMeetingAt(lead.getPreferredMeetingAt())
                .preferredTime(lead.getPreferredTime())
                .firstContactAt(lead.getFirstContactAt())
                .lastInteractionAt(lead.getLastInteractionAt())
                .createdAt(lead.getCreatedAt())
                .updatedAt(lead.getUpdatedAt())
                .build();
    }
}
