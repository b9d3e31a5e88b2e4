package com.ai.screening.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Meeting booked with a sales agent. Created by the booking flow; read here for reporting.
 */
@Entity
@Table(name = "schedulings", indexes = {
    @Index(name = "idx_schedulings_lead_id", columnList = "lead_id"),
    @Index(name = "idx_schedulings_meeting_at", columnList = "meeting_at"),
    @Index(name = "idx_schedulings_status", columnList = "status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Scheduling {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "lead_id", nullable = false)
    private Lead lead;

    @Column(name = "meeting_at", nullable = false)
    private Instant meetingAt;

    @Convert(converter = SchedulingStatusConverter.class)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private SchedulingStatus status = SchedulingStatus.SCHEDULED;

    @Column(name = "assigned_agent", length = 255)
    private String assignedAgent;

    @Column(name = "agent_email", length = 255)
    private String agentEmail;

    @Column(length = 500)
    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (meetingAt == null || !meetingAt.isAfter(now)) {
            throw new IllegalStateException("Meeting time must be in the future: " + meetingAt);
        }
        createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isUpcoming(Instant now) {
        return meetingAt.isAfter(now);
    }

    public boolean isPast(Instant now) {
        return meetingAt.isBefore(now);
    }
}
