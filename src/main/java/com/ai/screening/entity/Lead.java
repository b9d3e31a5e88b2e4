package com.ai.screening.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Prospective franchisee tracked through screening.
 * Status transitions are driven by LeadService only.
 */
@Entity
@Table(name = "leads", indexes = {
    @Index(name = "idx_leads_phone", columnList = "phone", unique = true),
    @Index(name = "idx_leads_status", columnList = "status"),
    @Index(name = "idx_leads_region", columnList = "region"),
    @Index(name = "idx_leads_next_follow_up", columnList = "next_follow_up_at"),
    @Index(name = "idx_leads_first_contact", columnList = "first_contact_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Lead {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    /** Canonical phone digits, e.g. 5511999999999 */
    @Column(nullable = false, unique = true, length = 20)
    private String phone;

    @Column(length = 255)
    private String name;

    @Column(length = 255)
    private String email;

    /** Brazilian state code, e.g. RS */
    @Column(length = 2)
    private String region;

    @Column(length = 100)
    private String city;

    @Column(length = 500)
    private String interest;

    @Column(length = 500)
    private String availability;

    @Convert(converter = LeadStatusConverter.class)
    @Column(nullable = false, length = 30)
    @Builder.Default
    private LeadStatus status = LeadStatus.NEW;

    /** null until eligibility has been evaluated */
    private Boolean eligible;

    @Column(name = "follow_up_attempts", nullable = false)
    @Builder.Default
    private int followUpAttempts = 0;

    @Column(name = "last_follow_up_at")
    private Instant lastFollowUpAt;

    @Column(name = "next_follow_up_at")
    private Instant nextFollowUpAt;

    @Column(name = "preferred_meeting_at")
    private Instant preferredMeetingAt;

    /** HH:mm */
    @Column(name = "preferred_time", length = 5)
    private String preferredTime;

    @Column(name = "first_contact_at", nullable = false)
    private Instant firstContactAt;

    @Column(name = "last_interaction_at", nullable = false)
    private Instant lastInteractionAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = now;
        if (firstContactAt == null) firstContactAt = now;
        if (lastInteractionAt == null) lastInteractionAt = firstContactAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isOverdueForFollowUp(Instant now) {
        return nextFollowUpAt != null && !now.isBefore(nextFollowUpAt);
    }

    /** Overwrites any previously armed deadline. */
    public void markForFollowUp(Instant now, Duration delay) {
        this.nextFollowUpAt = now.plus(delay);
    }

    public void incrementFollowUpAttempts(Instant now) {
        this.followUpAttempts++;
        this.lastFollowUpAt = now;
    }
}
