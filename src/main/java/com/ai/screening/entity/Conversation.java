package com.ai.screening.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * One inbound/outbound exchange with the screening agent. Never updated after insert.
 */
@Entity
@Table(name = "conversations", indexes = {
    @Index(name = "idx_conversations_lead_id", columnList = "lead_id"),
    @Index(name = "idx_conversations_occurred_at", columnList = "occurred_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Conversation {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "lead_id", nullable = false, updatable = false)
    private Lead lead;

    @Column(name = "inbound_text", columnDefinition = "TEXT", nullable = false, updatable = false)
    private String inboundText;

    @Column(name = "outbound_text", columnDefinition = "TEXT", nullable = false, updatable = false)
    private String outboundText;

    @Column(name = "tokens_input", updatable = false)
    private Integer tokensInput;

    @Column(name = "tokens_output", updatable = false)
    private Integer tokensOutput;

    @Column(name = "tokens_total", updatable = false)
    private Integer tokensTotal;

    /** USD cents */
    @Column(name = "cost_cents", updatable = false)
    private Integer costCents;

    @Column(name = "latency_ms", updatable = false)
    private Long latencyMs;

    /** Orders a lead's history. */
    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant timestamp;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        if (timestamp == null) timestamp = createdAt;
    }
}
