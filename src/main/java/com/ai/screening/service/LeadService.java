package com.ai.screening.service;

import com.ai.screening.dto.GenerationResult;
import com.ai.screening.entity.Conversation;
import com.ai.screening.entity.Lead;
import com.ai.screening.entity.LeadStatus;
import com.ai.screening.exception.ScreeningErrorCode;
import com.ai.screening.exception.ScreeningException;
import com.ai.screening.repository.ConversationRepository;
import com.ai.screening.repository.LeadRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Owns every write to Lead rows, including status transitions and follow-up fields.
 * Each public method runs in its own transaction. Writes are reached through LeadScreeningOrchestrator,
 * which holds the contact's lock around the whole transaction.
 */
@Service
public class LeadService {

    private static final Logger log = LoggerFactory.getLogger(LeadService.class);

    private final LeadRepository leadRepository;
    private final ConversationRepository conversationRepository;
    private final Clock clock;
    private final Duration followUpDelay;

    public LeadService(LeadRepository leadRepository,
                       ConversationRepository conversationRepository,
                       Clock clock,
                       @Value("${screening.follow-up-hours:2}") long followUpHours) {
        this.leadRepository = leadRepository;
        this.conversationRepository = conversationRepository;
        this.clock = clock;
        this.followUpDelay = Duration.ofHours(followUpHours);
    }

    /**
     * Finds or creates the lead for a phone, moves NEW leads into screening and refreshes last interaction.
     */
    @Transactional
    public Lead openTurn(String phone) {
        Instant now = clock.instant();
        Lead lead = leadRepository.findByPhone(phone).orElse(null);
        if (lead == null) {
            lead = leadRepository.saveAndFlush(Lead.builder()
                    .phone(phone)
                    .status(LeadStatus.NEW)
                    .firstContactAt(now)
                    .lastInteractionAt(now)
                    .build());
            log.info("[lead={}] new lead created phone={}", lead.getId(), phone);
        }
        if (lead.getStatus() == LeadStatus.NEW) {
            transition(lead, LeadStatus.IN_SCREENING);
        }
        lead.setLastInteractionAt(now);
        return leadRepository.save(lead);
    }

    /**
     * Appends the exchange and re-arms the follow-up deadline if the lead is still awaiting a reply.
     */
    @Transactional
    public Lead completeTurn(UUID leadId, String inboundText, GenerationResult generation) {
        Lead lead = require(leadId);
        conversationRepository.save(Conversation.builder()
                .lead(lead)
                .inboundText(inboundText)
                .outboundText(generation.getText())
                .tokensInput(generation.getTokensInput())
                .tokensOutput(generation.getTokensOutput())
                .tokensTotal(generation.getTokensTotal())
                .costCents(generation.getCostCents())
                .latencyMs(generation.getLatencyMs())
                .timestamp(clock.instant())
                .build());

        if (lead.getStatus() == LeadStatus.AWAITING_RESPONSE) {
            lead.markForFollowUp(clock.instant(), followUpDelay);
            log.debug("[lead={}] follow-up due at {}", leadId, lead.getNextFollowUpAt());
        }
        return leadRepository.save(lead);
    }

    /**
     * Records the eligibility outcome and moves the lead to AWAITING_RESPONSE or NOT_ELIGIBLE.
     */
    @Transactional
    public Lead applyEligibility(UUID leadId, boolean eligible) {
        Lead lead = require(leadId);
        lead.setEligible(eligible);
        transition(lead, eligible ? LeadStatus.AWAITING_RESPONSE : LeadStatus.NOT_ELIGIBLE);
        return leadRepository.save(lead);
    }

    @Transactional
    public Lead assignRegion(UUID leadId, String regionCode) {
        String code = StringUtils.trimToEmpty(regionCode).toUpperCase(Locale.ROOT);
        if (code.length() != 2 || !StringUtils.isAlpha(code)) {
            throw new ScreeningException(ScreeningErrorCode.INVALID_REGION,
                    "Region must be a 2-letter state code (e.g. RS, SP)");
        }
        Lead lead = require(leadId);
        lead.setRegion(code);
        return leadRepository.save(lead);
    }

    @Transactional
    public Lead markAwaitingResponse(UUID leadId) {
        Lead lead = require(leadId);
        transition(lead, LeadStatus.AWAITING_RESPONSE);
        lead.markForFollowUp(clock.instant(), followUpDelay);
        return leadRepository.save(lead);
    }

    /** Invoked by the follow-up sweep after a re-engagement message goes out. */
    @Transactional
    public Lead recordFollowUpAttempt(UUID leadId) {
        Lead lead = require(leadId);
        lead.incrementFollowUpAttempts(clock.instant());
        log.info("[lead={}] follow-up attempt #{}", leadId, lead.getFollowUpAttempts());
        return leadRepository.save(lead);
    }

    @Transactional(readOnly = true)
    public List<Lead> findDueForFollowUp(Instant now) {
        return leadRepository.findByNextFollowUpAtLessThanEqualOrderByNextFollowUpAtAsc(now);
    }

    @Transactional(readOnly = true)
    public Lead get(UUID leadId) {
        return require(leadId);
    }

    private Lead require(UUID leadId) {
        return leadRepository.findById(leadId).orElseThrow(() -> ScreeningException.leadNotFound(leadId));
    }

    /** The log line is the only status history kept; it is written for every transition, repeated ones included. */
    private void transition(Lead lead, LeadStatus newStatus) {
        LeadStatus old = lead.getStatus();
        lead.setStatus(newStatus);
        log.info("[lead={}] status {} -> {}", lead.getId(), old, newStatus);
    }
}
