package com.ai.screening.service;

import com.ai.screening.dto.ChatTurn;
import com.ai.screening.dto.EligibilityResult;
import com.ai.screening.dto.GenerationResult;
import com.ai.screening.dto.ScreeningResult;
import com.ai.screening.entity.Lead;
import com.ai.screening.exception.ScreeningErrorCode;
import com.ai.screening.exception.ScreeningException;
import com.ai.screening.utils.PhoneNumbers;
import com.ai.screening.utils.TextSanitizer;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;

/**
 * Single entry for inbound lead messages, eligibility checks and admin-side lead writes.
 * Every Lead write happens under the contact's lock; the language-model call never does.
 * receiveMessage and validateEligibility return structured results and do not throw.
 */
@Service
public class LeadScreeningOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(LeadScreeningOrchestrator.class);

    private final LeadService leadService;
    private final ConversationHistoryService historyService;
    private final ResponseGenerator responseGenerator;
    private final SystemPromptLoader promptLoader;
    private final RegionalValidator regionalValidator;
    private final ContactLocks contactLocks;
    private final int maxMessageLength;

    public LeadScreeningOrchestrator(LeadService leadService,
                                     ConversationHistoryService historyService,
                                     ResponseGenerator responseGenerator,
                                     SystemPromptLoader promptLoader,
                                     RegionalValidator regionalValidator,
                                     ContactLocks contactLocks,
                                     @Value("${screening.max-message-length:5000}") int maxMessageLength) {
        this.leadService = leadService;
        this.historyService = historyService;
        this.responseGenerator = responseGenerator;
        this.promptLoader = promptLoader;
        this.regionalValidator = regionalValidator;
        this.contactLocks = contactLocks;
        this.maxMessageLength = maxMessageLength;
    }

    /**
     * Processes one inbound message from a WhatsApp contact key (e.g. 5511999999999@s.whatsapp.net).
     * A lead created or moved into screening before a failed generation stays that way.
     */
    public ScreeningResult receiveMessage(String contactKey, String rawText) {
        Optional<String> canonical = PhoneNumbers.fromContactKey(contactKey);
        if (canonical.isEmpty()) {
            log.warn("Rejected message from invalid contact key={}", contactKey);
            return ScreeningResult.failure(ScreeningErrorCode.INVALID_CONTACT, "Invalid phone format");
        }
        String phone = canonical.get();
        String text = TextSanitizer.sanitize(rawText, maxMessageLength);

        try {
            Lead lead = withContactLock(phone, () -> openTurn(phone));
            UUID leadId = lead.getId();

            List<ChatTurn> history = historyService.buildHistory(leadId);
            GenerationResult generation = responseGenerator.generate(promptLoader.load(), history, text);
            if (!generation.isSuccess()) {
                log.error("[lead={}] reply generation failed: {} {}", leadId,
                        generation.getFailure(), StringUtils.defaultString(generation.getErrorMessage()));
                return ScreeningResult.failure(ScreeningErrorCode.GENERATION_FAILED,
                        "Reply generation failed: " + generation.getFailure());
            }

            withContactLock(phone, () -> retryOnConflict(leadId,
                    () -> leadService.completeTurn(leadId, text, generation)));
            log.debug("[lead={}] message processed tokens={} latencyMs={}",
                    leadId, generation.getTokensTotal(), generation.getLatencyMs());
            return ScreeningResult.success(leadId, phone, generation);
        } catch (ScreeningException ex) {
            log.error("[phone={}] screening failed code={} message={}", phone, ex.code(), ex.getMessage());
            return ScreeningResult.failure(ex.code(), ex.getMessage());
        } catch (DataAccessException ex) {
            log.error("[phone={}] storage failure while processing message", phone, ex);
            return ScreeningResult.failure(ScreeningErrorCode.PERSISTENCE_ERROR, "Storage failure");
        }
    }

    /**
     * Classifies the lead's region and moves it to AWAITING_RESPONSE (eligible) or NOT_ELIGIBLE.
     */
    public EligibilityResult validateEligibility(UUID leadId) {
        try {
            Lead lead = leadService.get(leadId);
            if (StringUtils.isBlank(lead.getRegion())) {
                return EligibilityResult.failure(ScreeningErrorCode.REGION_MISSING, "Region not provided");
            }
            String region = lead.getRegion();
            boolean eligible = regionalValidator.classify(region) == RegionalValidator.Classification.ELIGIBLE;

            withContactLock(lead.getPhone(), () -> retryOnConflict(leadId,
                    () -> leadService.applyEligibility(leadId, eligible)));
            log.info("[lead={}] eligibility checked region={} eligible={}", leadId, region, eligible);
            return EligibilityResult.success(leadId, eligible, regionalValidator.describe(region));
        } catch (ScreeningException ex) {
            log.warn("[lead={}] eligibility check failed code={} message={}", leadId, ex.code(), ex.getMessage());
            return EligibilityResult.failure(ex.code(), ex.getMessage());
        } catch (DataAccessException ex) {
            log.error("[lead={}] storage failure during eligibility check", leadId, ex);
            return EligibilityResult.failure(ScreeningErrorCode.PERSISTENCE_ERROR, "Storage failure");
        }
    }

    /**
     * Sets the lead's region code under the contact's lock.
     *
     * @throws ScreeningException LEAD_NOT_FOUND or INVALID_REGION
     */
    public Lead assignRegion(UUID leadId, String regionCode) {
        return lockedWrite(leadId, () -> leadService.assignRegion(leadId, regionCode));
    }

    public Lead markAwaitingResponse(UUID leadId) {
        return lockedWrite(leadId, () -> leadService.markAwaitingResponse(leadId));
    }

    public Lead recordFollowUpAttempt(UUID leadId) {
        return lockedWrite(leadId, () -> leadService.recordFollowUpAttempt(leadId));
    }

    private Lead lockedWrite(UUID leadId, Supplier<Lead> write) {
        String phone = leadService.get(leadId).getPhone();
        return withContactLock(phone, () -> retryOnConflict(leadId, write));
    }

    // A concurrent insert from another node surfaces as a unique-key violation; the retry finds that row.
    private Lead openTurn(String phone) {
        try {
            return leadService.openTurn(phone);
        } catch (DataIntegrityViolationException | OptimisticLockingFailureException ex) {
            log.info("[phone={}] lead changed concurrently, retrying open turn", phone);
            return leadService.openTurn(phone);
        }
    }

    // The contact lock is per process; a version conflict can still come from another node. One retry re-reads the row.
    private <T> T retryOnConflict(UUID leadId, Supplier<T> write) {
        try {
            return write.get();
        } catch (OptimisticLockingFailureException ex) {
            log.info("[lead={}] version conflict, retrying write", leadId);
            return write.get();
        }
    }

    private <T> T withContactLock(String phone, Supplier<T> action) {
        Lock lock = contactLocks.forContact(phone);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
