package com.ai.screening.service;

import com.ai.screening.dto.ChatTurn;
import com.ai.screening.entity.Conversation;
import com.ai.screening.repository.ConversationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Rebuilds the chat context for a lead from stored conversations.
 * Best effort: a failed read yields an empty history.
 */
@Service
public class ConversationHistoryService {

    private static final Logger log = LoggerFactory.getLogger(ConversationHistoryService.class);

    private final ConversationRepository repository;
    private final int historyLimit;

    public ConversationHistoryService(ConversationRepository repository,
                                      @Value("${screening.history-limit:10}") int historyLimit) {
        this.repository = repository;
        this.historyLimit = historyLimit;
    }

    /**
     * Most recent exchanges, oldest first, as alternating user/assistant turns.
     */
    public List<ChatTurn> buildHistory(UUID leadId) {
        try {
            List<Conversation> newestFirst = new ArrayList<>(
                    repository.findByLead_IdOrderByTimestampDescCreatedAtDesc(leadId, PageRequest.of(0, historyLimit)));
            Collections.reverse(newestFirst);
            List<ChatTurn> turns = new ArrayList<>(newestFirst.size() * 2);
            for (Conversation c : newestFirst) {
                turns.add(ChatTurn.user(c.getInboundText()));
                turns.add(ChatTurn.assistant(c.getOutboundText()));
            }
            return turns;
        } catch (DataAccessException | TransactionException ex) {
            log.warn("[lead={}] history unavailable, continuing without context: {}", leadId, ex.getMessage());
            return Collections.emptyList();
        }
    }
}
