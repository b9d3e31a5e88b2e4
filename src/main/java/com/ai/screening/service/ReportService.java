package com.ai.screening.service;

import com.ai.screening.entity.Conversation;
import com.ai.screening.entity.Lead;
import com.ai.screening.entity.LeadStatus;
import com.ai.screening.entity.Scheduling;
import com.ai.screening.entity.SchedulingStatus;
import com.ai.screening.exception.ScreeningException;
import com.ai.screening.repository.ConversationRepository;
import com.ai.screening.repository.LeadRepository;
import com.ai.screening.repository.SchedulingRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Read-only aggregates for the admin endpoints.
 */
@Service
@Transactional(readOnly = true)
public class ReportService {

    private final LeadRepository leadRepository;
    private final ConversationRepository conversationRepository;
    private final SchedulingRepository schedulingRepository;
    private final Clock clock;
    private final double costLimitMonthly;

    public ReportService(LeadRepository leadRepository,
                         ConversationRepository conversationRepository,
                         SchedulingRepository schedulingRepository,
                         Clock clock,
                         @Value("${openai.cost-limit-monthly:20.0}") double costLimitMonthly) {
        this.leadRepository = leadRepository;
        this.conversationRepository = conversationRepository;
        this.schedulingRepository = schedulingRepository;
        this.clock = clock;
        this.costLimitMonthly = costLimitMonthly;
    }

    public Map<String, Object> usage() {
        Instant now = clock.instant();

        Map<String, Long> byStatus = new LinkedHashMap<>();
        for (Object[] row : leadRepository.countGroupedByStatus()) {
            byStatus.put(((LeadStatus) row[0]).getCode(), (Long) row[1]);
        }
        Map<String, Object> leads = new LinkedHashMap<>();
        leads.put("total", leadRepository.count());
        leads.put("new_24h", leadRepository.countByCreatedAtGreaterThanEqual(now.minus(Duration.ofHours(24))));
        leads.put("by_status", byStatus);

        double totalCostUsd = nullToZero(conversationRepository.sumCostCents()) / 100.0;
        Map<String, Object> conversations = new LinkedHashMap<>();
        conversations.put("total", conversationRepository.count());
        conversations.put("total_tokens", nullToZero(conversationRepository.sumTokensTotal()));
        conversations.put("total_cost_usd", round(totalCostUsd, 4));
        Double avgLatency = conversationRepository.averageLatencyMs();
        conversations.put("average_latency_ms", round(avgLatency != null ? avgLatency : 0.0, 2));

        Map<String, Object> schedulings = new LinkedHashMap<>();
        schedulings.put("total", schedulingRepository.count());
        schedulings.put("upcoming", schedulingRepository.countByStatusAndMeetingAtAfter(SchedulingStatus.SCHEDULED, now));

        Map<String, Object> limits = new LinkedHashMap<>();
        limits.put("cost_limit_monthly", costLimitMonthly);
        limits.put("cost_current", round(totalCostUsd, 4));
        limits.put("cost_percentage", costLimitMonthly > 0 ? round(totalCostUsd / costLimitMonthly * 100, 1) : 0.0);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", now.toString());
        body.put("leads", leads);
        body.put("conversations", conversations);
        body.put("schedulings", schedulings);
        body.put("limits", limits);
        return body;
    }

    public Page<Lead> leads(LeadStatus status, int page, int size) {
        PageRequest pageable = PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "createdAt"));
        return status == null ? leadRepository.findAll(pageable) : leadRepository.findByStatus(status, pageable);
    }

    public LeadDetail leadDetail(UUID leadId) {
        Lead lead = leadRepository.findById(leadId).orElseThrow(() -> ScreeningException.leadNotFound(leadId));
        return new LeadDetail(lead,
                conversationRepository.findByLead_IdOrderByTimestampAscCreatedAtAsc(leadId),
                schedulingRepository.findByLead_IdOrderByMeetingAtAsc(leadId));
    }

    private static long nullToZero(Long value) {
        return value != null ? value : 0L;
    }

    private static double round(double value, int places) {
        double factor = Math.pow(10, places);
        return Math.round(value * factor) / factor;
    }

    public static final class LeadDetail {
        public final Lead lead;
        public final List<Conversation> conversations;
        public final List<Scheduling> schedulings;

        public LeadDetail(Lead lead, List<Conversation> conversations, List<Scheduling> schedulings) {
            this.lead = lead;
            this.conversations = conversations;
            this.schedulings = schedulings;
        }
    }
}
