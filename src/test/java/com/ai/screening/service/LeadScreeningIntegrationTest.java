package com.ai.screening.service;

import com.ai.screening.dto.ChatTurn;
import com.ai.screening.dto.EligibilityResult;
import com.ai.screening.dto.GenerationResult;
import com.ai.screening.dto.ScreeningResult;
import com.ai.screening.entity.Conversation;
import com.ai.screening.entity.Lead;
import com.ai.screening.entity.LeadStatus;
import com.ai.screening.exception.ScreeningErrorCode;
import com.ai.screening.repository.ConversationRepository;
import com.ai.screening.repository.LeadRepository;
import com.ai.screening.repository.SchedulingRepository;
import org.apache.commons.lang3.StringUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@SpringBootTest
@ActiveProfiles("test")
@ExtendWith(OutputCaptureExtension.class)
class LeadScreeningIntegrationTest {

    @Autowired
    private LeadScreeningOrchestrator orchestrator;

    @Autowired
    private LeadService leadService;

    @Autowired
    private ConversationHistoryService historyService;

    @Autowired
    private ReportService reportService;

    @Autowired
    private LeadRepository leadRepository;

    @Autowired
    private ConversationRepository conversationRepository;

    @Autowired
    private SchedulingRepository schedulingRepository;

    @MockBean
    private ResponseGenerator responseGenerator;

    @BeforeEach
    void setUp() {
        conversationRepository.deleteAll();
        schedulingRepository.deleteAll();
        leadRepository.deleteAll();
        when(responseGenerator.generate(anyString(), anyList(), anyString()))
                .thenReturn(GenerationResult.success("Olá! De qual cidade você fala?", 120, 30, 150, 0.000036, 0, 900L));
    }

    @Test
    void eligibleLeadFromRioGrandeDoSulAwaitsResponse() {
        ScreeningResult first = orchestrator.receiveMessage("5551999999999", "Olá! Quero abrir franquia em Porto Alegre");

        assertTrue(first.isSuccess());
        assertEquals("5551999999999", first.getPhone());
        assertEquals(150, first.getTokensTotal());
        Lead lead = leadRepository.findByPhone("5551999999999").orElseThrow();
        assertEquals(LeadStatus.IN_SCREENING, lead.getStatus());
        assertNull(lead.getEligible());

        orchestrator.assignRegion(lead.getId(), "rs");
        EligibilityResult eligibility = orchestrator.validateEligibility(lead.getId());

        assertTrue(eligibility.isSuccess());
        assertTrue(eligibility.getEligible());
        Lead updated = leadRepository.findById(lead.getId()).orElseThrow();
        assertEquals(LeadStatus.AWAITING_RESPONSE, updated.getStatus());
        assertEquals(Boolean.TRUE, updated.getEligible());
        assertEquals("RS", updated.getRegion());
    }

    @Test
    void leadFromBahiaIsNotEligible() {
        ScreeningResult first = orchestrator.receiveMessage("5575999999999@s.whatsapp.net", "Sou da Bahia");
        orchestrator.assignRegion(first.getLeadId(), "BA");

        EligibilityResult eligibility = orchestrator.validateEligibility(first.getLeadId());

        assertTrue(eligibility.isSuccess());
        assertFalse(eligibility.getEligible());
        Lead lead = leadRepository.findById(first.getLeadId()).orElseThrow();
        assertEquals(LeadStatus.NOT_ELIGIBLE, lead.getStatus());
        assertEquals(Boolean.FALSE, lead.getEligible());
    }

    @Test
    void eligibilityIsIdempotentInEffect() {
        ScreeningResult first = orchestrator.receiveMessage("5511988887777", "oi");
        orchestrator.assignRegion(first.getLeadId(), "SP");

        orchestrator.validateEligibility(first.getLeadId());
        orchestrator.validateEligibility(first.getLeadId());

        assertEquals(LeadStatus.AWAITING_RESPONSE, leadRepository.findById(first.getLeadId()).orElseThrow().getStatus());
    }

    @Test
    void generationTimeoutKeepsLeadInScreeningWithoutConversation() {
        when(responseGenerator.generate(anyString(), anyList(), anyString()))
                .thenReturn(GenerationResult.failure(GenerationResult.Failure.TIMEOUT, "timed out"));

        ScreeningResult result = orchestrator.receiveMessage("5521999999999@s.whatsapp.net", "Olá, tudo bem?");

        assertFalse(result.isSuccess());
        assertEquals(ScreeningErrorCode.GENERATION_FAILED, result.getError());
        Lead lead = leadRepository.findByPhone("5521999999999").orElseThrow();
        assertEquals(LeadStatus.IN_SCREENING, lead.getStatus());
        assertNull(lead.getNextFollowUpAt());
        assertEquals(0, conversationRepository.count());
    }

    @Test
    void invalidContactPersistsNothing() {
        ScreeningResult result = orchestrator.receiveMessage("0000000000@s.whatsapp.net", "oi");

        assertEquals(ScreeningErrorCode.INVALID_CONTACT, result.getError());
        assertEquals(0, leadRepository.count());
        assertEquals(0, conversationRepository.count());
    }

    @Test
    void messageWhileAwaitingResponseArmsFollowUpTwoHoursOut() {
        ScreeningResult first = orchestrator.receiveMessage("5548999990000", "oi");
        assertNull(leadRepository.findById(first.getLeadId()).orElseThrow().getNextFollowUpAt());
        orchestrator.assignRegion(first.getLeadId(), "SC");
        orchestrator.validateEligibility(first.getLeadId());

        Instant before = Instant.now();
        orchestrator.receiveMessage("5548999990000", "Pode ser amanhã às 14h");
        Instant after = Instant.now();

        Lead lead = leadRepository.findById(first.getLeadId()).orElseThrow();
        assertEquals(LeadStatus.AWAITING_RESPONSE, lead.getStatus());
        assertEquals(0, lead.getFollowUpAttempts());
        Instant due = lead.getNextFollowUpAt();
        assertNotNull(due);
        assertFalse(due.isBefore(before.plus(Duration.ofHours(2)).minusSeconds(1)));
        assertFalse(due.isAfter(after.plus(Duration.ofHours(2)).plusSeconds(1)));
    }

    @Test
    void historyKeepsTenMostRecentExchangesInOrder() {
        Lead lead = leadRepository.save(Lead.builder().phone("5511900001111").status(LeadStatus.IN_SCREENING).build());
        Instant base = Instant.parse("2026-01-01T10:00:00Z");
        for (int i = 0; i < 15; i++) {
            conversationRepository.save(Conversation.builder()
                    .lead(lead)
                    .inboundText("in" + i)
                    .outboundText("out" + i)
                    .timestamp(base.plusSeconds(i * 60L))
                    .build());
        }

        List<ChatTurn> history = historyService.buildHistory(lead.getId());

        assertEquals(20, history.size());
        assertEquals(ChatTurn.user("in5"), history.get(0));
        assertEquals(ChatTurn.assistant("out5"), history.get(1));
        assertEquals(ChatTurn.user("in14"), history.get(18));
        assertEquals(ChatTurn.assistant("out14"), history.get(19));
        for (int i = 0; i < history.size(); i++) {
            assertEquals(i % 2 == 0 ? ChatTurn.USER : ChatTurn.ASSISTANT, history.get(i).getRole());
        }
    }

    @Test
    void concurrentDeliveriesFromSameContactCreateOneLead() throws Exception {
        int deliveries = 8;
        ExecutorService pool = Executors.newFixedThreadPool(deliveries);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ScreeningResult>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < deliveries; i++) {
                String text = "mensagem " + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    return orchestrator.receiveMessage("5511977776666@s.whatsapp.net", text);
                }));
            }
            start.countDown();
            for (Future<ScreeningResult> f : futures) {
                assertTrue(f.get(30, TimeUnit.SECONDS).isSuccess());
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, leadRepository.count());
        Lead lead = leadRepository.findByPhone("5511977776666").orElseThrow();
        assertEquals(LeadStatus.IN_SCREENING, lead.getStatus());
        assertEquals(deliveries, conversationRepository.countByLead_Id(lead.getId()));
    }

    @Test
    void conversationStoresUsageAndLeavesMissingFieldsUnset() {
        when(responseGenerator.generate(anyString(), anyList(), anyString()))
                .thenReturn(GenerationResult.success("ok", null, null, 42, null, null, 300L));

        ScreeningResult result = orchestrator.receiveMessage("5511966665555", "oi");

        Conversation stored = conversationRepository.findByLead_IdOrderByTimestampAscCreatedAtAsc(result.getLeadId()).get(0);
        assertEquals("oi", stored.getInboundText());
        assertEquals("ok", stored.getOutboundText());
        assertEquals(42, stored.getTokensTotal());
        assertNull(stored.getTokensInput());
        assertNull(stored.getCostCents());
        assertEquals(300L, stored.getLatencyMs());
    }

    @Test
    void followUpSweepSupport() {
        ScreeningResult first = orchestrator.receiveMessage("5511955554444", "oi");
        Lead armed = orchestrator.markAwaitingResponse(first.getLeadId());

        assertEquals(LeadStatus.AWAITING_RESPONSE, armed.getStatus());
        assertTrue(leadService.findDueForFollowUp(Instant.now()).isEmpty());
        List<Lead> due = leadService.findDueForFollowUp(Instant.now().plus(Duration.ofHours(3)));
        assertEquals(1, due.size());

        Lead attempted = orchestrator.recordFollowUpAttempt(first.getLeadId());
        assertEquals(1, attempted.getFollowUpAttempts());
        assertNotNull(attempted.getLastFollowUpAt());
    }

    @Test
    @SuppressWarnings("unchecked")
    void usageReportCountsLeadsAndConversations() {
        orchestrator.receiveMessage("5511944443333", "oi");
        orchestrator.receiveMessage("5511944443333", "tudo bem?");

        Map<String, Object> usage = reportService.usage();

        Map<String, Object> leads = (Map<String, Object>) usage.get("leads");
        Map<String, Object> conversations = (Map<String, Object>) usage.get("conversations");
        assertEquals(1L, leads.get("total"));
        assertEquals(Map.of("em_triagem", 1L), leads.get("by_status"));
        assertEquals(2L, conversations.get("total"));
        assertEquals(300L, conversations.get("total_tokens"));
    }

    @Test
    void everyTransitionIsLoggedWithLeadIdAndBothStates(CapturedOutput output) {
        ScreeningResult first = orchestrator.receiveMessage("5511933330000", "oi");
        UUID id = first.getLeadId();
        orchestrator.assignRegion(id, "RS");

        orchestrator.validateEligibility(id);
        orchestrator.validateEligibility(id);

        String out = output.getOut();
        assertEquals(1, StringUtils.countMatches(out, "[lead=" + id + "] status NEW -> IN_SCREENING"));
        assertEquals(1, StringUtils.countMatches(out, "[lead=" + id + "] status IN_SCREENING -> AWAITING_RESPONSE"));
        assertEquals(1, StringUtils.countMatches(out, "[lead=" + id + "] status AWAITING_RESPONSE -> AWAITING_RESPONSE"));
    }

    @Test
    void adminWritesRacingInboundMessagesLoseNothing() throws Exception {
        String contact = "5511933332222@s.whatsapp.net";
        UUID id = orchestrator.receiveMessage(contact, "oi").getLeadId();
        int rounds = 60;
        AtomicInteger adminFailures = new AtomicInteger();
        List<ScreeningResult> results = new CopyOnWriteArrayList<>();
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (int i = 0; i < rounds; i++) {
                CountDownLatch start = new CountDownLatch(1);
                boolean regionRound = i % 2 == 0;
                Future<?> inbound = pool.submit(() -> {
                    start.await();
                    results.add(orchestrator.receiveMessage(contact, "msg"));
                    return null;
                });
                Future<?> admin = pool.submit(() -> {
                    start.await();
                    try {
                        if (regionRound) {
                            orchestrator.assignRegion(id, "SP");
                        } else {
                            orchestrator.markAwaitingResponse(id);
                        }
                    } catch (RuntimeException ex) {
                        adminFailures.incrementAndGet();
                    }
                    return null;
                });
                start.countDown();
                inbound.get(30, TimeUnit.SECONDS);
                admin.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(0, adminFailures.get());
        assertEquals(rounds, results.size());
        for (ScreeningResult r : results) {
            assertTrue(r.isSuccess(), () -> "inbound message failed: " + r.getError());
        }
        assertEquals(rounds + 1, conversationRepository.countByLead_Id(id));
        Lead lead = leadRepository.findById(id).orElseThrow();
        assertEquals(LeadStatus.AWAITING_RESPONSE, lead.getStatus());
        assertEquals("SP", lead.getRegion());
    }

    @Test
    void conversationsWithEqualTimestampsKeepInsertionOrder() {
        Lead lead = leadRepository.save(Lead.builder().phone("5511900002222").status(LeadStatus.IN_SCREENING).build());
        Instant same = Instant.parse("2026-01-01T10:00:00Z");
        for (int i = 0; i < 5; i++) {
            conversationRepository.saveAndFlush(Conversation.builder()
                    .lead(lead)
                    .inboundText("in" + i)
                    .outboundText("out" + i)
                    .timestamp(same)
                    .build());
            sleepPastClockTick();
        }

        List<ChatTurn> history = historyService.buildHistory(lead.getId());

        assertEquals(10, history.size());
        for (int i = 0; i < 5; i++) {
            assertEquals(ChatTurn.user("in" + i), history.get(i * 2));
        }
        List<Conversation> ascending = conversationRepository.findByLead_IdOrderByTimestampAscCreatedAtAsc(lead.getId());
        assertEquals("in0", ascending.get(0).getInboundText());
        assertEquals("in4", ascending.get(4).getInboundText());
    }

    private static void sleepPastClockTick() {
        try {
            Thread.sleep(2);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }
}
