package com.ai.screening.controller;

import com.ai.screening.dto.ConversationView;
import com.ai.screening.dto.EligibilityResult;
import com.ai.screening.dto.LeadView;
import com.ai.screening.dto.SchedulingView;
import com.ai.screening.entity.Lead;
import com.ai.screening.entity.LeadStatus;
import com.ai.screening.service.LeadScreeningOrchestrator;
import com.ai.screening.service.RegionalValidator;
import com.ai.screening.service.ReportService;
import org.springframework.data.domain.Page;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/admin")
public class AdminController {

    private final ReportService reportService;
    private final LeadScreeningOrchestrator orchestrator;
    private final RegionalValidator regionalValidator;
    private final Clock clock;

    public AdminController(ReportService reportService,
                           LeadScreeningOrchestrator orchestrator,
                           RegionalValidator regionalValidator,
                           Clock clock) {
        this.reportService = reportService;
        this.orchestrator = orchestrator;
        this.regionalValidator = regionalValidator;
        this.clock = clock;
    }

    @GetMapping("/usage")
    public Map<String, Object> usage() {
        return reportService.usage();
    }

    @GetMapping("/leads")
    public Map<String, Object> leads(@RequestParam(required = false) String status,
                                     @RequestParam(defaultValue = "0") int page,
                                     @RequestParam(defaultValue = "20") int size) {
        LeadStatus filter = status == null ? null : parseStatus(status);
        Page<Lead> result = reportService.leads(filter, Math.max(page, 0), Math.min(Math.max(size, 1), 100));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("total", result.getTotalElements());
        body.put("page", result.getNumber());
        body.put("size", result.getSize());
        body.put("leads", result.getContent().stream().map(LeadView::from).collect(Collectors.toList()));
        return body;
    }

    @GetMapping("/leads/{leadId}")
    public Map<String, Object> leadDetail(@PathVariable UUID leadId) {
        ReportService.LeadDetail detail = reportService.leadDetail(leadId);
        Instant now = clock.instant();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("lead", LeadView.from(detail.lead));
        body.put("conversations", detail.conversations.stream().map(ConversationView::from).collect(Collectors.toList()));
        body.put("schedulings", detail.schedulings.stream().map(s -> SchedulingView.from(s, now)).collect(Collectors.toList()));
        return body;
    }

    @PutMapping("/leads/{leadId}/region")
    public LeadView assignRegion(@PathVariable UUID leadId, @RequestBody Map<String, String> request) {
        return LeadView.from(orchestrator.assignRegion(leadId, request.get("region")));
    }

    @PostMapping("/leads/{leadId}/eligibility")
    public ResponseEntity<EligibilityResult> eligibility(@PathVariable UUID leadId) {
        EligibilityResult result = orchestrator.validateEligibility(leadId);
        if (!result.isSuccess()) {
            return ResponseEntity.status(result.getError().status()).body(result);
        }
        return ResponseEntity.ok(result);
    }

    @GetMapping("/regions")
    public Map<String, Object> regions() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("eligible", regionalValidator.eligibleRegionsList());
        body.put("interest", regionalValidator.interestRegionsList());
        return body;
    }

    private static LeadStatus parseStatus(String status) {
        String value = status.trim();
        for (LeadStatus s : LeadStatus.values()) {
            if (s.name().equalsIgnoreCase(value) || s.getCode().equals(value.toLowerCase(Locale.ROOT))) {
                return s;
            }
        }
        throw new IllegalArgumentException("Invalid status: " + status);
    }
}
