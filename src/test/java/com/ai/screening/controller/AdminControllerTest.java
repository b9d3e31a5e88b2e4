package com.ai.screening.controller;

import com.ai.screening.dto.EligibilityResult;
import com.ai.screening.entity.Lead;
import com.ai.screening.entity.LeadStatus;
import com.ai.screening.exception.ScreeningErrorCode;
import com.ai.screening.exception.ScreeningException;
import com.ai.screening.service.LeadScreeningOrchestrator;
import com.ai.screening.service.RegionalValidator;
import com.ai.screening.service.ReportService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class AdminControllerTest {

    private ReportService reportService;
    private LeadScreeningOrchestrator orchestrator;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        reportService = mock(ReportService.class);
        orchestrator = mock(LeadScreeningOrchestrator.class);
        RegionalValidator validator = new RegionalValidator(List.of("RS"), List.of("BA"));
        Clock clock = Clock.fixed(Instant.parse("2026-03-10T12:00:00Z"), ZoneOffset.UTC);
        mvc = MockMvcBuilders
                .standaloneSetup(new AdminController(reportService, orchestrator, validator, clock))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void listsLeadsFilteredByStatusCode() throws Exception {
        Lead lead = Lead.builder().id(UUID.randomUUID()).phone("5511999999999").status(LeadStatus.IN_SCREENING).build();
        when(reportService.leads(eq(LeadStatus.IN_SCREENING), eq(0), eq(20)))
                .thenReturn(new PageImpl<>(List.of(lead), PageRequest.of(0, 20), 1));

        mvc.perform(get("/api/admin/leads").param("status", "em_triagem"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.leads[0].phone").value("5511999999999"))
                .andExpect(jsonPath("$.leads[0].status").value("em_triagem"));
    }

    @Test
    void unknownStatusFilterIsBadRequest() throws Exception {
        mvc.perform(get("/api/admin/leads").param("status", "bogus"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
    }

    @Test
    void unknownLeadIsNotFound() throws Exception {
        UUID id = UUID.randomUUID();
        when(reportService.leadDetail(id)).thenThrow(ScreeningException.leadNotFound(id));

        mvc.perform(get("/api/admin/leads/{id}", id))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("LEAD_NOT_FOUND"));
    }

    @Test
    void invalidRegionIsRejected() throws Exception {
        UUID id = UUID.randomUUID();
        when(orchestrator.assignRegion(eq(id), anyString()))
                .thenThrow(new ScreeningException(ScreeningErrorCode.INVALID_REGION, "Region must be a 2-letter state code"));

        mvc.perform(put("/api/admin/leads/{id}/region", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"region\":\"RSX\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_REGION"));
    }

    @Test
    void eligibilityFailureUsesErrorStatus() throws Exception {
        UUID id = UUID.randomUUID();
        when(orchestrator.validateEligibility(id))
                .thenReturn(EligibilityResult.failure(ScreeningErrorCode.REGION_MISSING, "Region not provided"));

        mvc.perform(post("/api/admin/leads/{id}/eligibility", id))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("REGION_MISSING"));
    }

    @Test
    void regionsAreListed() throws Exception {
        mvc.perform(get("/api/admin/regions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.eligible[0].code").value("RS"))
                .andExpect(jsonPath("$.interest[0].name").value("Nordeste"));
    }
}
