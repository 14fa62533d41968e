package com.xammer.tagops.controller;

import com.xammer.tagops.domain.CloudProvider;
import com.xammer.tagops.domain.CloudResource;
import com.xammer.tagops.dto.ComplianceSummaryDto;
import com.xammer.tagops.dto.EvaluationSummary;
import com.xammer.tagops.exception.ValidationException;
import com.xammer.tagops.service.ComplianceService;
import com.xammer.tagops.service.ScanOrchestrator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ComplianceController.class)
class ComplianceControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ScanOrchestrator scanOrchestrator;

    @MockBean
    private ComplianceService complianceService;

    @Test
    void scanOfOneProviderReportsCount() throws Exception {
        when(scanOrchestrator.scan(Optional.of(CloudProvider.AZURE))).thenReturn(List.of(
                new CloudResource("/subscriptions/s/vm-1", "vm-1", "vm", CloudProvider.AZURE, "westeurope")));

        mockMvc.perform(post("/api/tagops/compliance/scan").param("provider", "azure"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.provider").value("azure"))
                .andExpect(jsonPath("$.resources_scanned").value(1));
    }

    @Test
    void scanOfUnconfiguredProviderIsBadRequest() throws Exception {
        when(scanOrchestrator.scan(Optional.of(CloudProvider.GCP)))
                .thenThrow(new ValidationException("No connector configured for provider gcp"));

        mockMvc.perform(post("/api/tagops/compliance/scan").param("provider", "gcp"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void evaluateReturnsSummary() throws Exception {
        when(complianceService.evaluateAll()).thenReturn(EvaluationSummary.builder()
                .total(4).compliant(3).nonCompliant(1).complianceRate(75.0).workflowsProposed(1).build());

        mockMvc.perform(post("/api/tagops/compliance/evaluate"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.compliance_rate").value(75.0))
                .andExpect(jsonPath("$.workflows_proposed").value(1));
    }

    @Test
    void statusReturnsCounts() throws Exception {
        when(complianceService.summary()).thenReturn(new ComplianceSummaryDto(5, 2, 1, 1, 1, 66.67));

        mockMvc.perform(get("/api/tagops/compliance/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_resources").value(5))
                .andExpect(jsonPath("$.unknown").value(1));
    }
}
