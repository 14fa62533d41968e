package com.xammer.tagops.controller;

import com.xammer.tagops.domain.Workflow;
import com.xammer.tagops.domain.WorkflowDetails;
import com.xammer.tagops.domain.WorkflowStatus;
import com.xammer.tagops.domain.WorkflowType;
import com.xammer.tagops.exception.ConnectorException;
import com.xammer.tagops.exception.InvalidStateException;
import com.xammer.tagops.exception.NotFoundException;
import com.xammer.tagops.service.RemediationWorkflowService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(WorkflowController.class)
class WorkflowControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RemediationWorkflowService workflowService;

    @Test
    void exemptionRequestIsRoutedToRequestExemption() throws Exception {
        Workflow workflow = workflow(1L, WorkflowType.EXEMPTION, WorkflowStatus.PENDING);
        when(workflowService.requestExemption("vm-1", "legacy", "bob")).thenReturn(workflow);

        mockMvc.perform(post("/api/tagops/workflows")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"resource_id\":\"vm-1\",\"workflow_type\":\"EXEMPTION\",\"reason\":\"legacy\",\"created_by\":\"bob\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.workflowType").value("EXEMPTION"))
                .andExpect(jsonPath("$.status").value("PENDING"));
    }

    @Test
    void remediationRequestIsRoutedToPropose() throws Exception {
        when(workflowService.propose(eq("vm-1"), any(), anyMap(), eq("alice")))
                .thenReturn(workflow(2L, WorkflowType.REMEDIATION, WorkflowStatus.PENDING));

        mockMvc.perform(post("/api/tagops/workflows")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"resource_id\":\"vm-1\",\"workflow_type\":\"REMEDIATION\","
                                + "\"suggested_tags\":{\"Owner\":\"\"},\"created_by\":\"alice\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(2));
    }

    @Test
    void missingWorkflowTypeIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/tagops/workflows")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"resource_id\":\"vm-1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("workflow_type is required"));
    }

    @Test
    void approvePassesTagsAndApprover() throws Exception {
        when(workflowService.approve(eq(5L), anyMap(), eq("carol")))
                .thenReturn(workflow(5L, WorkflowType.REMEDIATION, WorkflowStatus.COMPLETED));

        mockMvc.perform(post("/api/tagops/workflows/5/approve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"approved_tags\":{\"Owner\":\"alice\"},\"approved_by\":\"carol\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED"));

        verify(workflowService).approve(5L, Map.of("Owner", "alice"), "carol");
    }

    @Test
    void serviceErrorsMapToStatusCodes() throws Exception {
        when(workflowService.get(404L)).thenThrow(new NotFoundException("Workflow not found: 404"));
        when(workflowService.reject(eq(6L), any(), any())).thenThrow(new InvalidStateException("Workflow 6 is COMPLETED"));
        when(workflowService.approve(eq(7L), anyMap(), any())).thenThrow(new ConnectorException("aws connector did not apply tags"));

        mockMvc.perform(get("/api/tagops/workflows/404"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Workflow not found: 404"));
        mockMvc.perform(post("/api/tagops/workflows/6/reject")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"no\",\"decided_by\":\"dave\"}"))
                .andExpect(status().isConflict());
        mockMvc.perform(post("/api/tagops/workflows/7/approve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"approved_tags\":{\"Owner\":\"x\"},\"approved_by\":\"carol\"}"))
                .andExpect(status().isBadGateway());
    }

    @Test
    void grantWithoutBodyUsesNoApprover() throws Exception {
        when(workflowService.grantExemption(eq(8L), isNull()))
                .thenReturn(workflow(8L, WorkflowType.EXEMPTION, WorkflowStatus.COMPLETED));

        mockMvc.perform(post("/api/tagops/workflows/8/exemption/grant"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED"));
    }

    @Test
    void unknownStatusFilterIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/tagops/workflows").param("status", "DONE"))
                .andExpect(status().isBadRequest());
    }

    private static Workflow workflow(Long id, WorkflowType type, WorkflowStatus status) {
        Workflow workflow = new Workflow("vm-1", type, new WorkflowDetails(), "bob");
        workflow.setId(id);
        workflow.setStatus(status);
        return workflow;
    }
}
