package com.xammer.tagops.controller;

import com.xammer.tagops.domain.Policy;
import com.xammer.tagops.domain.TagRule;
import com.xammer.tagops.dto.PolicyRequest;
import com.xammer.tagops.service.PolicyService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(PolicyController.class)
class PolicyControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PolicyService policyService;

    @Test
    void createReadsSnakeCaseRules() throws Exception {
        Policy saved = new Policy();
        saved.setId(1L);
        saved.setName("prod");
        when(policyService.create(any())).thenReturn(saved);

        mockMvc.perform(post("/api/tagops/policies")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"prod\",\"required_tags\":[{\"name\":\"Env\",\"allowed_values\":[\"prod\"]}],"
                                + "\"cloud_providers\":[\"AWS\"]}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(1));

        ArgumentCaptor<PolicyRequest> captor = ArgumentCaptor.forClass(PolicyRequest.class);
        verify(policyService).create(captor.capture());
        TagRule rule = captor.getValue().getRequiredTags().get(0);
        assertThat(rule.isRequired()).isTrue();
        assertThat(rule.getAllowedValues()).containsExactly("prod");
        assertThat(captor.getValue().getCloudProviders()).extracting(Enum::name).containsExactly("AWS");
    }

    @Test
    void malformedRuleIsBadRequestWithItsMessage() throws Exception {
        mockMvc.perform(post("/api/tagops/policies")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"prod\",\"required_tags\":[{\"name\":\"Env\",\"allowed_values\":[]}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("allowed_values for tag 'Env' must be a non-empty list"));
        verifyNoInteractions(policyService);
    }

    @Test
    void listPassesPaging() throws Exception {
        when(policyService.list(true, 0, 5)).thenReturn(List.of());

        mockMvc.perform(get("/api/tagops/policies").param("activeOnly", "true").param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());
    }

    @Test
    void deleteReturnsNoContent() throws Exception {
        mockMvc.perform(delete("/api/tagops/policies/3"))
                .andExpect(status().isNoContent());
        verify(policyService).delete(3L);
    }
}
