package com.traffic.anomaly.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.traffic.anomaly.exception.DuplicateRuleException;
import com.traffic.anomaly.exception.RuleNotFoundException;
import com.traffic.anomaly.exception.RuleValidationException;
import com.traffic.anomaly.model.PromQLRule;
import com.traffic.anomaly.service.RuleService;
import com.traffic.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(RuleController.class)
class RuleControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private RuleService ruleService;

    @Test
    void listRules_success() throws Exception {
        when(ruleService.getAllRules()).thenReturn(List.of(TestDataFactory.createRule("r1", 100.0, ">")));

        mockMvc.perform(get("/api/v1/rules"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray())
                .andExpect(jsonPath("$[0].name").value("r1"))
                .andExpect(jsonPath("$[0].comparison").value(">"));
    }

    @Test
    void getRule_found() throws Exception {
        when(ruleService.getRule("r1")).thenReturn(TestDataFactory.createRule("r1", 100.0, ">"));

        mockMvc.perform(get("/api/v1/rules/r1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("r1"))
                .andExpect(jsonPath("$.threshold").value(100.0));
    }

    @Test
    void getRule_notFound() throws Exception {
        when(ruleService.getRule("missing")).thenThrow(new RuleNotFoundException("missing"));

        mockMvc.perform(get("/api/v1/rules/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.rule").value("missing"));
    }

    @Test
    void createRule_created() throws Exception {
        PromQLRule rule = TestDataFactory.createRule("r-new", 5.0, ">=");
        when(ruleService.createRule(any(PromQLRule.class))).thenReturn(rule);

        mockMvc.perform(post("/api/v1/rules")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(rule)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.name").value("r-new"));
    }

    @Test
    void createRule_invalidIsBadRequest() throws Exception {
        PromQLRule rule = TestDataFactory.createRule("r-bad", 5.0, "BAD");
        when(ruleService.createRule(any(PromQLRule.class)))
                .thenThrow(new RuleValidationException("r-bad", "Unsupported comparison 'BAD'"));

        mockMvc.perform(post("/api/v1/rules")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(rule)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Unsupported comparison 'BAD'"));
    }

    @Test
    void createRule_duplicateIsConflict() throws Exception {
        PromQLRule rule = TestDataFactory.createRule("r1", 5.0, ">");
        when(ruleService.createRule(any(PromQLRule.class))).thenThrow(new DuplicateRuleException("r1"));

        mockMvc.perform(post("/api/v1/rules")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(rule)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.rule").value("r1"));
    }

    @Test
    void updateRule_success() throws Exception {
        PromQLRule rule = TestDataFactory.createRule("r1", 9.0, "<");
        when(ruleService.updateRule(eq("r1"), any(PromQLRule.class))).thenReturn(rule);

        mockMvc.perform(put("/api/v1/rules/r1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(rule)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.threshold").value(9.0));
    }

    @Test
    void updateRule_notFound() throws Exception {
        when(ruleService.updateRule(eq("missing"), any(PromQLRule.class)))
                .thenThrow(new RuleNotFoundException("missing"));

        mockMvc.perform(put("/api/v1/rules/missing")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(TestDataFactory.createRule("missing", 1.0, ">"))))
                .andExpect(status().isNotFound());
    }

    @Test
    void deleteRule_noContent() throws Exception {
        mockMvc.perform(delete("/api/v1/rules/r1"))
                .andExpect(status().isNoContent());

        verify(ruleService).deleteRule("r1");
    }

    @Test
    void deleteRule_notFound() throws Exception {
        doThrow(new RuleNotFoundException("missing")).when(ruleService).deleteRule("missing");

        mockMvc.perform(delete("/api/v1/rules/missing"))
                .andExpect(status().isNotFound());
    }

    @Test
    void validateRule_reportsValidity() throws Exception {
        when(ruleService.isValid(any(PromQLRule.class))).thenReturn(false);

        mockMvc.perform(post("/api/v1/rules/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(TestDataFactory.createRule("r", 1.0, "=>"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(false));
    }
}
