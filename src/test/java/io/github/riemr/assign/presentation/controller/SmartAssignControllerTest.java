package io.github.riemr.assign.presentation.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.riemr.assign.application.dto.AppliedAssignmentsResponse;
import io.github.riemr.assign.application.dto.SmartAssignRequest;
import io.github.riemr.assign.application.dto.SopAssignmentView;
import io.github.riemr.assign.application.service.SmartAssignmentService;
import io.github.riemr.assign.optimization.InvalidAssignmentInputException;
import io.github.riemr.assign.optimization.solution.AssignmentDecision;
import io.github.riemr.assign.optimization.solution.AssignmentReasoning;
import io.github.riemr.assign.optimization.solution.OptimizationMetrics;
import io.github.riemr.assign.optimization.solution.OptimizationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringBootConfiguration;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.util.List;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = SmartAssignController.class)
@AutoConfigureMockMvc(addFilters = false)
class SmartAssignControllerTest {

    @SpringBootConfiguration
    @Import({SmartAssignController.class, GlobalExceptionHandler.class})
    static class TestApplication {}

    @Autowired
    MockMvc mockMvc;

    @Autowired
    ObjectMapper objectMapper;

    @MockBean
    SmartAssignmentService service;

    @BeforeEach
    void setup() {
        Mockito.reset(service);
    }

    @Test
    void recommend_returns400_whenSopIdsMissing() throws Exception {
        mockMvc.perform(get("/api/sop/smart-assign").param("restaurant", "r1").param("sop_ids", " , "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("At least one SOP ID is required"))
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"));
        verifyNoInteractions(service);
    }

    @Test
    void recommend_returnsDecisions_withoutPersisting() throws Exception {
        AssignmentDecision decision = AssignmentDecision.builder()
                .sopId("sop-1")
                .assignedTo("u1")
                .assignmentScore(0.84)
                .reasoning(AssignmentReasoning.builder()
                        .skillMatchScore(1.0).availabilityScore(1.0).workloadScore(0.7).performanceScore(0.6)
                        .overallConfidence(0.84).keyFactors(List.of("Strong skill match")).build())
                .estimatedCompletionMinutes(32)
                .recommendedDueDate(LocalDateTime.of(2026, 1, 18, 9, 0))
                .build();
        when(service.recommend(any())).thenReturn(new OptimizationResult(List.of(decision),
                new OptimizationMetrics(0.84, 1.0, 1.0, 0.84, 1.0), List.of(), List.of()));

        mockMvc.perform(get("/api/sop/smart-assign")
                        .param("restaurant", "r1")
                        .param("sop_ids", "sop-1, sop-2")
                        .param("priority", "urgent"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.assignments[0].assignedTo").value("u1"))
                .andExpect(jsonPath("$.assignments[0].reasoning.keyFactors[0]").value("Strong skill match"))
                .andExpect(jsonPath("$.metrics.totalScore").value(0.84));

        ArgumentCaptor<SmartAssignRequest> captor = ArgumentCaptor.forClass(SmartAssignRequest.class);
        verify(service).recommend(captor.capture());
        assertThat(captor.getValue().getSopIds()).containsExactly("sop-1", "sop-2");
        assertThat(captor.getValue().getPriority()).isEqualTo("urgent");
        verify(service, never()).createAssignments(any());
    }

    @Test
    void create_returns400_whenSopIdsEmpty() throws Exception {
        var req = new java.util.LinkedHashMap<String, Object>();
        req.put("restaurantId", "r1");
        req.put("sopIds", List.of());

        mockMvc.perform(post("/api/sop/smart-assign")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(req)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("At least one SOP ID is required"))
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"));
    }

    @Test
    void create_returns201_withCreatedAssignments() throws Exception {
        when(service.createAssignments(any())).thenReturn(AppliedAssignmentsResponse.builder()
                .assignments(List.of(SopAssignmentView.builder().id("as-1").sopId("sop-1").assignedTo("u1")
                        .priority("medium").status("pending").build()))
                .optimizationSummary(new OptimizationMetrics(0.8, 0.8, 1.0, 0.8, 1.0))
                .recommendations(List.of())
                .warnings(List.of("1 SOPs could not be assigned optimally"))
                .build());

        var req = new java.util.LinkedHashMap<String, Object>();
        req.put("restaurantId", "r1");
        req.put("sopIds", List.of("sop-1", "sop-2"));
        req.put("criteria", java.util.Map.of("fairnessWeight", 0.5));

        mockMvc.perform(post("/api/sop/smart-assign")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(req)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.assignments[0].id").value("as-1"))
                .andExpect(jsonPath("$.optimizationSummary.workloadBalance").value(1.0))
                .andExpect(jsonPath("$.warnings[0]").value("1 SOPs could not be assigned optimally"));

        ArgumentCaptor<SmartAssignRequest> captor = ArgumentCaptor.forClass(SmartAssignRequest.class);
        verify(service, times(1)).createAssignments(captor.capture());
        assertThat(captor.getValue().getCriteria().getFairnessWeight()).isEqualTo(0.5);
    }

    @Test
    void create_returns400_whenWeightOutOfRange() throws Exception {
        var req = new java.util.LinkedHashMap<String, Object>();
        req.put("restaurantId", "r1");
        req.put("sopIds", List.of("sop-1"));
        req.put("criteria", java.util.Map.of("skillWeight", 1.5));

        mockMvc.perform(post("/api/sop/smart-assign")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(req)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"));
        verifyNoInteractions(service);
    }

    @Test
    void create_returns400_whenScoringWeightsSumAboveOne() throws Exception {
        var req = new java.util.LinkedHashMap<String, Object>();
        req.put("restaurantId", "r1");
        req.put("sopIds", List.of("sop-1"));
        req.put("criteria", java.util.Map.of("skillWeight", 0.5, "availabilityWeight", 0.5, "workloadWeight", 0.5));

        mockMvc.perform(post("/api/sop/smart-assign")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(req)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error")
                        .value("skill, availability, workload and performance weights must not sum to more than 1"))
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"));
        verifyNoInteractions(service);
    }

    @Test
    void create_returns400_whenRequesterIsNotUuid() throws Exception {
        var req = new java.util.LinkedHashMap<String, Object>();
        req.put("restaurantId", "r1");
        req.put("sopIds", List.of("sop-1"));
        req.put("requestedBy", "alice");

        mockMvc.perform(post("/api/sop/smart-assign")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(req)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("requestedBy must be a UUID"))
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"));
        verifyNoInteractions(service);
    }

    @Test
    void create_acceptsUuidRequester() throws Exception {
        when(service.createAssignments(any())).thenReturn(AppliedAssignmentsResponse.builder()
                .assignments(List.of())
                .optimizationSummary(new OptimizationMetrics(0, 0, 0, 0, 0))
                .recommendations(List.of())
                .warnings(List.of())
                .build());

        var req = new java.util.LinkedHashMap<String, Object>();
        req.put("restaurantId", "r1");
        req.put("sopIds", List.of("sop-1"));
        req.put("requestedBy", "5F0C6C1E-3B1A-4C55-9D8E-2A7B1C9E4F10");

        mockMvc.perform(post("/api/sop/smart-assign")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(req)))
                .andExpect(status().isCreated());

        ArgumentCaptor<SmartAssignRequest> captor = ArgumentCaptor.forClass(SmartAssignRequest.class);
        verify(service).createAssignments(captor.capture());
        assertThat(captor.getValue().getRequestedBy()).isEqualTo("5F0C6C1E-3B1A-4C55-9D8E-2A7B1C9E4F10");
    }

    @Test
    void create_returns422_whenNoStaffAvailable() throws Exception {
        when(service.createAssignments(any()))
                .thenThrow(new InvalidAssignmentInputException("No available staff found for assignment"));

        var req = new java.util.LinkedHashMap<String, Object>();
        req.put("restaurantId", "r1");
        req.put("sopIds", List.of("sop-1"));

        mockMvc.perform(post("/api/sop/smart-assign")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(req)))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("No available staff found for assignment"))
                .andExpect(jsonPath("$.errorCode").value("INVALID_INPUT"));
    }

    @Test
    void create_returns500_whenPersistenceFails() throws Exception {
        when(service.createAssignments(any()))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        var req = new java.util.LinkedHashMap<String, Object>();
        req.put("restaurantId", "r1");
        req.put("sopIds", List.of("sop-1"));

        mockMvc.perform(post("/api/sop/smart-assign")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(req)))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.errorCode").value("OPTIMIZATION_ERROR"))
                .andExpect(jsonPath("$.rootCause").value("DataAccessResourceFailureException"));
    }

    @Test
    void reoptimize_returns404_whenNothingToOptimize() throws Exception {
        when(service.reoptimize(any())).thenThrow(new NoSuchElementException("No optimizable assignments found"));

        var req = new java.util.LinkedHashMap<String, Object>();
        req.put("restaurantId", "r1");
        req.put("assignmentIds", List.of("as-1"));

        mockMvc.perform(put("/api/sop/smart-assign/optimize")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(req)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("NOT_FOUND"));
    }

    @Test
    void reoptimize_returns400_whenAssignmentIdsMissing() throws Exception {
        var req = new java.util.LinkedHashMap<String, Object>();
        req.put("restaurantId", "r1");

        mockMvc.perform(put("/api/sop/smart-assign/optimize")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(req)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("At least one assignment ID is required"));
        verifyNoInteractions(service);
    }

    @Test
    void reoptimize_returns400_whenRequesterIsNotUuid() throws Exception {
        var req = new java.util.LinkedHashMap<String, Object>();
        req.put("restaurantId", "r1");
        req.put("assignmentIds", List.of("as-1"));
        req.put("requestedBy", "alice");

        mockMvc.perform(put("/api/sop/smart-assign/optimize")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(req)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("requestedBy must be a UUID"))
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"));
        verifyNoInteractions(service);
    }
}
