package com.vitalscan.assessment.controller;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.vitalscan.assessment.domain.AssessmentReport;
import com.vitalscan.assessment.domain.AssessmentRunView;
import com.vitalscan.assessment.domain.RunStatus;
import com.vitalscan.assessment.domain.SubmissionOutcome;
import com.vitalscan.assessment.parse.VitalsParser;
import com.vitalscan.assessment.scoring.RiskScorer;
import com.vitalscan.assessment.service.AssessmentRunService;
import com.vitalscan.assessment.service.PatientClassifier;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class AssessmentControllerTest {

    private AssessmentRunService runService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        runService = mock(AssessmentRunService.class);
        PatientClassifier classifier = new PatientClassifier(new VitalsParser(), new RiskScorer());
        mockMvc = MockMvcBuilders.standaloneSetup(new AssessmentController(runService, classifier))
            .setControllerAdvice(new ApiExceptionHandler())
            .build();
    }

    @Test
    void run_returnsRunId() throws Exception {
        AssessmentRunView view = view(UUID.randomUUID());
        when(runService.runAssessment(false)).thenReturn(view);

        mockMvc.perform(post("/v1/assessments/run")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"submit\":false}"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.runId").value(view.runId().toString()));
    }

    @Test
    void getRun_unknownIdIsBadRequest() throws Exception {
        UUID runId = UUID.randomUUID();
        when(runService.getRun(runId)).thenReturn(Optional.empty());

        mockMvc.perform(get("/v1/assessments/runs/{runId}", runId))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("bad_request"));
    }

    @Test
    void getRun_returnsStoredRun() throws Exception {
        AssessmentRunView view = view(UUID.randomUUID());
        when(runService.getRun(view.runId())).thenReturn(Optional.of(view));

        mockMvc.perform(get("/v1/assessments/runs/{runId}", view.runId()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("COMPLETED"))
            .andExpect(jsonPath("$.report.high_risk_patients[0]").value("A1"));
    }

    @Test
    void classify_scoresPostedRecordsAndSkipsThoseWithoutId() throws Exception {
        mockMvc.perform(post("/v1/assessments/classify")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"records":[
                      {"patient_id":"A1","blood_pressure":"150/95","temperature":"101.2","age":"70"},
                      {"patient_id":"C3","blood_pressure":null,"temperature":"99.7","age":"30"},
                      {"blood_pressure":"120/80"}
                    ]}
                    """))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.skipped").value(1))
            .andExpect(jsonPath("$.patients", hasSize(2)))
            .andExpect(jsonPath("$.patients[0].totalScore").value(8))
            .andExpect(jsonPath("$.patients[1].dataQualityIssue").value(true))
            .andExpect(jsonPath("$.report.high_risk_patients[0]").value("A1"))
            .andExpect(jsonPath("$.report.fever_patients", hasSize(2)))
            .andExpect(jsonPath("$.report.data_quality_issues[0]").value("C3"));
    }

    @Test
    void classify_emptyRecordsFailsValidation() throws Exception {
        mockMvc.perform(post("/v1/assessments/classify")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"records\":[]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("validation_error"));
    }

    private static AssessmentRunView view(UUID runId) {
        return new AssessmentRunView(
            runId, RunStatus.COMPLETED, Instant.parse("2026-01-01T00:00:00Z"), Instant.parse("2026-01-01T00:01:00Z"),
            1, 0, List.of(), List.of(),
            new AssessmentReport(List.of("A1"), List.of("A1"), List.of()),
            SubmissionOutcome.submitted(200, "{}"), null);
    }
}
