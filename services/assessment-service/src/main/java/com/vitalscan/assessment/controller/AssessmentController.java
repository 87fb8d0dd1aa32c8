package com.vitalscan.assessment.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.vitalscan.assessment.domain.AssessmentRunView;
import com.vitalscan.assessment.domain.PatientAssessment;
import com.vitalscan.assessment.domain.PatientRecord;
import com.vitalscan.assessment.service.AssessmentRunService;
import com.vitalscan.assessment.service.PatientClassifier;
import jakarta.validation.Valid;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/assessments")
public class AssessmentController {

    private final AssessmentRunService assessmentRunService;
    private final PatientClassifier patientClassifier;

    public AssessmentController(AssessmentRunService assessmentRunService, PatientClassifier patientClassifier) {
        this.assessmentRunService = assessmentRunService;
        this.patientClassifier = patientClassifier;
    }

    @PostMapping("/run")
    public ResponseEntity<Map<String, Object>> run(@RequestBody(required = false) AssessmentRunRequest request) {
        Boolean submit = request == null ? null : request.submit();
        AssessmentRunView view = assessmentRunService.runAssessment(submit);
        return ResponseEntity.accepted().body(Map.of("runId", view.runId()));
    }

    @GetMapping("/runs/{runId}")
    public AssessmentRunView getRun(@PathVariable UUID runId) {
        return assessmentRunService.getRun(runId)
            .orElseThrow(() -> new IllegalArgumentException("Run not found: " + runId));
    }

    @PostMapping("/classify")
    public ClassifyResponse classify(@Valid @RequestBody ClassifyRequest request) {
        List<PatientRecord> records = new ArrayList<>();
        for (JsonNode node : request.records()) {
            PatientRecord.from(node).ifPresent(records::add);
        }
        List<PatientAssessment> assessments = patientClassifier.assessAll(records);
        return new ClassifyResponse(
            patientClassifier.toReport(assessments),
            assessments.stream().map(ClassifyResponse.PatientBreakdown::from).toList(),
            request.records().size() - records.size()
        );
    }
}
