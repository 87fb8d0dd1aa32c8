package com.vitalscan.assessment.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * The payload posted to {@code /submit-assessment}. Lists keep record order and are copied on
 * construction.
 */
public record AssessmentReport(
    @JsonProperty("high_risk_patients") List<String> highRiskPatients,
    @JsonProperty("fever_patients") List<String> feverPatients,
    @JsonProperty("data_quality_issues") List<String> dataQualityIssues
) {

    public AssessmentReport {
        highRiskPatients = List.copyOf(highRiskPatients);
        feverPatients = List.copyOf(feverPatients);
        dataQualityIssues = List.copyOf(dataQualityIssues);
    }

    public static AssessmentReport empty() {
        return new AssessmentReport(List.of(), List.of(), List.of());
    }
}
