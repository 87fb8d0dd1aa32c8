package com.vitalscan.assessment.domain;

public record PatientAssessment(
    String patientId,
    ParsedVitals vitals,
    RiskScore score,
    boolean highRisk,
    boolean fever,
    boolean dataQualityIssue
) {
}
