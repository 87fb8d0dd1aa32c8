package com.vitalscan.assessment.controller;

import com.vitalscan.assessment.domain.AssessmentReport;
import com.vitalscan.assessment.domain.ParsedVitals;
import com.vitalscan.assessment.domain.PatientAssessment;
import com.vitalscan.assessment.domain.RiskScore;
import java.util.List;

public record ClassifyResponse(AssessmentReport report, List<PatientBreakdown> patients, int skipped) {

    public record PatientBreakdown(
        String patientId,
        Integer systolic,
        Integer diastolic,
        Double temperature,
        Integer age,
        int bloodPressureScore,
        int temperatureScore,
        int ageScore,
        int totalScore,
        boolean highRisk,
        boolean fever,
        boolean dataQualityIssue
    ) {
        public static PatientBreakdown from(PatientAssessment assessment) {
            ParsedVitals vitals = assessment.vitals();
            RiskScore score = assessment.score();
            return new PatientBreakdown(
                assessment.patientId(),
                vitals.systolic().isPresent() ? vitals.systolic().getAsInt() : null,
                vitals.diastolic().isPresent() ? vitals.diastolic().getAsInt() : null,
                vitals.temperature().isPresent() ? vitals.temperature().getAsDouble() : null,
                vitals.age().isPresent() ? vitals.age().getAsInt() : null,
                score.bloodPressure(),
                score.temperature(),
                score.age(),
                score.total(),
                assessment.highRisk(),
                assessment.fever(),
                assessment.dataQualityIssue()
            );
        }
    }
}
