package com.vitalscan.assessment.service;

import com.vitalscan.assessment.domain.AssessmentReport;
import com.vitalscan.assessment.domain.ParsedVitals;
import com.vitalscan.assessment.domain.PatientAssessment;
import com.vitalscan.assessment.domain.PatientRecord;
import com.vitalscan.assessment.domain.RiskScore;
import com.vitalscan.assessment.parse.VitalsParser;
import com.vitalscan.assessment.scoring.RiskScorer;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Service;

@Service
public class PatientClassifier {

    private final VitalsParser vitalsParser;
    private final RiskScorer riskScorer;

    public PatientClassifier(VitalsParser vitalsParser, RiskScorer riskScorer) {
        this.vitalsParser = vitalsParser;
        this.riskScorer = riskScorer;
    }

    public PatientAssessment assess(PatientRecord record) {
        ParsedVitals vitals = vitalsParser.parse(record);
        RiskScore score = riskScorer.score(vitals);
        return new PatientAssessment(
            record.patientId(),
            vitals,
            score,
            score.isHighRisk(),
            riskScorer.isFever(vitals.temperature()),
            vitals.hasInvalidField()
        );
    }

    public List<PatientAssessment> assessAll(List<PatientRecord> records) {
        return records.stream().map(this::assess).toList();
    }

    public AssessmentReport classify(List<PatientRecord> records) {
        return toReport(assessAll(records));
    }

    public AssessmentReport toReport(List<PatientAssessment> assessments) {
        List<String> highRisk = new ArrayList<>();
        List<String> fever = new ArrayList<>();
        List<String> dataIssues = new ArrayList<>();
        for (PatientAssessment assessment : assessments) {
            if (assessment.dataQualityIssue()) {
                dataIssues.add(assessment.patientId());
            }
            if (assessment.highRisk()) {
                highRisk.add(assessment.patientId());
            }
            if (assessment.fever()) {
                fever.add(assessment.patientId());
            }
        }
        return new AssessmentReport(highRisk, fever, dataIssues);
    }
}
