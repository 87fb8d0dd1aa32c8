package com.vitalscan.assessment.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vitalscan.assessment.domain.AssessmentReport;
import com.vitalscan.assessment.domain.PatientAssessment;
import com.vitalscan.assessment.domain.PatientRecord;
import com.vitalscan.assessment.parse.VitalsParser;
import com.vitalscan.assessment.scoring.RiskScorer;
import java.util.List;
import org.junit.jupiter.api.Test;

class PatientClassifierTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final PatientClassifier classifier = new PatientClassifier(new VitalsParser(), new RiskScorer());

    @Test
    void assess_hypertensiveFebrileElderIsHighRisk() throws Exception {
        PatientAssessment a1 = classifier.assess(record("""
            {"patient_id":"A1","blood_pressure":"150/95","temperature":"101.2","age":"70"}
            """));

        assertThat(a1.score().bloodPressure()).isEqualTo(4);
        assertThat(a1.score().temperature()).isEqualTo(2);
        assertThat(a1.score().age()).isEqualTo(2);
        assertThat(a1.score().total()).isEqualTo(8);
        assertThat(a1.highRisk()).isTrue();
        assertThat(a1.fever()).isTrue();
        assertThat(a1.dataQualityIssue()).isFalse();
    }

    @Test
    void assess_unreadableTemperatureIsDataIssueButStillScored() throws Exception {
        PatientAssessment b2 = classifier.assess(record("""
            {"patient_id":"B2","blood_pressure":"120/70","temperature":"abc","age":"50"}
            """));

        assertThat(b2.score().bloodPressure()).isEqualTo(2);
        assertThat(b2.score().temperature()).isZero();
        assertThat(b2.score().age()).isEqualTo(1);
        assertThat(b2.score().total()).isEqualTo(3);
        assertThat(b2.highRisk()).isFalse();
        assertThat(b2.fever()).isFalse();
        assertThat(b2.dataQualityIssue()).isTrue();
    }

    @Test
    void assess_missingBloodPressureIsDataIssue() throws Exception {
        PatientAssessment c3 = classifier.assess(record("""
            {"patient_id":"C3","blood_pressure":null,"temperature":"99.7","age":"30"}
            """));

        assertThat(c3.score().bloodPressure()).isZero();
        assertThat(c3.score().temperature()).isEqualTo(1);
        assertThat(c3.score().age()).isEqualTo(1);
        assertThat(c3.score().total()).isEqualTo(2);
        assertThat(c3.highRisk()).isFalse();
        assertThat(c3.fever()).isTrue();
        assertThat(c3.dataQualityIssue()).isTrue();
    }

    @Test
    void assess_isStableAcrossCalls() throws Exception {
        PatientRecord record = record("""
            {"patient_id":"D4","blood_pressure":"135/","temperature":100.1,"age":67}
            """);

        assertThat(classifier.assess(record)).isEqualTo(classifier.assess(record));
    }

    @Test
    void classify_recordCanLandInSeveralLists() throws Exception {
        List<PatientRecord> records = List.of(
            record("""
                {"patient_id":"A1","blood_pressure":"150/95","temperature":"101.2","age":"70"}
                """),
            record("""
                {"patient_id":"B2","blood_pressure":"120/70","temperature":"abc","age":"50"}
                """),
            record("""
                {"patient_id":"C3","blood_pressure":null,"temperature":"99.7","age":"30"}
                """),
            record("""
                {"patient_id":"E5","blood_pressure":"160/100","temperature":98.2}
                """)
        );

        AssessmentReport report = classifier.classify(records);

        assertThat(report.highRiskPatients()).containsExactly("A1", "E5");
        assertThat(report.feverPatients()).containsExactly("A1", "C3");
        assertThat(report.dataQualityIssues()).containsExactly("B2", "C3", "E5");
    }

    @Test
    void classify_emptyCollectionGivesEmptyReport() {
        assertThat(classifier.classify(List.of())).isEqualTo(AssessmentReport.empty());
    }

    private PatientRecord record(String json) throws Exception {
        JsonNode node = objectMapper.readTree(json);
        return PatientRecord.from(node).orElseThrow();
    }
}
