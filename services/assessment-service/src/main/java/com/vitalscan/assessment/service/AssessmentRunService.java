package com.vitalscan.assessment.service;

import com.vitalscan.assessment.client.ReportSubmitter;
import com.vitalscan.assessment.config.AssessmentProperties;
import com.vitalscan.assessment.domain.AssessmentReport;
import com.vitalscan.assessment.domain.AssessmentRunView;
import com.vitalscan.assessment.domain.CollectionResult;
import com.vitalscan.assessment.domain.RunStatus;
import com.vitalscan.assessment.domain.SubmissionOutcome;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * One run = collect every page, classify, submit once. Each run builds its own report; finished
 * runs are only kept in memory for lookup.
 */
@Service
public class AssessmentRunService {

    private static final Logger LOGGER = LoggerFactory.getLogger(AssessmentRunService.class);

    private final PatientCollector patientCollector;
    private final PatientClassifier patientClassifier;
    private final ReportSubmitter reportSubmitter;
    private final AssessmentProperties properties;
    private final ConcurrentHashMap<UUID, AssessmentRunView> runs = new ConcurrentHashMap<>();

    public AssessmentRunService(
        PatientCollector patientCollector,
        PatientClassifier patientClassifier,
        ReportSubmitter reportSubmitter,
        AssessmentProperties properties
    ) {
        this.patientCollector = patientCollector;
        this.patientClassifier = patientClassifier;
        this.reportSubmitter = reportSubmitter;
        this.properties = properties;
    }

    public AssessmentRunView runAssessment(Boolean submit) {
        boolean shouldSubmit = submit == null ? properties.isSubmitEnabled() : submit;
        UUID runId = UUID.randomUUID();
        Instant startedAt = Instant.now();
        runs.put(runId, new AssessmentRunView(
            runId, RunStatus.RUNNING, startedAt, null, 0, 0, List.of(), List.of(), null, null, null));

        AssessmentRunView view;
        try {
            CollectionResult collected = patientCollector.collect();
            LOGGER.info("Fetched {} patients", collected.records().size());

            AssessmentReport report = patientClassifier.classify(collected.records());
            LOGGER.info("High risk: {} {}", report.highRiskPatients().size(), report.highRiskPatients());
            LOGGER.info("Fever: {} {}", report.feverPatients().size(), report.feverPatients());
            LOGGER.info("Data quality issues: {} {}", report.dataQualityIssues().size(), report.dataQualityIssues());

            SubmissionOutcome submission = shouldSubmit ? reportSubmitter.submit(report) : SubmissionOutcome.skipped();

            view = new AssessmentRunView(
                runId,
                collected.isComplete() ? RunStatus.COMPLETED : RunStatus.COMPLETED_WITH_LOSSES,
                startedAt,
                Instant.now(),
                collected.records().size(),
                collected.duplicatesDropped(),
                collected.recoveredPages(),
                collected.lostPages(),
                report,
                submission,
                null
            );
        } catch (RuntimeException ex) {
            LOGGER.error("Assessment run {} failed", runId, ex);
            view = new AssessmentRunView(
                runId, RunStatus.FAILED, startedAt, Instant.now(), 0, 0, List.of(), List.of(),
                AssessmentReport.empty(), SubmissionOutcome.skipped(), truncate(ex.getMessage(), 400));
        }
        runs.put(runId, view);
        return view;
    }

    public Optional<AssessmentRunView> getRun(UUID runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    private String truncate(String text, int max) {
        if (text == null || text.isBlank()) {
            return "unknown";
        }
        return text.length() <= max ? text : text.substring(0, max);
    }
}
