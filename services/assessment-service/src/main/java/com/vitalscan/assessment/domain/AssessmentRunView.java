package com.vitalscan.assessment.domain;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record AssessmentRunView(
    UUID runId,
    RunStatus status,
    Instant startedAt,
    Instant completedAt,
    int fetchedCount,
    int duplicatesDropped,
    List<Integer> recoveredPages,
    List<Integer> lostPages,
    AssessmentReport report,
    SubmissionOutcome submission,
    String error
) {
}
