package com.vitalscan.assessment.client;

import com.vitalscan.assessment.domain.PatientRecord;
import java.util.List;

public record PageFetchResult(
    int page,
    boolean success,
    List<PatientRecord> records,
    Boolean hasNext,
    int attempts,
    String failureReason
) {

    public PageFetchResult {
        records = List.copyOf(records);
    }

    public static PageFetchResult success(int page, List<PatientRecord> records, Boolean hasNext, int attempts) {
        return new PageFetchResult(page, true, records, hasNext, attempts, null);
    }

    public static PageFetchResult failure(int page, int attempts, String reason) {
        return new PageFetchResult(page, false, List.of(), null, attempts, reason);
    }

    public boolean isLastPage() {
        return Boolean.FALSE.equals(hasNext);
    }
}
