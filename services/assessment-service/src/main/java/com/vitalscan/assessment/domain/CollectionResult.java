package com.vitalscan.assessment.domain;

import java.util.List;

public record CollectionResult(
    List<PatientRecord> records,
    List<Integer> recoveredPages,
    List<Integer> lostPages,
    int duplicatesDropped
) {

    public CollectionResult {
        records = List.copyOf(records);
        recoveredPages = List.copyOf(recoveredPages);
        lostPages = List.copyOf(lostPages);
    }

    public boolean isComplete() {
        return lostPages.isEmpty();
    }
}
